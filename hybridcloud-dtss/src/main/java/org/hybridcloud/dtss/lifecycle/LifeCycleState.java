package org.hybridcloud.dtss.lifecycle;

import org.hybridcloud.dtss.exceptions.StateException;

import java.text.MessageFormat;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Tracks the life cycle of a simulator component.
 * Used for objects implementing {@link LifeCycle}.
 */
public enum LifeCycleState {
  NOT_INITED,
  INITED,
  STARTED,
  STOPPED,
  FAILED,
  CANCELLED,
  UNKNOWN; // Should not enter this state!

  private static final Map<LifeCycleState, Set<LifeCycleState>> ALLOWED = new EnumMap<>(LifeCycleState.class);

  static {
    ALLOWED.put(NOT_INITED, EnumSet.of(INITED, STOPPED, FAILED, CANCELLED));
    ALLOWED.put(INITED, EnumSet.of(STARTED, STOPPED, FAILED, CANCELLED));
    ALLOWED.put(STARTED, EnumSet.of(STOPPED, FAILED, CANCELLED));
    ALLOWED.put(STOPPED, EnumSet.noneOf(LifeCycleState.class));
    ALLOWED.put(FAILED, EnumSet.noneOf(LifeCycleState.class));
    ALLOWED.put(CANCELLED, EnumSet.noneOf(LifeCycleState.class));
  }

  public LifeCycleState transition(final LifeCycleState to) {
    if (isValidTransition(to)) {
      return to;
    }

    throw new StateException(
        MessageFormat.format("Invalid lifeCycleState transition from {0} to {1}.", this, to));
  }

  public boolean isValidTransition(final LifeCycleState to) {
    if (this == to) {
      return true;
    }

    final Set<LifeCycleState> allowed = ALLOWED.get(this);
    if (allowed == null) {
      throw new StateException(MessageFormat.format("Invalid lifecycle state {0}.", this));
    }

    return allowed.contains(to);
  }

  public boolean isDone() {
    return this == STOPPED || this == FAILED || this == CANCELLED;
  }
}
