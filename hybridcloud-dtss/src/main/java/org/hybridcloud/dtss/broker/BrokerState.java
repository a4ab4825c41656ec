package org.hybridcloud.dtss.broker;

import org.hybridcloud.dtss.exceptions.StateException;

import java.text.MessageFormat;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The states a job goes through under a {@link CapacityAwareBroker}.
 * Every iteration runs a quantum phase then a classical phase.
 */
public enum BrokerState {
  ARRIVED,
  SELECT_QPU,
  QPU_RUN,
  SELECT_CPU,
  CPU_RUN,
  DONE,
  FAILED;

  private static final Map<BrokerState, Set<BrokerState>> ALLOWED = new EnumMap<>(BrokerState.class);

  static {
    ALLOWED.put(ARRIVED, EnumSet.of(SELECT_QPU, FAILED));
    ALLOWED.put(SELECT_QPU, EnumSet.of(QPU_RUN, FAILED));
    ALLOWED.put(QPU_RUN, EnumSet.of(SELECT_CPU, FAILED));
    ALLOWED.put(SELECT_CPU, EnumSet.of(CPU_RUN, FAILED));
    // Back to the quantum phase while iterations remain
    ALLOWED.put(CPU_RUN, EnumSet.of(SELECT_QPU, DONE, FAILED));
    ALLOWED.put(DONE, EnumSet.noneOf(BrokerState.class));
    ALLOWED.put(FAILED, EnumSet.noneOf(BrokerState.class));
  }

  public BrokerState transition(final BrokerState to) {
    if (ALLOWED.get(this).contains(to)) {
      return to;
    }

    throw new StateException(MessageFormat.format("Invalid broker state transition from {0} to {1}.", this, to));
  }

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
