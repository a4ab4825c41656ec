package org.hybridcloud.dtss.metrics.job;

import org.hybridcloud.dtss.exceptions.StateException;

import javax.annotation.Nullable;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * The events recorded for one job, by event name, in recording order.
 * An event recorded more than once, e.g. once per iteration, keeps every value.
 */
public final class JobRecord {
  private final int jobId;
  private final Map<String, List<Object>> events = new LinkedHashMap<>();

  private JobEndState endState = JobEndState.NOT_ARRIVED;

  JobRecord(final int jobId) {
    this.jobId = jobId;
  }

  void log(final String event, final Object value) {
    events.computeIfAbsent(event, e -> new ArrayList<>()).add(value);
  }

  void setEndState(final JobEndState endState) {
    if (this.endState == JobEndState.COMPLETED || this.endState == JobEndState.FAILED) {
      throw new StateException(MessageFormat.format(
          "Job {0} already ended as {1}, cannot move to {2}.", jobId, this.endState, endState));
    }

    this.endState = endState;
  }

  public int getJobId() {
    return jobId;
  }

  public JobEndState getEndState() {
    return endState;
  }

  public boolean has(final String event) {
    return events.containsKey(event);
  }

  public List<Object> getAll(final String event) {
    final List<Object> values = events.get(event);
    return values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
  }

  @Nullable
  public Object getFirst(final String event) {
    final List<Object> values = events.get(event);
    return values == null ? null : values.get(0);
  }

  @Nullable
  public Object getLast(final String event) {
    final List<Object> values = events.get(event);
    return values == null ? null : values.get(values.size() - 1);
  }

  public OptionalDouble getFirstTime(final String event) {
    return asTime(getFirst(event));
  }

  public OptionalDouble getLastTime(final String event) {
    return asTime(getLast(event));
  }

  private static OptionalDouble asTime(@Nullable final Object value) {
    if (value instanceof Number) {
      return OptionalDouble.of(((Number) value).doubleValue());
    }

    return OptionalDouble.empty();
  }

  /**
   * @return the record as event name to value, a single value as a scalar and
   * repeated values as a list
   */
  public Map<String, Object> asMap() {
    final Map<String, Object> view = new LinkedHashMap<>();
    for (final Map.Entry<String, List<Object>> entry : events.entrySet()) {
      final List<Object> values = entry.getValue();
      view.put(entry.getKey(),
          values.size() == 1 ? values.get(0) : Collections.unmodifiableList(new ArrayList<>(values)));
    }

    return Collections.unmodifiableMap(view);
  }

  @Override
  public String toString() {
    return MessageFormat.format("Job {0} [{1}]: {2}", jobId, endState, asMap());
  }
}
