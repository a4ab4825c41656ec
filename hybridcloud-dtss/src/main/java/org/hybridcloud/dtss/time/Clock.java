package org.hybridcloud.dtss.time;

import org.hybridcloud.dtss.lifecycle.InitializedLifeCycle;
import org.hybridcloud.dtss.lifecycle.LifeCycleState;

import javax.annotation.Nullable;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * The clock abstract class. Time is a non-negative double in simulation time units.
 */
public abstract class Clock extends InitializedLifeCycle {
  private static final double TICKS_PER_TIME_UNIT = 1_000_000_000D;

  private final MetricsClock metricsClock = new MetricsClock();

  /**
   * Schedules a periodic alarm on the clock, following an initial delay.
   * @param initialDelay the delay before the first occurrence
   * @param period the task period
   * @param handler the handler of the alarm event
   * @return an ID of the scheduled task
   */
  public abstract long schedulePeriodicAlarm(
      double initialDelay, double period, Consumer<PeriodicClientAlarm> handler);

  /**
   * Schedules a periodic alarm on the clock, first firing one period from now.
   * @param period the task period
   * @param handler the handler of the alarm event
   * @return an ID of the scheduled task
   */
  public abstract long schedulePeriodicAlarm(double period, Consumer<PeriodicClientAlarm> handler);

  /**
   * Unschedules the periodic task provided the schedule ID.
   * @param periodicAlarmId the ID of the scheduled periodic task
   */
  public abstract void unschedulePeriodicAlarm(long periodicAlarmId);

  /**
   * Schedules an alarm that fires {@code delay} from now.
   * @param delay the offset from current time, must not be negative
   * @param alarmHandler the handler for the alarm
   * @return the ID of the alarm
   */
  public abstract long scheduleAlarm(double delay, Consumer<Alarm> alarmHandler);

  /**
   * Schedules an alarm that fires at {@code alarmTime}.
   * @param alarmTime the alarm time, must not be in the past
   * @param alarmHandler the handler for the alarm
   * @return the ID of the alarm
   */
  public abstract long scheduleAbsoluteAlarm(double alarmTime, Consumer<Alarm> alarmHandler);

  public abstract void cancelAlarm(long alarmId);

  /**
   * Schedules an alarm that triggers the shutdown of the clock after {@code delay}.
   * @param delay the time to shut down the clock
   */
  public abstract void scheduleShutdown(double delay);

  public abstract void scheduleAbsoluteShutdown(double alarmTime);

  /**
   * Advances the clock to the next alarm and fires every alarm due at that time.
   * @return the state of the clock after the alarms fired
   */
  public abstract LifeCycleState pollNextAlarm();

  /**
   * @return the current simulation time
   */
  public abstract double getTime();

  @Nullable
  public abstract Double getScheduledShutdown();

  public abstract OptionalDouble getStopTime();

  /**
   * Suspends the caller for {@code delay} time units.
   * @param delay the delay, must not be negative
   * @return a future completed by the clock once the delay has elapsed
   */
  public CompletableFuture<Void> timeout(final double delay) {
    final CompletableFuture<Void> elapsed = new CompletableFuture<>();
    scheduleAlarm(delay, alarm -> elapsed.complete(null));
    return elapsed;
  }

  public com.codahale.metrics.Clock getMetricsClock() {
    return metricsClock;
  }

  private class MetricsClock extends com.codahale.metrics.Clock {
    private MetricsClock() {
    }

    @Override
    public long getTick() {
      return (long) (Clock.this.getTime() * TICKS_PER_TIME_UNIT);
    }
  }
}
