package org.hybridcloud.dtss.time;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Bounded busy-wait on the simulated clock: try a probe now, and if it yields nothing,
 * retry it every fixed interval on a periodic alarm until it does.
 * Admission latency is quantized to the interval, there is no event-driven wakeup.
 */
public final class Poller {
  private Poller() {
  }

  /**
   * Polls {@code probe} until it returns a non-null value.
   * @param clock the simulation clock
   * @param interval the retry interval
   * @param probe returns null when the condition is not yet met
   * @param <T> the type of the probe result
   * @return a future completed with the first non-null probe result,
   * or exceptionally if the probe throws
   */
  public static <T> CompletableFuture<T> pollUntil(
      final Clock clock, final double interval, final Supplier<T> probe) {
    return pollUntil(clock, interval, probe, () -> { });
  }

  /**
   * Like {@link #pollUntil(Clock, double, Supplier)}, notifying {@code onRetry} every time
   * the probe comes back empty.
   */
  public static <T> CompletableFuture<T> pollUntil(
      final Clock clock, final double interval, final Supplier<T> probe, final Runnable onRetry) {
    final CompletableFuture<T> result = new CompletableFuture<>();
    final T first;
    try {
      first = probe.get();
    } catch (final RuntimeException e) {
      result.completeExceptionally(e);
      return result;
    }

    if (first != null) {
      result.complete(first);
      return result;
    }

    onRetry.run();
    clock.schedulePeriodicAlarm(interval, alarm -> {
      final T value;
      try {
        value = probe.get();
      } catch (final RuntimeException e) {
        clock.unschedulePeriodicAlarm(alarm.getPeriodicAlarmId());
        result.completeExceptionally(e);
        return;
      }

      if (value == null) {
        onRetry.run();
        return;
      }

      clock.unschedulePeriodicAlarm(alarm.getPeriodicAlarmId());
      result.complete(value);
    });

    return result;
  }
}
