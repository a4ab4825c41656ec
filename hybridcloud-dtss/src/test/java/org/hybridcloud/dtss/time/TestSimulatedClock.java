package org.hybridcloud.dtss.time;

import org.apache.commons.math3.util.Precision;
import org.hybridcloud.dtss.exceptions.OperationNotSupportedException;
import org.hybridcloud.dtss.lifecycle.LifeCycleState;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public class TestSimulatedClock {
  private SimulatedClock clock;

  @Before
  public void setup() {
    clock = new SimulatedClock();
  }

  @Test
  public void testAlarmsFireInTimeThenSubmissionOrder() {
    final List<String> fired = new ArrayList<>();
    clock.scheduleAlarm(5, alarm -> fired.add("late"));
    clock.scheduleAlarm(1, alarm -> fired.add("first"));
    clock.scheduleAlarm(1, alarm -> fired.add("second"));
    clock.scheduleAbsoluteAlarm(3, alarm -> fired.add("middle"));

    Assert.assertEquals(LifeCycleState.STOPPED, clock.run());
    Assert.assertEquals(Arrays.asList("first", "second", "middle", "late"), fired);
    Assert.assertTrue(Precision.equals(5D, clock.getTime()));
  }

  @Test
  public void testEmptyQueueShutsDownTheClock() {
    Assert.assertEquals(LifeCycleState.STOPPED, clock.pollNextAlarm());
    Assert.assertTrue(clock.getStopTime().isPresent());
  }

  @Test(expected = OperationNotSupportedException.class)
  public void testPollingAfterShutdownFails() {
    clock.run();
    clock.pollNextAlarm();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeDelayIsRejected() {
    clock.scheduleAlarm(-1, alarm -> { });
  }

  @Test
  public void testRunUntilStopsAtTheGivenTime() {
    final List<Double> ticks = new ArrayList<>();
    clock.schedulePeriodicAlarm(2, alarm -> ticks.add(clock.getTime()));

    Assert.assertEquals(LifeCycleState.STOPPED, clock.runUntil(7));
    Assert.assertEquals(Arrays.asList(2D, 4D, 6D), ticks);
    Assert.assertTrue(Precision.equals(7D, clock.getTime()));
  }

  @Test
  public void testPeriodicAlarmWithInitialDelayCanBeUnscheduled() {
    final List<Double> ticks = new ArrayList<>();
    clock.schedulePeriodicAlarm(0, 3, alarm -> {
      ticks.add(clock.getTime());
      if (ticks.size() == 3) {
        clock.unschedulePeriodicAlarm(alarm.getPeriodicAlarmId());
      }
    });

    clock.run();
    Assert.assertEquals(Arrays.asList(0D, 3D, 6D), ticks);
  }

  @Test
  public void testUnscheduledPeriodicOccurrenceDoesNotAdvanceTime() {
    final CompletableFuture<Double> found = Poller.pollUntil(clock, 0.5,
        () -> clock.getTime() >= 2 ? clock.getTime() : null);

    // The occurrence queued for 2.5 is dropped without moving the clock
    Assert.assertEquals(LifeCycleState.STOPPED, clock.run());
    Assert.assertTrue(Precision.equals(2D, found.join()));
    Assert.assertTrue(Precision.equals(2D, clock.getStopTime().getAsDouble()));
  }

  @Test
  public void testCancelledAlarmDoesNotFire() {
    final List<String> fired = new ArrayList<>();
    final long alarmId = clock.scheduleAlarm(1, alarm -> fired.add("cancelled"));
    clock.scheduleAlarm(2, alarm -> fired.add("kept"));
    clock.cancelAlarm(alarmId);

    clock.run();
    Assert.assertEquals(Arrays.asList("kept"), fired);
  }

  @Test
  public void testTimeoutCompletesAfterTheDelay() {
    final CompletableFuture<Double> resumedAt = clock.timeout(2.5).thenApply(v -> clock.getTime());
    Assert.assertFalse(resumedAt.isDone());

    clock.run();
    Assert.assertTrue(Precision.equals(2.5, resumedAt.join()));
  }

  @Test
  public void testEarliestShutdownIsKept() {
    clock.scheduleAbsoluteShutdown(10);
    clock.scheduleAbsoluteShutdown(4);
    clock.scheduleAlarm(8, alarm -> Assert.fail("Alarm after the shutdown must not fire."));

    Assert.assertEquals(LifeCycleState.STOPPED, clock.run());
    Assert.assertEquals(Double.valueOf(4), clock.getScheduledShutdown());
    Assert.assertTrue(Precision.equals(4D, clock.getTime()));
  }

  @Test
  public void testPollUntilRetriesOnTheInterval() {
    final int[] probes = {0};
    final CompletableFuture<Double> found = Poller.pollUntil(clock, 0.5, () -> {
      probes[0]++;
      return clock.getTime() >= 2 ? clock.getTime() : null;
    });

    Assert.assertFalse(found.isDone());
    clock.run();
    Assert.assertTrue(Precision.equals(2D, found.join()));
    Assert.assertEquals(5, probes[0]);
  }

  @Test
  public void testPollUntilCompletesImmediatelyWhenTheProbeSucceeds() {
    final CompletableFuture<String> found = Poller.pollUntil(clock, 1, () -> "now");
    Assert.assertTrue(found.isDone());
    Assert.assertEquals(0, clock.getPendingAlarmCount());
  }
}
