package org.hybridcloud.dtss.time;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.hybridcloud.dtss.exceptions.OperationNotSupportedException;
import org.hybridcloud.dtss.lifecycle.LifeCycleState;

import javax.annotation.Nullable;
import java.text.MessageFormat;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.PriorityQueue;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A discrete, event-driven clock that polls events, or {@link Alarm}s,
 * from a priority queue in time order, then in submission order.
 * Job and device processes suspend by scheduling alarms and are resumed by their handlers.
 * Shuts down when a {@link RuntimeStopAlarm} is encountered,
 * or when there are no more events remaining in the clock.
 */
@Singleton
public final class SimulatedClock extends Clock {
  private static final Logger LOG = Logger.getLogger(SimulatedClock.class.getName());

  private final Map<Long, Consumer<PeriodicClientAlarm>> periodicTasks = new HashMap<>();
  private final PriorityQueue<Alarm> eventQueue = new PriorityQueue<>();

  private long nextSequenceId = 0;
  private Double scheduledShutdown = null;
  private double currTime = 0D;

  @Inject
  public SimulatedClock() {
  }

  private long nextSequenceId() {
    return nextSequenceId++;
  }

  private static void checkDelay(final double delay) {
    if (delay < 0 || Double.isNaN(delay)) {
      throw new IllegalArgumentException("Cannot schedule an alarm with a negative delay: " + delay);
    }
  }

  @Override
  public long schedulePeriodicAlarm(
      final double initialDelay, final double period, final Consumer<PeriodicClientAlarm> handler) {
    checkDelay(initialDelay);
    if (!(period > 0)) {
      throw new IllegalArgumentException("The period of a periodic alarm must be positive: " + period);
    }

    final long periodicAlarmId = nextSequenceId();
    periodicTasks.put(periodicAlarmId, handler);
    eventQueue.add(new PeriodicClientAlarm(
        periodicAlarmId, nextSequenceId(), period, currTime + initialDelay, handler));
    return periodicAlarmId;
  }

  @Override
  public long schedulePeriodicAlarm(final double period, final Consumer<PeriodicClientAlarm> handler) {
    return schedulePeriodicAlarm(period, period, handler);
  }

  @Override
  public void unschedulePeriodicAlarm(final long periodicAlarmId) {
    periodicTasks.remove(periodicAlarmId);
  }

  @Override
  public long scheduleAlarm(final double delay, final Consumer<Alarm> alarmHandler) {
    checkDelay(delay);
    final long alarmId = nextSequenceId();
    eventQueue.add(new ClientAlarm(alarmId, currTime + delay, alarmHandler));
    return alarmId;
  }

  @Override
  public long scheduleAbsoluteAlarm(final double alarmTime, final Consumer<Alarm> alarmHandler) {
    if (alarmTime < currTime) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Cannot schedule an alarm at {0}, the clock is already at {1}.", alarmTime, currTime));
    }

    final long alarmId = nextSequenceId();
    eventQueue.add(new ClientAlarm(alarmId, alarmTime, alarmHandler));
    return alarmId;
  }

  @Override
  public void cancelAlarm(final long alarmId) {
    eventQueue.removeIf(alarm -> alarm.getSequenceId() == alarmId);
  }

  @Override
  public void scheduleShutdown(final double delay) {
    checkDelay(delay);
    scheduleAbsoluteShutdown(currTime + delay);
  }

  @Override
  public void scheduleAbsoluteShutdown(final double alarmTime) {
    if (alarmTime < currTime) {
      throw new IllegalArgumentException("Cannot schedule a shutdown in the past: " + alarmTime);
    }

    LOG.log(Level.INFO, "Shutdown scheduled at " + alarmTime);
    if (scheduledShutdown == null || alarmTime < scheduledShutdown) {
      scheduledShutdown = alarmTime;
    }

    eventQueue.add(new RuntimeStopAlarm(nextSequenceId(), alarmTime));
  }

  @Override
  @Nullable
  public Double getScheduledShutdown() {
    return scheduledShutdown;
  }

  @Override
  public OptionalDouble getStopTime() {
    if (lifeCycleState.isDone()) {
      return OptionalDouble.of(currTime);
    }

    return OptionalDouble.empty();
  }

  @Override
  public double getTime() {
    return currTime;
  }

  /**
   * @return the number of alarms waiting in the queue, including periodic occurrences
   */
  public int getPendingAlarmCount() {
    return eventQueue.size();
  }

  /**
   * Polls for the next event in the priority queue,
   * then fires every other event due at the same time.
   * @return The current state of the simulation
   */
  @Override
  public LifeCycleState pollNextAlarm() {
    if (lifeCycleState.isDone()) {
      throw new OperationNotSupportedException(MessageFormat.format(
          "Clock cannot handle more alarms after entering {0} state!", lifeCycleState));
    }

    if (lifeCycleState != LifeCycleState.STARTED) {
      start();
    }

    if (eventQueue.isEmpty()) {
      LOG.log(Level.INFO, "Simulation clock has no more events! Shutting down...");
      scheduleShutdown(0);
    }

    LifeCycleState setState = handleAlarm(eventQueue.poll());

    // Trigger all other events that occur at the current time.
    while (!eventQueue.isEmpty() && eventQueue.peek().getTime() == currTime) {
      final LifeCycleState newState = handleAlarm(eventQueue.poll());
      if (newState.isDone()) {
        setState = newState;
      }
    }

    lifeCycleState = lifeCycleState.transition(setState);
    return lifeCycleState;
  }

  /**
   * Runs the simulation until there are no more alarms or a shutdown alarm fires.
   * @return the final state of the clock
   */
  public LifeCycleState run() {
    while (!lifeCycleState.isDone()) {
      pollNextAlarm();
    }

    return lifeCycleState;
  }

  /**
   * Runs the simulation until {@code until}, or earlier if the alarms run out.
   * @param until the time at which the clock stops
   * @return the final state of the clock
   */
  public LifeCycleState runUntil(final double until) {
    scheduleAbsoluteShutdown(until);
    return run();
  }

  /**
   * Handles the {@link Alarm} based on its type.
   * A {@link RuntimeStopAlarm} ends the simulation,
   * a {@link PeriodicClientAlarm} queues its next occurrence before firing.
   */
  private LifeCycleState handleAlarm(final Alarm alarm) {
    if (alarm.getTime() < currTime) {
      LOG.log(Level.WARNING, MessageFormat.format(
          "Alarm went backward in time! Alarm time: [{0}], current time: [{1}]. Ignoring the alarm!",
          alarm.getTime(), currTime));
      return lifeCycleState;
    }

    if (alarm instanceof PeriodicClientAlarm
        && !periodicTasks.containsKey(((PeriodicClientAlarm) alarm).getPeriodicAlarmId())) {
      // Unscheduled already, time does not move
      return lifeCycleState;
    }

    currTime = alarm.getTime();

    if (alarm instanceof RuntimeStopAlarm) {
      LOG.log(Level.INFO, () -> "Simulation clock received a RuntimeStopAlarm at " + currTime);
      return LifeCycleState.STOPPED;
    }

    if (alarm instanceof PeriodicClientAlarm) {
      final PeriodicClientAlarm periodicAlarm = (PeriodicClientAlarm) alarm;
      eventQueue.add(new PeriodicClientAlarm(
          periodicAlarm.getPeriodicAlarmId(),
          nextSequenceId(),
          periodicAlarm.getPeriod(),
          currTime + periodicAlarm.getPeriod(),
          periodicAlarm.getHandler()));
    }

    alarm.handleAlarm();
    return lifeCycleState;
  }

  @Override
  public void start() {
    LOG.log(Level.INFO, MessageFormat.format("Simulation clock starting at {0}!", currTime));
    super.start();
  }

  @Override
  public void stop() {
    LOG.log(Level.INFO, MessageFormat.format("Simulation clock stopped at {0}!", currTime));
    super.stop();
  }
}
