package org.hybridcloud.dtss.time;

import java.util.function.Consumer;

/**
 * One occurrence of a periodic task. The {@link SimulatedClock} queues the next
 * occurrence, under the same periodic alarm ID, each time this one fires.
 */
public final class PeriodicClientAlarm extends Alarm {
  private final long periodicAlarmId;
  private final double period;
  private final Consumer<PeriodicClientAlarm> handler;

  public PeriodicClientAlarm(final long periodicAlarmId,
                             final long sequenceId,
                             final double period,
                             final double alarmTime,
                             final Consumer<PeriodicClientAlarm> handler) {
    super(sequenceId, alarmTime);
    this.periodicAlarmId = periodicAlarmId;
    this.period = period;
    this.handler = handler;
  }

  @Override
  public void handleAlarm() {
    handler.accept(this);
  }

  public long getPeriodicAlarmId() {
    return periodicAlarmId;
  }

  public double getPeriod() {
    return period;
  }

  Consumer<PeriodicClientAlarm> getHandler() {
    return handler;
  }
}
