package org.hybridcloud.dtss.time;

/**
 * Signals that the simulation should stop once it is polled.
 */
public final class RuntimeStopAlarm extends Alarm {
  public RuntimeStopAlarm(final long sequenceId, final double alarmTime) {
    super(sequenceId, alarmTime);
  }

  @Override
  public void handleAlarm() {
    // Handled by the clock itself
  }
}
