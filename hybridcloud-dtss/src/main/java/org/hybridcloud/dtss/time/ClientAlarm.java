package org.hybridcloud.dtss.time;

import java.util.function.Consumer;

/**
 * A one-shot {@link Alarm} scheduled on the {@link SimulatedClock}.
 */
public final class ClientAlarm extends Alarm {
  private final Consumer<Alarm> handler;

  public ClientAlarm(final long sequenceId, final double alarmTime, final Consumer<Alarm> handler) {
    super(sequenceId, alarmTime);
    this.handler = handler;
  }

  @Override
  public void handleAlarm() {
    handler.accept(this);
  }
}
