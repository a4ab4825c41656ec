package org.hybridcloud.dtss.time;

/**
 * Each {@link Alarm} is a pending resumption in the discrete event simulation.
 * An {@link Alarm} is marked by a due time and a sequence ID handed out in submission order.
 * Alarms due at the same time are ordered by their sequence ID, which makes
 * replays deterministic for a fixed random seed.
 */
public abstract class Alarm implements Comparable<Alarm> {
  private final double alarmTime;
  private final long sequenceId;

  protected Alarm(final long sequenceId, final double alarmTime) {
    this.alarmTime = alarmTime;
    this.sequenceId = sequenceId;
  }

  public final long getSequenceId() {
    return sequenceId;
  }

  public final double getTime() {
    return alarmTime;
  }

  public abstract void handleAlarm();

  @Override
  public int compareTo(final Alarm that) {
    final int byTime = Double.compare(this.alarmTime, that.alarmTime);
    if (byTime != 0) {
      return byTime;
    }

    return Long.compare(this.sequenceId, that.sequenceId);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final Alarm alarm = (Alarm) o;
    return sequenceId == alarm.sequenceId && Double.compare(alarmTime, alarm.alarmTime) == 0;
  }

  @Override
  public int hashCode() {
    final long timeBits = Double.doubleToLongBits(alarmTime);
    int result = (int) (timeBits ^ (timeBits >>> 32));
    result = 31 * result + (int) (sequenceId ^ (sequenceId >>> 32));
    return result;
  }
}
