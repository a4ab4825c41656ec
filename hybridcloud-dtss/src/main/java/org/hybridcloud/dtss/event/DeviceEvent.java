package org.hybridcloud.dtss.event;

import org.apache.commons.math3.util.Precision;

import java.text.MessageFormat;

/**
 * Payload of a device notification. The timestamp is rounded to 2 decimals.
 */
public final class DeviceEvent {
  private final String deviceName;
  private final int jobId;
  private final double timestamp;

  public DeviceEvent(final String deviceName, final int jobId, final double timestamp) {
    this.deviceName = deviceName;
    this.jobId = jobId;
    this.timestamp = Precision.round(timestamp, 2);
  }

  public String getDeviceName() {
    return deviceName;
  }

  public int getJobId() {
    return jobId;
  }

  public double getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return MessageFormat.format("'{'device={0}, job={1}, time={2}'}'", deviceName, jobId, timestamp);
  }
}
