package org.hybridcloud.dtss.event;

/**
 * Device lifecycle notifications published on the {@link DeviceEventBus}.
 */
public enum EventType {
  DEVICE_START("device_start"),
  DEVICE_FINISH("device_finish");

  private final String eventName;

  EventType(final String eventName) {
    this.eventName = eventName;
  }

  public String getEventName() {
    return eventName;
  }
}
