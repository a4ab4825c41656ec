package org.hybridcloud.dtss.device;

/**
 * The kinds of devices in the hybrid cloud.
 */
public enum DeviceType {
  QPU,
  CPU
}
