package org.hybridcloud.dtss.cloud;

import java.text.MessageFormat;
import java.util.Arrays;
import java.util.Locale;

/**
 * How a job too large for any single QPU is split across devices.
 */
public enum AllocationMode {
  /**
   * Every eligible device takes an even share.
   */
  FAST("fast"),

  /**
   * The fewest lowest-error devices that can hold the job take an even share.
   */
  SMART("smart");

  private final String configName;

  AllocationMode(final String configName) {
    this.configName = configName;
  }

  public String getConfigName() {
    return configName;
  }

  /**
   * @throws IllegalArgumentException if no mode has that name
   */
  public static AllocationMode fromName(final String name) {
    if (name != null) {
      for (final AllocationMode mode : values()) {
        if (mode.configName.equals(name.toLowerCase(Locale.ROOT))) {
          return mode;
        }
      }
    }

    throw new IllegalArgumentException(MessageFormat.format(
        "Invalid allocation mode {0}, choose from {1}.", name, Arrays.toString(values())));
  }

  @Override
  public String toString() {
    return configName;
  }
}
