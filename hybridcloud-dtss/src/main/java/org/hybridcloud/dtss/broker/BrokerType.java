package org.hybridcloud.dtss.broker;

import java.text.MessageFormat;
import java.util.Arrays;
import java.util.Locale;

/**
 * The scheduling strategies a job can be brokered with.
 */
public enum BrokerType {
  CAPACITY_AWARE("capacity-aware"),
  SERIAL("serial");

  private final String configName;

  BrokerType(final String configName) {
    this.configName = configName;
  }

  public String getConfigName() {
    return configName;
  }

  /**
   * @throws IllegalArgumentException if no broker type has that name
   */
  public static BrokerType fromName(final String name) {
    if (name != null) {
      for (final BrokerType type : values()) {
        if (type.configName.equals(name.toLowerCase(Locale.ROOT))) {
          return type;
        }
      }
    }

    throw new IllegalArgumentException(MessageFormat.format(
        "Invalid broker type {0}, choose from {1}.", name, Arrays.toString(values())));
  }

  @Override
  public String toString() {
    return configName;
  }
}
