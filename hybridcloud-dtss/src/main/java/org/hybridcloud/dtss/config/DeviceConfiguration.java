package org.hybridcloud.dtss.config;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The devices of the simulated cloud, in the order jobs see them.
 * Serialized from the {@code quantumDevices} and {@code computeDevices} keys of the configuration.
 */
public final class DeviceConfiguration {
  /**
   * A quantum device instantiated from a catalog preset.
   */
  public static final class QuantumDeviceConfig {
    @SerializedName("preset")
    private String preset;

    // Defaults to the preset name
    @SerializedName("name")
    private String name;

    @SerializedName("maintenance")
    private boolean maintenance = false;

    private QuantumDeviceConfig() {
    }

    @VisibleForTesting
    public static QuantumDeviceConfig of(final String preset, final String name, final boolean maintenance) {
      final QuantumDeviceConfig config = new QuantumDeviceConfig();
      config.preset = preset;
      config.name = name;
      config.maintenance = maintenance;
      return config;
    }

    public String getPreset() {
      return preset;
    }

    public String getName() {
      return name == null ? preset : name;
    }

    public boolean isMaintenance() {
      return maintenance;
    }
  }

  /**
   * A classical device with its CPU and memory bandwidth capacities.
   */
  public static final class ComputeDeviceConfig {
    @SerializedName("name")
    private String name;

    @SerializedName("cpuCapacity")
    private int cpuCapacity = 100;

    @SerializedName("memBwCapacity")
    private int memBwCapacity = 200;

    private ComputeDeviceConfig() {
    }

    @VisibleForTesting
    public static ComputeDeviceConfig of(final String name, final int cpuCapacity, final int memBwCapacity) {
      final ComputeDeviceConfig config = new ComputeDeviceConfig();
      config.name = name;
      config.cpuCapacity = cpuCapacity;
      config.memBwCapacity = memBwCapacity;
      return config;
    }

    public String getName() {
      return name;
    }

    public int getCpuCapacity() {
      return cpuCapacity;
    }

    public int getMemBwCapacity() {
      return memBwCapacity;
    }
  }

  private final List<QuantumDeviceConfig> quantumDevices;
  private final List<ComputeDeviceConfig> computeDevices;

  public DeviceConfiguration(final List<QuantumDeviceConfig> quantumDevices,
                             final List<ComputeDeviceConfig> computeDevices) {
    this.quantumDevices = quantumDevices == null
        ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(quantumDevices));
    this.computeDevices = computeDevices == null
        ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(computeDevices));
  }

  public List<QuantumDeviceConfig> getQuantumDevices() {
    return quantumDevices;
  }

  public List<ComputeDeviceConfig> getComputeDevices() {
    return computeDevices;
  }
}
