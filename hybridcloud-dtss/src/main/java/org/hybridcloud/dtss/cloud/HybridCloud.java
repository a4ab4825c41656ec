package org.hybridcloud.dtss.cloud;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.hybridcloud.dtss.config.DeviceConfiguration;
import org.hybridcloud.dtss.device.ComputeDevice;
import org.hybridcloud.dtss.device.Device;
import org.hybridcloud.dtss.device.DeviceFactory;
import org.hybridcloud.dtss.device.MaintenanceProcess;
import org.hybridcloud.dtss.device.QuantumDevice;
import org.hybridcloud.dtss.lifecycle.LifeCycle;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The devices of the simulated cloud. Builds them from the configuration on init
 * and starts their maintenance processes on start.
 */
@Singleton
public final class HybridCloud extends LifeCycle {
  private static final Logger LOG = Logger.getLogger(HybridCloud.class.getName());

  private final DeviceConfiguration deviceConfig;
  private final DeviceFactory deviceFactory;

  private final List<QuantumDevice> quantumDevices = new ArrayList<>();
  private final List<ComputeDevice> computeDevices = new ArrayList<>();
  private final List<MaintenanceProcess> maintenanceProcesses = new ArrayList<>();

  @Inject
  public HybridCloud(final DeviceConfiguration deviceConfig, final DeviceFactory deviceFactory) {
    this.deviceConfig = deviceConfig;
    this.deviceFactory = deviceFactory;
  }

  /**
   * Instantiates the configured devices.
   * @throws IllegalArgumentException on an unknown preset or a duplicate device name
   */
  @Override
  public void init() {
    final Set<String> names = new HashSet<>();
    for (final DeviceConfiguration.QuantumDeviceConfig config : deviceConfig.getQuantumDevices()) {
      final QuantumDevice device = deviceFactory.newQuantumDevice(config);
      checkUnique(names, device);
      quantumDevices.add(device);
      if (config.isMaintenance()) {
        maintenanceProcesses.add(deviceFactory.newMaintenanceProcess(device));
      }
    }

    for (final DeviceConfiguration.ComputeDeviceConfig config : deviceConfig.getComputeDevices()) {
      final ComputeDevice device = deviceFactory.newComputeDevice(config);
      checkUnique(names, device);
      computeDevices.add(device);
    }

    if (quantumDevices.isEmpty() || computeDevices.isEmpty()) {
      LOG.log(Level.WARNING, MessageFormat.format(
          "The cloud has {0} quantum and {1} compute devices, jobs of the missing kind will never be admitted.",
          quantumDevices.size(), computeDevices.size()));
    }

    LOG.log(Level.INFO, MessageFormat.format("Hybrid cloud initialized with devices {0}.", getDevices()));
    super.init();
  }

  private static void checkUnique(final Set<String> names, final Device device) {
    if (!names.add(device.getName())) {
      throw new IllegalArgumentException("Duplicate device name " + device.getName());
    }
  }

  @Override
  public void start() {
    super.start();
    for (final MaintenanceProcess process : maintenanceProcesses) {
      process.start();
    }
  }

  /**
   * @return every device, quantum devices first, in configuration order
   */
  public List<Device> getDevices() {
    final List<Device> devices = new ArrayList<>(quantumDevices.size() + computeDevices.size());
    devices.addAll(quantumDevices);
    devices.addAll(computeDevices);
    return Collections.unmodifiableList(devices);
  }

  public List<QuantumDevice> getQuantumDevices() {
    return Collections.unmodifiableList(quantumDevices);
  }

  public List<ComputeDevice> getComputeDevices() {
    return Collections.unmodifiableList(computeDevices);
  }

  public List<MaintenanceProcess> getMaintenanceProcesses() {
    return Collections.unmodifiableList(maintenanceProcesses);
  }
}
