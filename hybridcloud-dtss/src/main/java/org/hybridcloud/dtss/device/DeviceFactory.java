package org.hybridcloud.dtss.device;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.hybridcloud.dtss.config.DeviceConfiguration;
import org.hybridcloud.dtss.event.DeviceEventBus;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.random.RandomSeeder;
import org.hybridcloud.dtss.time.Clock;
import org.hybridcloud.dtss.topology.TopologyAllocator;

import java.text.MessageFormat;

/**
 * Instantiates configured devices against the shared clock, allocator, ledger and event bus.
 */
@Singleton
public final class DeviceFactory {
  private final Clock clock;
  private final DeviceCatalog catalog;
  private final TopologyAllocator allocator;
  private final JobRecordLedger ledger;
  private final DeviceEventBus eventBus;
  private final RandomSeeder randomSeeder;

  @Inject
  public DeviceFactory(final Clock clock,
                       final DeviceCatalog catalog,
                       final TopologyAllocator allocator,
                       final JobRecordLedger ledger,
                       final DeviceEventBus eventBus,
                       final RandomSeeder randomSeeder) {
    this.clock = clock;
    this.catalog = catalog;
    this.allocator = allocator;
    this.ledger = ledger;
    this.eventBus = eventBus;
    this.randomSeeder = randomSeeder;
  }

  public QuantumDevice newQuantumDevice(final DeviceConfiguration.QuantumDeviceConfig config) {
    return newQuantumDevice(config.getName(), catalog.getProfile(config.getPreset()));
  }

  public QuantumDevice newQuantumDevice(final String name, final DeviceProfile profile) {
    return new QuantumDevice(name, profile, clock, allocator, ledger, eventBus);
  }

  public ComputeDevice newComputeDevice(final DeviceConfiguration.ComputeDeviceConfig config) {
    if (config.getName() == null) {
      throw new IllegalArgumentException("Compute devices need a name.");
    }

    if (config.getCpuCapacity() <= 0 || config.getMemBwCapacity() <= 0) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Compute device {0} needs positive capacities, got cpu={1}, memBw={2}.",
          config.getName(), config.getCpuCapacity(), config.getMemBwCapacity()));
    }

    return new ComputeDevice(config.getName(), config.getCpuCapacity(), config.getMemBwCapacity(),
        clock, randomSeeder.newRandomGenerator(), ledger, eventBus);
  }

  /**
   * @throws IllegalArgumentException if the device's model has no maintenance schedule
   */
  public MaintenanceProcess newMaintenanceProcess(final QuantumDevice device) {
    final DeviceProfile profile = device.getProfile();
    if (!profile.hasMaintenanceSchedule()) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Device {0} has maintenance enabled but preset {1} defines no schedule.",
          device.getName(), profile.getName()));
    }

    return new MaintenanceProcess(device, clock, profile.getMaintenanceInterval(),
        profile.getMaintenanceDuration(), randomSeeder.newRandomGenerator());
  }
}
