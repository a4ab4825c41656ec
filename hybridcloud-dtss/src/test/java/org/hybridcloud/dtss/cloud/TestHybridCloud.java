package org.hybridcloud.dtss.cloud;

import org.hybridcloud.dtss.config.DeviceConfiguration;
import org.hybridcloud.dtss.device.Device;
import org.hybridcloud.dtss.device.DeviceCatalog;
import org.hybridcloud.dtss.device.DeviceFactory;
import org.hybridcloud.dtss.device.DeviceType;
import org.hybridcloud.dtss.event.DeviceEventBus;
import org.hybridcloud.dtss.lifecycle.LifeCycleState;
import org.hybridcloud.dtss.metrics.MetricsConfiguration;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.random.RandomSeeder;
import org.hybridcloud.dtss.time.SimulatedClock;
import org.hybridcloud.dtss.topology.TopologyAllocator;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class TestHybridCloud {
  private SimulatedClock clock;
  private DeviceFactory deviceFactory;

  @Before
  public void setup() {
    clock = new SimulatedClock();
    deviceFactory = new DeviceFactory(clock, new DeviceCatalog(), new TopologyAllocator(),
        new JobRecordLedger(MetricsConfiguration.metricsOff()), new DeviceEventBus(), RandomSeeder.withSeed(1L));
  }

  private HybridCloud newCloud(final List<DeviceConfiguration.QuantumDeviceConfig> quantumDevices,
                               final List<DeviceConfiguration.ComputeDeviceConfig> computeDevices) {
    return new HybridCloud(new DeviceConfiguration(quantumDevices, computeDevices), deviceFactory);
  }

  @Test
  public void testDevicesFollowTheConfiguration() {
    final HybridCloud cloud = newCloud(
        Arrays.asList(
            DeviceConfiguration.QuantumDeviceConfig.of("IBM_guadalupe", "qpu-a", true),
            DeviceConfiguration.QuantumDeviceConfig.of("pentagon", null, false)),
        Collections.singletonList(DeviceConfiguration.ComputeDeviceConfig.of("cpu-0", 64, 128)));
    cloud.init();

    final List<String> names = new ArrayList<>();
    for (final Device device : cloud.getDevices()) {
      names.add(device.getName());
    }
    Assert.assertEquals(Arrays.asList("qpu-a", "pentagon", "cpu-0"), names);
    Assert.assertEquals(DeviceType.QPU, cloud.getDevices().get(0).getType());
    Assert.assertEquals(DeviceType.CPU, cloud.getDevices().get(2).getType());
    Assert.assertEquals(16, cloud.getQuantumDevices().get(0).getQubitCount());
    Assert.assertEquals(1, cloud.getComputeDevices().size());

    // Only the device with maintenance enabled gets a process
    Assert.assertEquals(1, cloud.getMaintenanceProcesses().size());

    cloud.start();
    Assert.assertEquals(LifeCycleState.STARTED, cloud.getState());

    // guadalupe: warm-up of at most 120, then a cycle every 100 lasting 15
    clock.runUntil(400);
    Assert.assertTrue(cloud.getMaintenanceProcesses().get(0).getCompletedCycles() >= 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateNamesAreRejected() {
    newCloud(
        Collections.singletonList(DeviceConfiguration.QuantumDeviceConfig.of("pentagon", "dup", false)),
        Collections.singletonList(DeviceConfiguration.ComputeDeviceConfig.of("dup", 64, 128))).init();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMaintenanceNeedsASchedule() {
    newCloud(
        Collections.singletonList(DeviceConfiguration.QuantumDeviceConfig.of("pentagon", "qpu", true)),
        Collections.emptyList()).init();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testComputeDeviceNeedsPositiveCapacity() {
    newCloud(Collections.emptyList(),
        Collections.singletonList(DeviceConfiguration.ComputeDeviceConfig.of("cpu-0", 0, 128))).init();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownPresetIsRejected() {
    newCloud(
        Collections.singletonList(DeviceConfiguration.QuantumDeviceConfig.of("IBM_nowhere", null, false)),
        Collections.emptyList()).init();
  }
}
