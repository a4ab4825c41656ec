package org.hybridcloud.dtss.config;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import org.hybridcloud.dtss.Runner;
import org.hybridcloud.dtss.broker.BrokerType;
import org.hybridcloud.dtss.cloud.AllocationMode;
import org.hybridcloud.dtss.config.parameters.BrokerStrategy;
import org.hybridcloud.dtss.config.parameters.BulkAllocationMode;
import org.hybridcloud.dtss.config.parameters.DispatcherFilePath;
import org.hybridcloud.dtss.config.parameters.FeedCheckInterval;
import org.hybridcloud.dtss.config.parameters.JobArrivalRate;
import org.hybridcloud.dtss.config.parameters.MaxJobs;
import org.hybridcloud.dtss.config.parameters.RandomSeed;
import org.hybridcloud.dtss.config.parameters.SimulationDuration;
import org.hybridcloud.dtss.feed.DispatcherJobFeed;
import org.hybridcloud.dtss.feed.GeneratorJobFeed;
import org.hybridcloud.dtss.feed.JobFeed;
import org.hybridcloud.dtss.feed.config.GeneratorFeedModule;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.logging.Level;

public class TestSimulatorModule {
  private static SimulatorModule read(final String resource) throws IOException {
    final String path;
    try {
      path = Paths.get(TestSimulatorModule.class.getClassLoader().getResource(resource).toURI()).toString();
    } catch (final URISyntaxException e) {
      throw new IllegalStateException(e);
    }

    return SimulatorModule.newReader().readConfiguration(path);
  }

  private static Injector injectorOf(final SimulatorModule module) {
    return Guice.createInjector(module, Runner.RunnerModule.newModule("test-run"));
  }

  @Test
  public void testDispatcherConfigurationIsBound() throws IOException {
    final SimulatorModule module = read("config/dispatcher-conf.json");
    Assert.assertEquals(Level.FINE, module.getSimulatorLogLevel());

    final Injector injector = injectorOf(module);
    Assert.assertEquals(Long.valueOf(3), injector.getInstance(Key.get(Long.class, RandomSeed.class)));
    Assert.assertNull(injector.getInstance(Key.get(Double.class, SimulationDuration.class)));
    Assert.assertEquals(SimulatorModule.DEFAULT_FEED_CHECK_INTERVAL,
        injector.getInstance(Key.get(Double.class, FeedCheckInterval.class)), 0D);
    Assert.assertEquals(BrokerType.SERIAL, injector.getInstance(Key.get(BrokerType.class, BrokerStrategy.class)));
    Assert.assertEquals(AllocationMode.FAST,
        injector.getInstance(Key.get(AllocationMode.class, BulkAllocationMode.class)));
    Assert.assertEquals("jobs.csv", injector.getInstance(Key.get(String.class, DispatcherFilePath.class)));

    final DeviceConfiguration devices = injector.getInstance(DeviceConfiguration.class);
    Assert.assertEquals(2, devices.getQuantumDevices().size());
    Assert.assertEquals("qpu-0", devices.getQuantumDevices().get(0).getName());
    Assert.assertTrue(devices.getQuantumDevices().get(0).isMaintenance());

    // The name defaults to the preset
    Assert.assertEquals("IBM_Fez", devices.getQuantumDevices().get(1).getName());
    Assert.assertFalse(devices.getQuantumDevices().get(1).isMaintenance());

    final DeviceConfiguration.ComputeDeviceConfig cpu = devices.getComputeDevices().get(0);
    Assert.assertEquals(32, cpu.getCpuCapacity());
    Assert.assertEquals(200, cpu.getMemBwCapacity());
  }

  @Test
  public void testGeneratorConfigurationIsBound() throws IOException {
    final Injector injector = injectorOf(read("config/generator-conf.json"));

    Assert.assertEquals(120D, injector.getInstance(Key.get(Double.class, SimulationDuration.class)), 0D);
    Assert.assertEquals(0.25, injector.getInstance(Key.get(Double.class, JobArrivalRate.class)), 0D);
    Assert.assertNull(injector.getInstance(Key.get(Integer.class, MaxJobs.class)));
    Assert.assertEquals(BrokerType.CAPACITY_AWARE,
        injector.getInstance(Key.get(BrokerType.class, BrokerStrategy.class)));
    Assert.assertEquals(AllocationMode.SMART,
        injector.getInstance(Key.get(AllocationMode.class, BulkAllocationMode.class)));
    Assert.assertTrue(injector.getInstance(JobFeed.class) instanceof GeneratorJobFeed);
  }

  @Test
  public void testDispatcherFeedIsInjected() throws IOException {
    final JobFeed feed = injectorOf(read("config/dispatcher-conf.json")).getInstance(JobFeed.class);
    Assert.assertTrue(feed instanceof DispatcherJobFeed);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testGeneratorWithoutLimitIsRejected() throws IOException {
    read("config/unbounded-generator-conf.json");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownFeedMethodIsRejected() throws IOException {
    read("config/unknown-method-conf.json");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownBrokerIsRejected() throws IOException {
    read("config/bad-broker-conf.json");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testQuantumDeviceNeedsAPreset() throws IOException {
    read("config/missing-preset-conf.json");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveDurationIsRejected() {
    SimulatorModule.newModule(1L, 0D, BrokerType.CAPACITY_AWARE, AllocationMode.SMART,
        new DeviceConfiguration(Collections.emptyList(), Collections.emptyList()),
        GeneratorFeedModule.newModule(1D, 3), null);
  }

  @Test
  public void testBundledSampleConfigurationsAreValid() throws IOException {
    for (final String sample : new String[] {
        "conf/sample-sim-conf.json", "conf/sample-generator-conf.json"}) {
      final SimulatorModule module = SimulatorModule.newReader().readConfiguration(sample);
      Assert.assertEquals(Level.INFO, module.getSimulatorLogLevel());
    }
  }
}
