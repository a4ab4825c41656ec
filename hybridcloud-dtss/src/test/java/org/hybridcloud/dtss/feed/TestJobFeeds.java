package org.hybridcloud.dtss.feed;

import org.hybridcloud.dtss.broker.BrokerFactory;
import org.hybridcloud.dtss.broker.BrokerType;
import org.hybridcloud.dtss.cloud.AllocationMode;
import org.hybridcloud.dtss.cloud.HybridCloud;
import org.hybridcloud.dtss.cloud.MultiDeviceAllocator;
import org.hybridcloud.dtss.config.DeviceConfiguration;
import org.hybridcloud.dtss.device.DeviceCatalog;
import org.hybridcloud.dtss.device.DeviceFactory;
import org.hybridcloud.dtss.event.DeviceEventBus;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.metrics.MetricsConfiguration;
import org.hybridcloud.dtss.metrics.MetricsManager;
import org.hybridcloud.dtss.metrics.job.JobEndState;
import org.hybridcloud.dtss.metrics.job.JobRecord;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.random.RandomSeeder;
import org.hybridcloud.dtss.time.SimulatedClock;
import org.hybridcloud.dtss.topology.TopologyAllocator;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class TestJobFeeds {
  private SimulatedClock clock;
  private JobRecordLedger ledger;
  private RandomSeeder randomSeeder;
  private BrokerFactory brokerFactory;

  @Before
  public void setup() {
    clock = new SimulatedClock();
    final MetricsConfiguration metricsConfig = MetricsConfiguration.metricsOff();
    ledger = new JobRecordLedger(metricsConfig);
    randomSeeder = RandomSeeder.withSeed(5L);

    final DeviceEventBus eventBus = new DeviceEventBus();
    final TopologyAllocator allocator = new TopologyAllocator();
    final MetricsManager metricsManager = new MetricsManager(clock, metricsConfig, eventBus);
    metricsManager.init();

    // A single compute device, so every job the serial broker sees completes
    final HybridCloud cloud = new HybridCloud(
        new DeviceConfiguration(Collections.emptyList(),
            Collections.singletonList(DeviceConfiguration.ComputeDeviceConfig.of("cpu-0", 100, 200))),
        new DeviceFactory(clock, new DeviceCatalog(), allocator, ledger, eventBus, randomSeeder));
    cloud.init();
    cloud.start();

    brokerFactory = new BrokerFactory(BrokerType.SERIAL, clock, cloud,
        new MultiDeviceAllocator(clock, allocator, ledger, AllocationMode.SMART),
        ledger, metricsManager, randomSeeder);
  }

  private static String resourcePath(final String resource) {
    try {
      return Paths.get(TestJobFeeds.class.getClassLoader().getResource(resource).toURI()).toString();
    } catch (final URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }

  private DispatcherJobFeed newDispatcher(final String resource) {
    return DispatcherJobFeed.newFeed(resourcePath(resource), clock, ledger, brokerFactory);
  }

  @Test
  public void testCsvJobsKeepFileOrderAndDefaults() {
    final List<QuantumJob> jobs = newDispatcher("feed/jobs.csv").parseJobs();

    Assert.assertEquals(4, jobs.size());
    final List<Integer> ids = new ArrayList<>();
    for (final QuantumJob job : jobs) {
      ids.add(job.getJobId());
    }
    Assert.assertEquals(Arrays.asList(1, 2, 3, 4), ids);

    final QuantumJob first = jobs.get(0);
    Assert.assertEquals(5, first.getNumQubits());
    Assert.assertEquals(10, first.getDepth());
    Assert.assertEquals(10000, first.getNumShots());
    Assert.assertEquals(2, first.getIterations());
    Assert.assertEquals(QuantumJob.DEFAULT_CPU_UNITS, first.getCpuUnits());
    Assert.assertEquals(QuantumJob.DEFAULT_MEM_BW, first.getMemBw());

    final QuantumJob second = jobs.get(1);
    Assert.assertEquals(QuantumJob.DEFAULT_ITERATIONS, second.getIterations());
    Assert.assertEquals(6, second.getCpuUnits());
    Assert.assertEquals(16, second.getMemBw());
    Assert.assertEquals(0.5, second.getArrivalTime(), 0D);

    Assert.assertNull(jobs.get(2).getArrivalTime());
  }

  @Test
  public void testJsonJobsUseTheSameDefaults() {
    final List<QuantumJob> jobs = newDispatcher("feed/jobs.json").parseJobs();

    Assert.assertEquals(2, jobs.size());
    Assert.assertEquals(2, jobs.get(0).getIterations());
    Assert.assertEquals(0D, jobs.get(0).getArrivalTime(), 0D);
    Assert.assertEquals(QuantumJob.DEFAULT_ITERATIONS, jobs.get(1).getIterations());
    Assert.assertNull(jobs.get(1).getArrivalTime());
    Assert.assertEquals(30, jobs.get(1).getNumQubits());
    Assert.assertEquals(6, jobs.get(1).getCpuUnits());
  }

  @Test
  public void testJsonWithoutJobsIsEmpty() {
    Assert.assertTrue(newDispatcher("feed/no-jobs.json").parseJobs().isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnsupportedExtensionIsRejected() {
    newDispatcher("feed/jobs.txt").parseJobs();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingRequiredColumnIsRejected() {
    newDispatcher("feed/missing-depth.csv").parseJobs();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRepeatedJobIdIsRejected() {
    newDispatcher("feed/duplicate-ids.csv").parseJobs();
  }

  @Test(expected = UncheckedIOException.class)
  public void testMissingFileIsFatal() {
    DispatcherJobFeed.newFeed("target/no-such-jobs.csv", clock, ledger, brokerFactory).parseJobs();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDispatcherNeedsAPath() {
    DispatcherJobFeed.newFeed(null, clock, ledger, brokerFactory).parseJobs();
  }

  @Test
  public void testDispatcherWaitsForArrivalTimes() {
    final DispatcherJobFeed feed = newDispatcher("feed/jobs.csv");
    feed.init();
    feed.start();
    Assert.assertFalse(feed.areFeedJobsDone());

    clock.run();

    // Arrivals at 0, 0.5, blank and an already passed 0.2 are each spaced by the minimum delay
    final double[] expected = {0.01, 0.5, 0.51, 0.52};
    for (int jobId = 1; jobId <= 4; jobId++) {
      final JobRecord record = ledger.getRecord(jobId);
      Assert.assertEquals(expected[jobId - 1],
          record.getFirstTime(JobRecordLedger.ARRIVAL_EVENT).getAsDouble(), 1e-9);
      Assert.assertEquals(JobEndState.COMPLETED, record.getEndState());
    }

    Assert.assertEquals(4, feed.getDispatchedCount());
    Assert.assertEquals(0, feed.getInFlightCount());
    Assert.assertTrue(feed.areFeedJobsDone());
  }

  @Test
  public void testGeneratedJobsStayInRange() {
    final GeneratorJobFeed feed = GeneratorJobFeed.newFeed(2D, null, clock, ledger, brokerFactory, randomSeeder);
    final Set<Integer> priorities = new HashSet<>();
    for (int i = 1; i <= 200; i++) {
      final QuantumJob job = feed.nextJob();
      Assert.assertEquals(i, job.getJobId());
      Assert.assertTrue(job.getNumShots() >= GeneratorJobFeed.MIN_SHOTS && job.getNumShots() <= GeneratorJobFeed.MAX_SHOTS);
      Assert.assertTrue(job.getDepth() >= GeneratorJobFeed.MIN_DEPTH && job.getDepth() <= GeneratorJobFeed.MAX_DEPTH);
      Assert.assertTrue(job.getNumQubits() >= GeneratorJobFeed.MIN_QUBITS
          && job.getNumQubits() <= GeneratorJobFeed.MAX_QUBITS);
      Assert.assertEquals(QuantumJob.DEFAULT_ITERATIONS, job.getIterations());
      priorities.add(job.getPriority());
    }

    Assert.assertEquals(new HashSet<>(Arrays.asList(1, 2)), priorities);
    Assert.assertFalse(feed.isExhausted());
  }

  @Test
  public void testGeneratorStopsAtMaxJobs() {
    final GeneratorJobFeed feed = GeneratorJobFeed.newFeed(2D, 3, clock, ledger, brokerFactory, randomSeeder);
    feed.init();
    feed.start();

    clock.run();

    Assert.assertEquals(3, feed.getDispatchedCount());
    Assert.assertTrue(feed.areFeedJobsDone());
    Assert.assertEquals(3, ledger.getRecords().size());
    Assert.assertNull(ledger.getRecord(4));
    for (final JobRecord record : ledger.getRecords()) {
      Assert.assertEquals(JobEndState.COMPLETED, record.getEndState());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testGeneratorRejectsNonPositiveRate() {
    GeneratorJobFeed.newFeed(0D, 3, clock, ledger, brokerFactory, randomSeeder);
  }
}
