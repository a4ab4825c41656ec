package org.hybridcloud.dtss.device;

import org.hybridcloud.dtss.event.DeviceEvent;
import org.hybridcloud.dtss.event.DeviceEventBus;
import org.hybridcloud.dtss.event.EventType;
import org.hybridcloud.dtss.exceptions.ResourceException;
import org.hybridcloud.dtss.job.JobPhase;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.metrics.MetricsConfiguration;
import org.hybridcloud.dtss.metrics.job.JobRecord;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.random.RandomSeeder;
import org.hybridcloud.dtss.time.SimulatedClock;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

public class TestComputeDevice {
  private SimulatedClock clock;
  private JobRecordLedger ledger;
  private DeviceEventBus eventBus;

  @Before
  public void setup() {
    clock = new SimulatedClock();
    ledger = new JobRecordLedger(MetricsConfiguration.metricsOff());
    eventBus = new DeviceEventBus();
  }

  private ComputeDevice newDevice(final int cpuCapacity, final int memBwCapacity) {
    return new ComputeDevice("cpu-1", cpuCapacity, memBwCapacity, clock,
        RandomSeeder.withSeed(5L).newRandomGenerator(), ledger, eventBus);
  }

  private static QuantumJob newJob(final int jobId, final int memBw) {
    return QuantumJob.Builder.newBuilder()
        .setJobId(jobId)
        .setNumQubits(5)
        .setDepth(10)
        .setNumShots(10000)
        .setPriority(1)
        .setMemBw(memBw)
        .build();
  }

  @Test
  public void testJobHoldsUnitsForItsDurationAndReturnsThem() {
    final ComputeDevice device = newDevice(100, 200);
    final List<DeviceEvent> finished = new ArrayList<>();
    eventBus.subscribe(EventType.DEVICE_FINISH, finished::add);

    final CompletableFuture<Double> finishedAt = device.processJob(newJob(1, 20)).thenApply(v -> clock.getTime());
    final int units = ((Number) ledger.getRecord(1).getFirst(ComputeDevice.CPU_UNITS_EVENT)).intValue();
    Assert.assertTrue(units >= 4 && units <= 10);
    Assert.assertEquals(100 - units, device.getCpuUnits().getLevel());
    Assert.assertEquals(180, device.getMemBw().getLevel());

    clock.run();

    final JobRecord record = ledger.getRecord(1);
    Assert.assertEquals(0D, record.getFirstTime(JobPhase.CPU.arriveEvent()).getAsDouble(), 0D);
    Assert.assertEquals(0D, record.getFirstTime(JobPhase.CPU.startEvent()).getAsDouble(), 0D);
    Assert.assertEquals(20, record.getFirst(ComputeDevice.CPU_MEM_BW_EVENT));
    Assert.assertEquals("cpu-1", record.getFirst(QuantumDevice.DEVICE_NAME_EVENT));

    final double duration = finishedAt.join();
    Assert.assertTrue(duration >= 1 && duration <= 3);
    Assert.assertEquals(100, device.getCpuUnits().getLevel());
    Assert.assertEquals(200, device.getMemBw().getLevel());
    Assert.assertEquals(1, finished.size());
    Assert.assertEquals(1, finished.get(0).getJobId());
  }

  @Test
  public void testJobsWaitForBandwidth() {
    final ComputeDevice device = newDevice(100, 30);
    final CompletableFuture<Double> first = device.processJob(newJob(1, 20)).thenApply(v -> clock.getTime());
    final CompletableFuture<Double> second = device.processJob(newJob(2, 20)).thenApply(v -> clock.getTime());

    clock.run();

    final double secondStart = ledger.getRecord(2).getFirstTime(JobPhase.CPU.startEvent()).getAsDouble();
    Assert.assertEquals(first.join(), secondStart, 1e-4);
    Assert.assertTrue(second.join() > first.join());
    Assert.assertEquals(30, device.getMemBw().getLevel());
  }

  @Test
  public void testFailedBandwidthRequestReturnsTheCpuUnits() {
    final ComputeDevice device = newDevice(100, 10);
    final CompletableFuture<Void> processed = device.processJob(newJob(1, 20));

    Assert.assertTrue(processed.isCompletedExceptionally());
    try {
      processed.join();
      Assert.fail("The bandwidth request is above capacity.");
    } catch (final CompletionException e) {
      Assert.assertTrue(e.getCause() instanceof ResourceException);
    }

    Assert.assertEquals(100, device.getCpuUnits().getLevel());
    Assert.assertEquals(10, device.getMemBw().getLevel());
  }
}
