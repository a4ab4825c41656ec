package org.hybridcloud.dtss;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import net.jcip.annotations.NotThreadSafe;
import org.apache.commons.math3.util.Precision;
import org.hybridcloud.dtss.broker.BrokerType;
import org.hybridcloud.dtss.config.DeviceConfiguration;
import org.hybridcloud.dtss.device.QuantumDevice;
import org.hybridcloud.dtss.feed.config.DispatcherFeedModule;
import org.hybridcloud.dtss.feed.config.GeneratorFeedModule;
import org.hybridcloud.dtss.metrics.job.JobEndState;
import org.hybridcloud.dtss.results.JobStatsFileReader;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * End-to-end tests for the hybrid cloud simulation.
 */
@NotThreadSafe
public class TestHybridCloudRunner extends BaseRunnerTest {
  private static final String PENTAGON = "pentagon";
  private static final String GUADALUPE = "IBM_guadalupe";

  private static DeviceConfiguration devices(final String preset, final int numQuantumDevices) {
    final List<DeviceConfiguration.QuantumDeviceConfig> quantumDevices = new ArrayList<>();
    for (int i = 1; i <= numQuantumDevices; i++) {
      quantumDevices.add(DeviceConfiguration.QuantumDeviceConfig.of(preset, "qpu-" + i, false));
    }

    return new DeviceConfiguration(quantumDevices,
        Collections.singletonList(DeviceConfiguration.ComputeDeviceConfig.of("cpu-0", 100, 200)));
  }

  @Test
  public void testNoJobs() throws IOException {
    setup(null, BrokerType.CAPACITY_AWARE, devices(PENTAGON, 1),
        DispatcherFeedModule.newModule(writeJobFile()));

    Runner.runSimulator(simulatorModule, runnerModule);

    checkRunFiles();
    Assert.assertEquals(0, readJobStats().size());
    Assert.assertEquals(0, readJobRecords().size());
  }

  @Test
  public void testRunOneJob() throws IOException {
    setup(null, BrokerType.CAPACITY_AWARE, devices(PENTAGON, 1),
        DispatcherFeedModule.newModule(writeJobFile("1,3,10,10000,1,0,2")));

    Runner.runSimulator(simulatorModule, runnerModule);

    checkRunFiles();
    final List<JobStatsFileReader.JobStatsEntry> jobs = readJobStats();
    Assert.assertEquals(1, jobs.size());

    final JobStatsFileReader.JobStatsEntry job = jobs.get(0);
    Assert.assertEquals(1, job.getJobId());
    Assert.assertEquals(JobEndState.COMPLETED, job.getEndState());
    Assert.assertEquals(2, job.getIterations());

    // Dispatch waits the minimum delay
    Assert.assertTrue(Precision.equals(0.01, job.getArrival()));

    // Two runs of three qubits on a pentagon, each followed by at least one time unit on the CPU
    Assert.assertTrue(job.getMakespan() >= 2 * 300 + 2);

    // The pentagon has no error rates
    Assert.assertTrue(Precision.equals(1D, job.getFidelity()));

    final JsonObject record = readJobRecords().getAsJsonObject("1");
    final JsonArray deviceNames = record.getAsJsonArray(QuantumDevice.DEVICE_NAME_EVENT);
    Assert.assertEquals(4, deviceNames.size());
    Assert.assertEquals("qpu-1", deviceNames.get(0).getAsString());
    Assert.assertEquals("cpu-0", deviceNames.get(1).getAsString());
  }

  @Test
  public void testOversizedJobIsSplitAcrossDevices() throws IOException {
    setup(null, BrokerType.CAPACITY_AWARE, devices(PENTAGON, 2),
        DispatcherFeedModule.newModule(writeJobFile("1,8,10,10000,1,0,1")));

    Runner.runSimulator(simulatorModule, runnerModule);

    final JobStatsFileReader.JobStatsEntry job = readJobStats().get(0);
    Assert.assertEquals(JobEndState.COMPLETED, job.getEndState());

    // One link between two error free devices
    Assert.assertTrue(Precision.equals(0.94, job.getFidelity()));

    final JsonArray deviceNames = readJobRecords().getAsJsonObject("1")
        .getAsJsonArray(QuantumDevice.DEVICE_NAME_EVENT);
    final List<String> names = new ArrayList<>();
    deviceNames.forEach(name -> names.add(name.getAsString()));
    Assert.assertEquals(Arrays.asList("qpu-1", "qpu-2", "cpu-0"), names);
  }

  @Test
  public void testOversizedJobFailsOnASingleDevice() throws IOException {
    setup(null, BrokerType.CAPACITY_AWARE, devices(PENTAGON, 1),
        DispatcherFeedModule.newModule(writeJobFile("1,8,10,10000,1,0,1", "2,2,10,10000,1,1,1")));

    Runner.runSimulator(simulatorModule, runnerModule);

    final List<JobStatsFileReader.JobStatsEntry> jobs = readJobStats();
    Assert.assertEquals(2, jobs.size());
    Assert.assertEquals(JobEndState.FAILED, jobs.get(0).getEndState());
    Assert.assertNull(jobs.get(0).getMakespan());
    Assert.assertEquals(JobEndState.COMPLETED, jobs.get(1).getEndState());
  }

  @Test
  public void testSerialBroker() throws IOException {
    setup(null, BrokerType.SERIAL, devices(PENTAGON, 1),
        DispatcherFeedModule.newModule(writeJobFile("1,3,10,10000,1,0,3", "2,4,10,10000,2,0,1")));

    Runner.runSimulator(simulatorModule, runnerModule);

    checkRunFiles();
    for (final JobStatsFileReader.JobStatsEntry job : readJobStats()) {
      Assert.assertEquals(JobEndState.COMPLETED, job.getEndState());
      Assert.assertTrue(job.getIterations() <= 1);
    }
  }

  @Test
  public void testSameSeedReplaysTheSameRun() throws IOException {
    setup(null, BrokerType.CAPACITY_AWARE, devices(GUADALUPE, 2), GeneratorFeedModule.newModule(0.5, 4));
    Runner.runSimulator(simulatorModule, runnerModule);
    final String firstRun = readJobRecordsText();

    setup(null, BrokerType.CAPACITY_AWARE, devices(GUADALUPE, 2), GeneratorFeedModule.newModule(0.5, 4));
    Runner.runSimulator(simulatorModule, runnerModule);
    final String secondRun = readJobRecordsText();

    Assert.assertEquals(firstRun, secondRun);

    final List<JobStatsFileReader.JobStatsEntry> jobs = readJobStats();
    Assert.assertEquals(4, jobs.size());
    for (final JobStatsFileReader.JobStatsEntry job : jobs) {
      Assert.assertEquals(JobEndState.COMPLETED, job.getEndState());
      Assert.assertTrue(job.getFidelity() > 0 && job.getFidelity() <= 1);
    }
  }

  @Test
  public void testDurationLeavesUnfinishedJobsInProgress() throws IOException {
    setup(100D, BrokerType.CAPACITY_AWARE, devices(GUADALUPE, 2), GeneratorFeedModule.newModule(0.2, null));

    Runner.runSimulator(simulatorModule, runnerModule);

    final List<JobStatsFileReader.JobStatsEntry> jobs = readJobStats();
    Assert.assertFalse(jobs.isEmpty());
    for (final JobStatsFileReader.JobStatsEntry job : jobs) {
      // A generated job runs for hundreds of time units on these devices
      Assert.assertEquals(JobEndState.IN_PROGRESS, job.getEndState());
      Assert.assertTrue(job.getArrival() <= 100);
      Assert.assertNull(job.getMakespan());
    }
  }
}
