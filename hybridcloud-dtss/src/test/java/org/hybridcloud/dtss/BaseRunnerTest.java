package org.hybridcloud.dtss;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.inject.AbstractModule;
import net.jcip.annotations.NotThreadSafe;
import org.hybridcloud.dtss.broker.BrokerType;
import org.hybridcloud.dtss.cloud.AllocationMode;
import org.hybridcloud.dtss.config.DeviceConfiguration;
import org.hybridcloud.dtss.config.SimulatorModule;
import org.hybridcloud.dtss.metrics.MetricsManager;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.results.JobStatsFileReader;
import org.hybridcloud.dtss.stats.JobStats;
import org.junit.Assert;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.UUID;

@NotThreadSafe
@SuppressWarnings("VisibilityModifier")
public abstract class BaseRunnerTest {
  protected static final long RANDOM_SEED = 5L;
  protected static final String CSV_HEADER =
      "job_id,num_qubits,depth,num_shots,priority,arrival_time,iterations";

  protected SimulatorModule simulatorModule;
  protected Runner.RunnerModule runnerModule;
  protected String runId;
  protected File dtssDir;
  protected File tempDir;

  protected void setup(final Double simulationDuration,
                       final BrokerType brokerType,
                       final DeviceConfiguration devices,
                       final AbstractModule feedModule) {
    dtssDir = new File("target", "dtssTestOutput");
    runId = UUID.randomUUID().toString();
    tempDir = new File(dtssDir, runId);
    if (!tempDir.mkdirs()) {
      throw new RuntimeException("Failed mkdirs for directory " + tempDir.getAbsolutePath());
    }

    simulatorModule = SimulatorModule.newModule(
        RANDOM_SEED,
        simulationDuration,
        brokerType,
        AllocationMode.SMART,
        devices,
        feedModule,
        dtssDir.getAbsolutePath()
    );

    runnerModule = Runner.RunnerModule.newModule(runId);
  }

  /**
   * Writes the given CSV rows under a header into a job file of this run.
   */
  protected String writeJobFile(final String... rows) throws IOException {
    final File jobFile = new File(new File(dtssDir, "jobs-" + UUID.randomUUID()), "jobs.csv");
    if (!jobFile.getParentFile().mkdirs()) {
      throw new RuntimeException("Failed mkdirs for directory " + jobFile.getParent());
    }

    try (Writer writer = Files.newBufferedWriter(jobFile.toPath(), StandardCharsets.UTF_8)) {
      writer.write(CSV_HEADER);
      writer.write("\n");
      for (final String row : rows) {
        writer.write(row);
        writer.write("\n");
      }
    }

    return jobFile.getAbsolutePath();
  }

  protected File getOutputFile(final String fileName) {
    final File file = new File(tempDir, fileName);
    Assert.assertTrue(file.getAbsolutePath() + " must exist.", file.exists());
    return file;
  }

  protected List<JobStatsFileReader.JobStatsEntry> readJobStats() throws IOException {
    return JobStatsFileReader.readAll(getOutputFile(JobStats.JOB_STATS_FILE).getAbsolutePath());
  }

  protected String readJobRecordsText() throws IOException {
    return new String(Files.readAllBytes(getOutputFile(JobRecordLedger.JOB_RECORDS_FILE).toPath()),
        StandardCharsets.UTF_8);
  }

  protected JsonObject readJobRecords() throws IOException {
    return JsonParser.parseString(readJobRecordsText()).getAsJsonObject();
  }

  protected void checkRunFiles() {
    getOutputFile(MetricsManager.METRICS_FILE);
    getOutputFile(Launcher.SIM_CONF_FILE);
  }
}
