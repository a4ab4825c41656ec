package org.hybridcloud.dtss.stats;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.hybridcloud.dtss.device.QuantumDevice;
import org.hybridcloud.dtss.job.JobPhase;
import org.hybridcloud.dtss.metrics.MetricsConfiguration;
import org.hybridcloud.dtss.metrics.job.JobEndState;
import org.hybridcloud.dtss.metrics.job.JobRecord;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-job summary of a run, derived from the job record ledger.
 */
@Singleton
public final class JobStats {
  private static final Logger LOG = Logger.getLogger(JobStats.class.getName());

  public static final String JOB_STATS_FILE = "jobStats.tsv";

  private final MetricsConfiguration metricsConfig;
  private final JobRecordLedger ledger;

  @Inject
  public JobStats(final MetricsConfiguration metricsConfig, final JobRecordLedger ledger) {
    this.metricsConfig = metricsConfig;
    this.ledger = ledger;
  }

  /**
   * One row of the job stats table.
   */
  public static final class JobSummary {
    private final int jobId;
    private final Double arrival;
    private final int iterations;
    private final Double makespan;
    private final Double fidelity;
    private final JobEndState endState;

    private JobSummary(final JobRecord record) {
      this.jobId = record.getJobId();
      this.arrival = toNullable(record.getFirstTime(JobRecordLedger.ARRIVAL_EVENT));
      this.iterations = record.getAll(JobPhase.CPU.finishEvent()).size();
      this.makespan = toNullable(record.getFirstTime(JobRecordLedger.MAKESPAN_EVENT));
      this.fidelity = toNullable(record.getLastTime(QuantumDevice.FIDELITY_EVENT));
      this.endState = record.getEndState();
    }

    public int getJobId() {
      return jobId;
    }

    @Nullable
    public Double getArrival() {
      return arrival;
    }

    public int getIterations() {
      return iterations;
    }

    @Nullable
    public Double getMakespan() {
      return makespan;
    }

    @Nullable
    public Double getFidelity() {
      return fidelity;
    }

    public JobEndState getEndState() {
      return endState;
    }
  }

  @Nullable
  private static Double toNullable(final OptionalDouble value) {
    return value.isPresent() ? value.getAsDouble() : null;
  }

  /**
   * @return a summary per job, in job ID order
   */
  public List<JobSummary> getSummaries() {
    final List<JobSummary> summaries = new ArrayList<>();
    for (final JobRecord record : ledger.getRecords()) {
      summaries.add(new JobSummary(record));
    }

    return summaries;
  }

  /**
   * @return statistics over the makespans of completed jobs, or null if none completed
   */
  @Nullable
  public StatUtils getMakespanStats() {
    final List<Double> makespans = new ArrayList<>();
    for (final JobSummary summary : getSummaries()) {
      if (summary.endState == JobEndState.COMPLETED && summary.makespan != null) {
        makespans.add(summary.makespan);
      }
    }

    if (makespans.isEmpty()) {
      return null;
    }

    final double[] data = new double[makespans.size()];
    for (int i = 0; i < data.length; i++) {
      data[i] = makespans.get(i);
    }

    return new StatUtils(data);
  }

  public int countJobs(final JobEndState endState) {
    int count = 0;
    for (final JobSummary summary : getSummaries()) {
      if (summary.endState == endState) {
        count++;
      }
    }

    return count;
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder();
    sb.append("JobId, Arrival, Iterations, Makespan, Fidelity, EndState\n");
    for (final JobSummary summary : getSummaries()) {
      sb.append(String.format("%" + 5 + "s", summary.jobId)).append(", ");
      sb.append(String.format("%" + 7 + "s", summary.arrival)).append(", ");
      sb.append(String.format("%" + 10 + "s", summary.iterations)).append(", ");
      sb.append(String.format("%" + 8 + "s", summary.makespan)).append(", ");
      sb.append(String.format("%" + 8 + "s", summary.fidelity)).append(", ");
      sb.append(summary.endState);
      sb.append("\n");
    }

    final StatUtils makespans = getMakespanStats();
    if (makespans != null) {
      sb.append(String.format(Locale.ROOT, "Makespan over %d completed jobs: mean=%.4f, median=%.4f, stddev=%.4f%n",
          makespans.getSize(), makespans.getMean(), makespans.getMedian(), makespans.getStdDev()));
    }

    sb.append(String.format("Failed jobs: %d, unfinished jobs: %d%n",
        countJobs(JobEndState.FAILED), countJobs(JobEndState.IN_PROGRESS)));
    return sb.toString();
  }

  public void writeResultsToTsv() {
    if (!metricsConfig.isMetricsOn()) {
      LOG.log(Level.INFO, "Metrics is not turned on, not writing job stats...");
      return;
    }

    final String path = metricsConfig.getMetricsFilePath(JOB_STATS_FILE);
    LOG.log(Level.INFO, "Writing job stats to " + path + "...");
    try (Writer writer = Files.newBufferedWriter(Paths.get(path), StandardCharsets.UTF_8);
         CSVPrinter printer = new CSVPrinter(writer,
             CSVFormat.TDF.builder().setEscape('\\').setQuoteMode(QuoteMode.NONE).build())) {
      printer.printRecord("JobId", "Arrival", "Iterations", "Makespan", "Fidelity", "EndState");
      for (final JobSummary summary : getSummaries()) {
        printer.printRecord(summary.jobId, summary.arrival, summary.iterations,
            summary.makespan, summary.fidelity, summary.endState);
      }
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }

    LOG.log(Level.INFO, "Done writing job stats!");
  }
}
