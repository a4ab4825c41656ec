package org.hybridcloud.dtss.metrics.job;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.hybridcloud.dtss.lifecycle.LifeCycle;
import org.hybridcloud.dtss.metrics.MetricsConfiguration;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A singleton, append-only store of every job's recorded events.
 * Devices and brokers record raw timestamps and the derived phase metrics here;
 * reporting reads them back through {@link #getRecords()} and never mutates them.
 */
@Singleton
public final class JobRecordLedger extends LifeCycle {
  private static final Logger LOG = Logger.getLogger(JobRecordLedger.class.getName());
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  public static final String JOB_RECORDS_FILE = "jobRecords.json";

  public static final String ARRIVAL_EVENT = "arrival";
  public static final String MAKESPAN_EVENT = "makespan";

  private final MetricsConfiguration metricsConfig;
  private final Map<Integer, JobRecord> records = new TreeMap<>();

  @Inject
  public JobRecordLedger(final MetricsConfiguration metricsConfig) {
    this.metricsConfig = metricsConfig;
  }

  /**
   * Records {@code value} under {@code event} for the job. Recording an event that already
   * exists appends the value, turning the entry into a list.
   * @param value a number or a string
   */
  public void logJobEvent(final int jobId, final String event, final Object value) {
    if (!(value instanceof Number) && !(value instanceof String)) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Job {0} event {1}: only numbers and strings can be recorded, got {2}.", jobId, event, value));
    }

    recordFor(jobId).log(event, value);
  }

  public void onJobArrived(final int jobId) {
    recordFor(jobId).setEndState(JobEndState.IN_PROGRESS);
  }

  public void onJobCompleted(final int jobId) {
    recordFor(jobId).setEndState(JobEndState.COMPLETED);
  }

  public void onJobFailed(final int jobId, final Throwable cause) {
    LOG.log(Level.SEVERE, MessageFormat.format("Job {0} failed.", jobId), cause);
    recordFor(jobId).setEndState(JobEndState.FAILED);
  }

  private JobRecord recordFor(final int jobId) {
    return records.computeIfAbsent(jobId, JobRecord::new);
  }

  @Nullable
  public JobRecord getRecord(final int jobId) {
    return records.get(jobId);
  }

  /**
   * @return every job record in job ID order
   */
  public Collection<JobRecord> getRecords() {
    return Collections.unmodifiableCollection(records.values());
  }

  /**
   * @return the ledger as JSON, job IDs in ascending order and events in recording order
   */
  public String toJson() {
    final Map<String, Map<String, Object>> view = new LinkedHashMap<>();
    for (final JobRecord record : records.values()) {
      view.put(String.valueOf(record.getJobId()), record.asMap());
    }

    return GSON.toJson(view);
  }

  @Override
  public void stop() {
    super.stop();
    if (!metricsConfig.isMetricsOn()) {
      return;
    }

    final String path = metricsConfig.getMetricsFilePath(JOB_RECORDS_FILE);
    LOG.log(Level.INFO, "Writing job records to " + path + "...");
    try (Writer writer = Files.newBufferedWriter(Paths.get(path), StandardCharsets.UTF_8)) {
      writer.write(toJson());
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
