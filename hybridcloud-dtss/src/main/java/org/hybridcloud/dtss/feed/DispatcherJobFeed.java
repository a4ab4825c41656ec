package org.hybridcloud.dtss.feed;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.hybridcloud.dtss.broker.BrokerFactory;
import org.hybridcloud.dtss.config.parameters.DispatcherFilePath;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.time.Clock;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A job feed that reads predefined jobs from a CSV or JSON file into memory and dispatches
 * them in file order. Each job waits until its arrival time, and at least
 * {@value #MIN_DISPATCH_DELAY} after the previous one.
 *
 * <p>CSV files carry a header naming the {@link QuantumJob.Constants} columns; a blank
 * {@code arrival_time} means the job arrives as soon as it is read and a blank
 * {@code iterations} means one iteration. JSON files hold {@code {"jobs": [...]}}.</p>
 */
@Singleton
public final class DispatcherJobFeed extends JobFeed {
  private static final Logger LOG = Logger.getLogger(DispatcherJobFeed.class.getName());
  private static final Gson GSON = new Gson();

  public static final String METHOD = "dispatcher";

  static final double MIN_DISPATCH_DELAY = 0.01;

  private static final String CSV_EXTENSION = ".csv";
  private static final String JSON_EXTENSION = ".json";

  private final String filePath;
  private List<QuantumJob> jobs = Collections.emptyList();
  private int nextJob = 0;

  private static final class JobFile {
    private List<QuantumJob.Builder> jobs;
  }

  @Inject
  private DispatcherJobFeed(@Nullable @DispatcherFilePath final String filePath,
                            final Clock clock,
                            final JobRecordLedger ledger,
                            final BrokerFactory brokerFactory) {
    super(clock, ledger, brokerFactory);
    this.filePath = filePath;
  }

  @VisibleForTesting
  public static DispatcherJobFeed newFeed(@Nullable final String filePath,
                                          final Clock clock,
                                          final JobRecordLedger ledger,
                                          final BrokerFactory brokerFactory) {
    return new DispatcherJobFeed(filePath, clock, ledger, brokerFactory);
  }

  @Override
  public void init() {
    jobs = parseJobs();
    LOG.log(Level.INFO, MessageFormat.format("Read {0} jobs from {1}.", jobs.size(), filePath));
    super.init();
  }

  @VisibleForTesting
  List<QuantumJob> parseJobs() {
    final List<QuantumJob> parsed = readJobs();
    final Set<Integer> jobIds = new HashSet<>();
    for (final QuantumJob job : parsed) {
      if (!jobIds.add(job.getJobId())) {
        throw new IllegalArgumentException(MessageFormat.format(
            "Job id {0} appears more than once in {1}.", job.getJobId(), filePath));
      }
    }

    return parsed;
  }

  private List<QuantumJob> readJobs() {
    if (filePath == null || filePath.trim().isEmpty()) {
      throw new IllegalArgumentException("The dispatcher job feed needs a filePath.");
    }

    final String lowerPath = filePath.toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(Paths.get(filePath), StandardCharsets.UTF_8)) {
      if (lowerPath.endsWith(CSV_EXTENSION)) {
        return parseCsv(reader);
      }

      if (lowerPath.endsWith(JSON_EXTENSION)) {
        return parseJson(reader);
      }
    } catch (final IOException e) {
      throw new UncheckedIOException("Unable to read jobs from " + filePath, e);
    }

    throw new IllegalArgumentException(
        "Unsupported job file format, please use a .csv or .json file: " + filePath);
  }

  private List<QuantumJob> parseCsv(final Reader reader) throws IOException {
    final CSVFormat format = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setTrim(true)
        .setIgnoreEmptyLines(true)
        .build();

    final List<QuantumJob> parsed = new ArrayList<>();
    try (CSVParser parser = format.parse(reader)) {
      for (final CSVRecord record : parser) {
        try {
          parsed.add(QuantumJob.Builder.newBuilder()
              .setJobId(requiredInt(record, QuantumJob.Constants.JOB_ID))
              .setNumQubits(requiredInt(record, QuantumJob.Constants.NUM_QUBITS))
              .setDepth(requiredInt(record, QuantumJob.Constants.DEPTH))
              .setNumShots(requiredInt(record, QuantumJob.Constants.NUM_SHOTS))
              .setPriority(requiredInt(record, QuantumJob.Constants.PRIORITY))
              .setArrivalTime(optionalDouble(record, QuantumJob.Constants.ARRIVAL_TIME))
              .setIterations(optionalInt(record, QuantumJob.Constants.ITERATIONS))
              .setCpuUnits(optionalInt(record, QuantumJob.Constants.CPU_UNITS))
              .setMemBw(optionalInt(record, QuantumJob.Constants.MEM_BW))
              .build());
        } catch (final NumberFormatException e) {
          throw new IllegalArgumentException(MessageFormat.format(
              "Invalid number on line {0} of {1}.", record.getRecordNumber() + 1, filePath), e);
        }
      }
    }

    return parsed;
  }

  private List<QuantumJob> parseJson(final Reader reader) {
    final JobFile jobFile;
    try {
      jobFile = GSON.fromJson(reader, JobFile.class);
    } catch (final JsonParseException e) {
      throw new IllegalArgumentException("Malformed job file " + filePath, e);
    }

    final List<QuantumJob> parsed = new ArrayList<>();
    if (jobFile == null || jobFile.jobs == null) {
      LOG.log(Level.WARNING, "No jobs found in " + filePath);
      return parsed;
    }

    for (final QuantumJob.Builder builder : jobFile.jobs) {
      parsed.add(builder.build());
    }

    return parsed;
  }

  private int requiredInt(final CSVRecord record, final String column) {
    final String value = value(record, column);
    if (value == null) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Line {0} of {1} is missing {2}.", record.getRecordNumber() + 1, filePath, column));
    }

    return Integer.parseInt(value);
  }

  @Nullable
  private static Integer optionalInt(final CSVRecord record, final String column) {
    final String value = value(record, column);
    return value == null ? null : Integer.valueOf(value);
  }

  @Nullable
  private static Double optionalDouble(final CSVRecord record, final String column) {
    final String value = value(record, column);
    return value == null ? null : Double.valueOf(value);
  }

  @Nullable
  private static String value(final CSVRecord record, final String column) {
    if (!record.isMapped(column) || !record.isSet(column)) {
      return null;
    }

    final String value = record.get(column);
    return value == null || value.isEmpty() ? null : value;
  }

  @Override
  public void start() {
    super.start();
    scheduleNext();
  }

  private void scheduleNext() {
    if (isExhausted()) {
      LOG.log(Level.INFO, MessageFormat.format("{0}: all {1} jobs dispatched.", clock.getTime(), jobs.size()));
      return;
    }

    final QuantumJob job = jobs.get(nextJob);
    final double arrival = job.getArrivalTime() == null ? clock.getTime() : job.getArrivalTime();
    clock.scheduleAlarm(Math.max(arrival - clock.getTime(), MIN_DISPATCH_DELAY), alarm -> {
      nextJob++;
      dispatch(job);
      scheduleNext();
    });
  }

  @Override
  protected boolean isExhausted() {
    return nextJob >= jobs.size();
  }

  public List<QuantumJob> getJobs() {
    return Collections.unmodifiableList(jobs);
  }
}
