package org.hybridcloud.dtss.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.SlidingWindowReservoir;
import com.codahale.metrics.Snapshot;
import com.codahale.metrics.Timer;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.hybridcloud.dtss.device.DeviceType;
import org.hybridcloud.dtss.event.DeviceEvent;
import org.hybridcloud.dtss.event.DeviceEventBus;
import org.hybridcloud.dtss.event.EventType;
import org.hybridcloud.dtss.exceptions.StateException;
import org.hybridcloud.dtss.job.JobPhase;
import org.hybridcloud.dtss.lifecycle.LifeCycle;
import org.hybridcloud.dtss.time.Clock;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The manager of run metrics: device start and finish counters fed from the event bus,
 * broker selection retries, phase time histograms and a job makespan timer
 * ticking on the simulated clock. Writes {@value #METRICS_FILE} at the end of a run.
 */
@Singleton
public final class MetricsManager extends LifeCycle {
  private static final Logger LOG = Logger.getLogger(MetricsManager.class.getName());

  public static final String METRICS_FILE = "metrics.tsv";

  public static final String JOB_MAKESPAN = "job.makespan";
  public static final String SELECTION_RETRY_PREFIX = "broker.selection.retry.";
  public static final String DEVICE_PREFIX = "device.";
  public static final String PHASE_PREFIX = "phase.";

  private static final int WINDOW_SIZE = 10_000;

  // Histograms hold longs, phase times keep 4 decimals
  private static final double HISTOGRAM_SCALE = 10_000D;
  private static final double NANOS_PER_TIME_UNIT = 1_000_000_000D;

  private final Clock clock;
  private final MetricsConfiguration metricsConfig;
  private final DeviceEventBus eventBus;
  private final MetricRegistry metricsRegistry = new MetricRegistry();

  private Timer makespanTimer;

  @Inject
  public MetricsManager(final Clock clock,
                        final MetricsConfiguration metricsConfig,
                        final DeviceEventBus eventBus) {
    this.clock = clock;
    this.metricsConfig = metricsConfig;
    this.eventBus = eventBus;
  }

  public boolean isMetricsOn() {
    return metricsConfig.isMetricsOn();
  }

  public MetricsConfiguration getMetricsConfig() {
    return metricsConfig;
  }

  @Override
  public void init() {
    super.init();
    makespanTimer = metricsRegistry.register(JOB_MAKESPAN,
        new Timer(new SlidingWindowReservoir(WINDOW_SIZE), clock.getMetricsClock()));
    for (final EventType eventType : EventType.values()) {
      eventBus.subscribe(eventType, event -> onDeviceEvent(eventType, event));
    }
  }

  private void onDeviceEvent(final EventType eventType, final DeviceEvent event) {
    metricsRegistry.counter(DEVICE_PREFIX + event.getDeviceName() + "." + eventType.getEventName()).inc();
  }

  /**
   * @return a context to stop once the job is done, timing it on the simulated clock
   */
  public Timer.Context startJobTimer() {
    if (makespanTimer == null) {
      throw new StateException("Metrics manager must be initialized before timing jobs.");
    }

    return makespanTimer.time();
  }

  public void onSelectionRetry(final DeviceType type) {
    metricsRegistry.counter(SELECTION_RETRY_PREFIX + type.name().toLowerCase(Locale.ROOT)).inc();
  }

  public void onPhaseCompleted(final JobPhase phase, final double wait, final double service, final double turnaround) {
    update(phase, "wait", wait);
    update(phase, "service", service);
    update(phase, "turnaround", turnaround);
  }

  private void update(final JobPhase phase, final String kind, final double value) {
    metricsRegistry.histogram(PHASE_PREFIX + phase.getKey() + "." + kind,
        () -> new Histogram(new SlidingWindowReservoir(WINDOW_SIZE)))
        .update(Math.round(value * HISTOGRAM_SCALE));
  }

  public MetricRegistry getMetricsRegistry() {
    return metricsRegistry;
  }

  /**
   * Writes counters and histogram snapshots, in metric name order, to {@value #METRICS_FILE}.
   */
  public void writeResults() {
    if (!lifeCycleState.isDone()) {
      throw new StateException("Cannot write metrics as the simulation is not yet done!");
    }

    if (!metricsConfig.isMetricsOn()) {
      LOG.log(Level.INFO, "Metrics is not turned on, not writing metrics...");
      return;
    }

    final String path = metricsConfig.getMetricsFilePath(METRICS_FILE);
    LOG.log(Level.INFO, "Writing metrics to " + path + "...");
    try (Writer writer = Files.newBufferedWriter(Paths.get(path), StandardCharsets.UTF_8);
         CSVPrinter printer = new CSVPrinter(writer,
             CSVFormat.TDF.builder().setEscape('\\').setQuoteMode(QuoteMode.NONE).build())) {
      printer.printRecord("Metric", "Type", "Count", "Mean", "Median", "P95", "Max");
      for (final Map.Entry<String, Counter> entry : metricsRegistry.getCounters().entrySet()) {
        printer.printRecord(entry.getKey(), "counter", entry.getValue().getCount(), "", "", "", "");
      }

      for (final Map.Entry<String, Histogram> entry : metricsRegistry.getHistograms().entrySet()) {
        printSnapshot(printer, entry.getKey(), "histogram",
            entry.getValue().getCount(), entry.getValue().getSnapshot(), HISTOGRAM_SCALE);
      }

      for (final Map.Entry<String, Timer> entry : metricsRegistry.getTimers().entrySet()) {
        printSnapshot(printer, entry.getKey(), "timer",
            entry.getValue().getCount(), entry.getValue().getSnapshot(), NANOS_PER_TIME_UNIT);
      }
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }

    LOG.log(Level.INFO, "Done writing metrics!");
  }

  private static void printSnapshot(final CSVPrinter printer,
                                    final String name,
                                    final String type,
                                    final long count,
                                    final Snapshot snapshot,
                                    final double scale) throws IOException {
    printer.printRecord(name, type, count,
        format(snapshot.getMean() / scale),
        format(snapshot.getMedian() / scale),
        format(snapshot.get95thPercentile() / scale),
        format(snapshot.getMax() / scale));
  }

  private static String format(final double value) {
    return String.format(Locale.ROOT, "%.4f", value);
  }
}
