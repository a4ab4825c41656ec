package org.hybridcloud.dtss;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.GsonBuilder;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import org.hybridcloud.dtss.cloud.HybridCloud;
import org.hybridcloud.dtss.config.SimulatorModule;
import org.hybridcloud.dtss.config.parameters.FeedCheckInterval;
import org.hybridcloud.dtss.config.parameters.SimulationDuration;
import org.hybridcloud.dtss.feed.JobFeed;
import org.hybridcloud.dtss.lifecycle.LifeCycleState;
import org.hybridcloud.dtss.metrics.MetricsConfiguration;
import org.hybridcloud.dtss.metrics.MetricsManager;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.stats.JobStats;
import org.hybridcloud.dtss.time.Clock;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Launcher class for the discrete event-driven simulation.
 */
final class Launcher {
  private static final Logger LOG = Logger.getLogger(Launcher.class.getName());

  static final String SIM_CONF_FILE = "sim-conf.json";

  private Launcher() {
  }

  /**
   * Builds the simulated cloud and runs the job feed through it until the feed is drained
   * or the configured duration has elapsed, then writes the results.
   * @param simulatorModule the simulation configuration
   * @param runnerModule the bindings of this run
   */
  @VisibleForTesting
  public static void launch(final SimulatorModule simulatorModule, final Module runnerModule) {
    final Injector injector = Guice.createInjector(Modules.combine(simulatorModule, runnerModule));

    final Clock clock = injector.getInstance(Clock.class);
    final MetricsConfiguration metricsConfig = injector.getInstance(MetricsConfiguration.class);
    final JobRecordLedger ledger = injector.getInstance(JobRecordLedger.class);
    final MetricsManager metricsManager = injector.getInstance(MetricsManager.class);
    final HybridCloud cloud = injector.getInstance(HybridCloud.class);
    final JobFeed jobFeed = injector.getInstance(JobFeed.class);
    final Double simulationDuration = injector.getInstance(Key.get(Double.class, SimulationDuration.class));
    final double feedCheckInterval = injector.getInstance(Key.get(Double.class, FeedCheckInterval.class));

    metricsConfig.createMetricsDirectory();

    try {
      ledger.init();
      ledger.start();
      metricsManager.init();
      metricsManager.start();

      // Devices and maintenance processes
      cloud.init();
      cloud.start();

      clock.start();
      jobFeed.init();
      jobFeed.start();
      registerFeedCheckAlarm(clock, jobFeed, feedCheckInterval);
      if (simulationDuration != null) {
        clock.scheduleAbsoluteShutdown(simulationDuration);
      }

      LifeCycleState clockState = clock.pollNextAlarm();

      // Run until either no more jobs/events, or until the end time is reached.
      while (shouldContinueRunning(clockState)) {
        clockState = clock.pollNextAlarm();
      }

      jobFeed.onStop();
    } catch (final RuntimeException e) {
      LOG.log(Level.SEVERE, "Simulation failed at time " + clock.getTime(), e);
      throw e;
    } finally {
      jobFeed.stop();
      cloud.stop();
      metricsManager.stop();
      ledger.stop();
      clock.stop();
    }

    final JobStats jobStats = injector.getInstance(JobStats.class);
    LOG.log(Level.INFO, "Simulation finished at time " + clock.getTime() + "\n" + jobStats);

    // By now, the metrics manager has already stopped
    if (metricsManager.isMetricsOn()) {
      metricsManager.writeResults();
      jobStats.writeResultsToTsv();
      writeConfigs(metricsConfig, simulatorModule);
    }
  }

  /**
   * Registers a periodic alarm on the clock that checks whether every job of the feed
   * has completed, and shuts the clock down once it has.
   * @param clock The clock
   * @param jobFeed The job feed
   * @param feedCheckInterval The period of the check
   */
  private static void registerFeedCheckAlarm(final Clock clock,
                                             final JobFeed jobFeed,
                                             final double feedCheckInterval) {
    clock.schedulePeriodicAlarm(0, feedCheckInterval, periodicClientAlarm -> {
      if (jobFeed.areFeedJobsDone()) {
        LOG.log(Level.INFO, "Job feed completed at " + clock.getTime() + "!");
        clock.unschedulePeriodicAlarm(periodicClientAlarm.getPeriodicAlarmId());
        clock.scheduleShutdown(0);
      }
    });
  }

  private static boolean shouldContinueRunning(final LifeCycleState clockState) {
    return clockState != LifeCycleState.STOPPED;
  }

  /**
   * Write the configuration used for running the simulation for diagnostic purposes.
   * @param metricsConfig The metric configuration
   * @param module the simulation configuration
   */
  private static void writeConfigs(final MetricsConfiguration metricsConfig, final SimulatorModule module) {
    final String simConfPath = metricsConfig.getMetricsFilePath(SIM_CONF_FILE);
    try (Writer writer = Files.newBufferedWriter(Paths.get(simConfPath), StandardCharsets.UTF_8)) {
      new GsonBuilder().setPrettyPrinting().create().toJson(module, writer);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
