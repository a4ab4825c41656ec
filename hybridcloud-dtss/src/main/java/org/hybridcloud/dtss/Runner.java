package org.hybridcloud.dtss;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.AbstractModule;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.builder.ReflectionToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;
import org.hybridcloud.dtss.config.SimulatorModule;
import org.hybridcloud.dtss.config.parameters.RunId;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point of the simulator. Reads the command line and the JSON configuration
 * and hands them to the {@link Launcher}.
 *
 * <pre>
 * Runner [-i runId] [-m metricsDir] [-s seed] config.json
 * </pre>
 */
public final class Runner {
  private static final Logger LOG = Logger.getLogger(Runner.class.getName());

  private static final String LOGGING_CONFIG = "logging.properties";
  private static final String USAGE = "Runner [options] <config.json>";

  private Runner() {
  }

  /**
   * Binds the values that identify a single run.
   */
  @VisibleForTesting
  public static final class RunnerModule extends AbstractModule {
    private final String runId;

    @VisibleForTesting
    public static RunnerModule newModule(final String runId) {
      return new RunnerModule(runId);
    }

    private RunnerModule(final String runId) {
      this.runId = runId;
    }

    @Override
    protected void configure() {
      bind(String.class).annotatedWith(RunId.class).toInstance(runId);
    }
  }

  /**
   * The parsed command line.
   */
  static final class Arguments {
    private final String configPath;
    private final String runId;
    private final String metricsDirectory;
    private final Long seed;

    private Arguments(final String configPath,
                      final String runId,
                      @Nullable final String metricsDirectory,
                      @Nullable final Long seed) {
      this.configPath = configPath;
      this.runId = runId;
      this.metricsDirectory = metricsDirectory;
      this.seed = seed;
    }

    static Arguments parse(final String[] args) {
      final CommandLine cmd;
      try {
        cmd = new DefaultParser().parse(options(), args);
      } catch (final ParseException e) {
        new HelpFormatter().printHelp(USAGE, options());
        throw new IllegalArgumentException("Invalid command line: " + e.getMessage(), e);
      }

      if (cmd.getArgs().length != 1) {
        new HelpFormatter().printHelp(USAGE, options());
        throw new IllegalArgumentException("Expected exactly one configuration file, got " + cmd.getArgList());
      }

      final String runId = cmd.hasOption('i')
          ? nonBlank(cmd.getOptionValue('i'), "Run ID")
          : DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss").format(LocalDateTime.now());
      final String metricsDirectory = cmd.hasOption('m')
          ? nonBlank(cmd.getOptionValue('m'), "Metrics output directory") : null;

      Long seed = null;
      if (cmd.hasOption('s')) {
        try {
          seed = Long.valueOf(cmd.getOptionValue('s').trim());
        } catch (final NumberFormatException e) {
          throw new IllegalArgumentException("The seed must be an integer: " + cmd.getOptionValue('s'), e);
        }
      }

      return new Arguments(cmd.getArgs()[0], runId, metricsDirectory, seed);
    }

    private static Options options() {
      return new Options()
          .addOption(Option.builder("i").longOpt("id").hasArg().desc("The run ID of the simulation.").build())
          .addOption(Option.builder("m").longOpt("metrics").hasArg()
              .desc("The metrics output directory, turns metrics on.").build())
          .addOption(Option.builder("s").longOpt("seed").hasArg()
              .desc("Overrides the random seed of the configuration.").build());
    }

    private static String nonBlank(final String value, final String what) {
      if (value == null || value.trim().isEmpty()) {
        throw new IllegalArgumentException(what + " cannot be empty!");
      }

      return value;
    }

    String getConfigPath() {
      return configPath;
    }

    String getRunId() {
      return runId;
    }

    @Nullable
    String getMetricsDirectory() {
      return metricsDirectory;
    }

    @Nullable
    Long getSeed() {
      return seed;
    }
  }

  public static void runSimulator(final SimulatorModule simulatorModule, final RunnerModule runnerModule) {
    LOG.log(Level.INFO, String.format(
        "Read configuration\n%s",
        ReflectionToStringBuilder.toString(simulatorModule, ToStringStyle.MULTI_LINE_STYLE)
    ));

    final Level logLevel = simulatorModule.getSimulatorLogLevel();
    LOG.log(Level.INFO, "Log level set to " + logLevel + ".");
    setRootLogLevel(logLevel);

    Launcher.launch(simulatorModule, runnerModule);
  }

  public static void main(final String[] args) {
    readLoggingConfiguration();

    final Arguments arguments = Arguments.parse(args);
    LOG.log(Level.INFO, "Running simulation " + arguments.getRunId()
        + " with configuration " + arguments.getConfigPath() + ".");

    final SimulatorModule simulatorModule;
    try {
      simulatorModule = SimulatorModule.newReader().readConfiguration(arguments.getConfigPath());
    } catch (final IOException e) {
      LOG.log(Level.SEVERE, "Unable to read simulation configuration at " + arguments.getConfigPath(), e);
      throw new UncheckedIOException(e);
    }

    if (arguments.getMetricsDirectory() != null) {
      LOG.log(Level.INFO, "Writing metrics to " + arguments.getMetricsDirectory());
      simulatorModule.setMetricsOutputDirectory(arguments.getMetricsDirectory());
      simulatorModule.setIsMetricsOn(true);
    }

    if (arguments.getSeed() != null) {
      LOG.log(Level.INFO, "Using random seed " + arguments.getSeed());
      simulatorModule.setRandomSeed(arguments.getSeed());
    }

    try {
      runSimulator(simulatorModule, RunnerModule.newModule(arguments.getRunId()));
    } catch (final RuntimeException e) {
      LOG.log(Level.SEVERE, "Simulation " + arguments.getRunId() + " failed.", e);
      throw e;
    }
  }

  private static void readLoggingConfiguration() {
    try (InputStream in = Runner.class.getClassLoader().getResourceAsStream(LOGGING_CONFIG)) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    } catch (final IOException e) {
      LOG.log(Level.WARNING, "Unable to read " + LOGGING_CONFIG + ", using the default logging setup.", e);
    }
  }

  private static void setRootLogLevel(final Level logLevel) {
    final Logger rootLogger = LogManager.getLogManager().getLogger("");
    rootLogger.setLevel(logLevel);
    for (final Handler h : rootLogger.getHandlers()) {
      h.setLevel(logLevel);
    }
  }
}
