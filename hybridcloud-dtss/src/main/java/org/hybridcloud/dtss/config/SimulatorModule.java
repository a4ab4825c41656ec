package org.hybridcloud.dtss.config;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.inject.AbstractModule;
import com.google.inject.util.Providers;
import org.hybridcloud.dtss.broker.BrokerType;
import org.hybridcloud.dtss.cloud.AllocationMode;
import org.hybridcloud.dtss.config.parameters.BrokerStrategy;
import org.hybridcloud.dtss.config.parameters.BulkAllocationMode;
import org.hybridcloud.dtss.config.parameters.FeedCheckInterval;
import org.hybridcloud.dtss.config.parameters.IsMetricsOn;
import org.hybridcloud.dtss.config.parameters.RandomSeed;
import org.hybridcloud.dtss.config.parameters.RootMetricsOutputDirectory;
import org.hybridcloud.dtss.config.parameters.SimulationDuration;
import org.hybridcloud.dtss.feed.config.DispatcherFeedModule;
import org.hybridcloud.dtss.feed.config.GeneratorFeedModule;
import org.hybridcloud.dtss.time.Clock;
import org.hybridcloud.dtss.time.SimulatedClock;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The module configuration for running the hybrid cloud simulation.
 * Serialized from JSON.
 */
public final class SimulatorModule extends AbstractModule {
  public static final class Constants {
    public static final String FEED_METHOD = "method";

    static final Map<String, Class<? extends AbstractModule>> FEED_MODULE_MAP =
        new HashMap<String, Class<? extends AbstractModule>>() {{
          put(GeneratorFeedModule.METHOD, GeneratorFeedModule.class);
          put(DispatcherFeedModule.METHOD, DispatcherFeedModule.class);
        }};

    private Constants() {
    }
  }

  private static final Logger LOG = Logger.getLogger(SimulatorModule.class.getName());

  private static final Gson GSON = new Gson();

  public static final double DEFAULT_FEED_CHECK_INTERVAL = 10D;

  private Long randomSeed = null;

  // Null runs the simulation until the feed is drained
  private Double simulationDuration = null;

  private double feedCheckInterval = DEFAULT_FEED_CHECK_INTERVAL;

  private String brokerType = BrokerType.CAPACITY_AWARE.getConfigName();

  private String bulkAllocationMode = AllocationMode.SMART.getConfigName();

  private List<DeviceConfiguration.QuantumDeviceConfig> quantumDevices = new ArrayList<>();

  private List<DeviceConfiguration.ComputeDeviceConfig> computeDevices = new ArrayList<>();

  private Map<String, Object> jobFeedConfig = new HashMap<>();

  private boolean isMetricsOn = false;

  private String metricsOutputDirectory = null;

  private String simulatorLogLevel = Level.INFO.getName();

  // Initialized by jobFeedConfig, available to be injected in test
  private transient AbstractModule feedModule = null;

  /**
   * @return a new {@link Reader}
   */
  public static Reader newReader() {
    return new SimulatorModule().new Reader();
  }

  private SimulatorModule() {
  }

  @VisibleForTesting
  public static SimulatorModule newModule(
      @Nullable final Long randomSeed,
      @Nullable final Double simulationDuration,
      final BrokerType brokerType,
      final AllocationMode bulkAllocationMode,
      final DeviceConfiguration deviceConfiguration,
      final AbstractModule feedModule,
      @Nullable final String metricsOutputDirectory) {
    final SimulatorModule m = new SimulatorModule();
    m.randomSeed = randomSeed;
    m.simulationDuration = simulationDuration;
    m.brokerType = brokerType.getConfigName();
    m.bulkAllocationMode = bulkAllocationMode.getConfigName();
    m.quantumDevices = new ArrayList<>(deviceConfiguration.getQuantumDevices());
    m.computeDevices = new ArrayList<>(deviceConfiguration.getComputeDevices());
    m.feedModule = feedModule;
    m.metricsOutputDirectory = metricsOutputDirectory;
    m.isMetricsOn = metricsOutputDirectory != null;
    m.validate();
    return m;
  }

  /**
   * Checks the configured values, so that a bad configuration fails before the simulation starts.
   * @throws IllegalArgumentException on an invalid or missing value
   */
  public void validate() {
    BrokerType.fromName(brokerType);
    AllocationMode.fromName(bulkAllocationMode);
    getSimulatorLogLevel();

    if (!(feedCheckInterval > 0)) {
      throw new IllegalArgumentException("feedCheckInterval must be positive: " + feedCheckInterval);
    }

    if (simulationDuration != null && !(simulationDuration > 0)) {
      throw new IllegalArgumentException("simulationDuration must be positive: " + simulationDuration);
    }

    if (quantumDevices == null) {
      quantumDevices = new ArrayList<>();
    }

    for (final DeviceConfiguration.QuantumDeviceConfig device : quantumDevices) {
      if (device == null || device.getPreset() == null) {
        throw new IllegalArgumentException("Every quantum device needs a preset.");
      }
    }

    if (feedModule == null) {
      feedModule = parseFeedConfig();
    }

    if (feedModule instanceof GeneratorFeedModule
        && ((GeneratorFeedModule) feedModule).getMaxJobs() == null
        && simulationDuration == null) {
      throw new IllegalArgumentException(
          "The generator feed never drains without maxJobs, set maxJobs or simulationDuration.");
    }
  }

  /**
   * Binds configurations to annotations for dependency injection.
   */
  @Override
  protected void configure() {
    bind(Clock.class).to(SimulatedClock.class);

    bind(Long.class).annotatedWith(RandomSeed.class)
        .toProvider(Providers.of(randomSeed));

    bind(Double.class).annotatedWith(SimulationDuration.class)
        .toProvider(Providers.of(simulationDuration));

    bind(Double.class).annotatedWith(FeedCheckInterval.class)
        .toInstance(feedCheckInterval);

    bind(BrokerType.class).annotatedWith(BrokerStrategy.class)
        .toInstance(BrokerType.fromName(brokerType));

    bind(AllocationMode.class).annotatedWith(BulkAllocationMode.class)
        .toInstance(AllocationMode.fromName(bulkAllocationMode));

    bind(Boolean.class).annotatedWith(IsMetricsOn.class)
        .toInstance(isMetricsOn);

    bind(String.class).annotatedWith(RootMetricsOutputDirectory.class)
        .toProvider(Providers.of(metricsOutputDirectory));

    bind(DeviceConfiguration.class)
        .toInstance(new DeviceConfiguration(quantumDevices, computeDevices));

    if (feedModule != null) {
      LOG.log(Level.INFO, "Feed module already initialized, installing...");
    } else {
      LOG.log(Level.INFO, "Feed module is not available, initializing through parsed value...");
      feedModule = parseFeedConfig();
    }

    install(feedModule);
  }

  public Level getSimulatorLogLevel() {
    try {
      return Level.parse(simulatorLogLevel);
    } catch (final IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid simulatorLogLevel " + simulatorLogLevel, e);
    }
  }

  public void setMetricsOutputDirectory(final String metricsOutputDirectory) {
    this.metricsOutputDirectory = metricsOutputDirectory;
  }

  public void setIsMetricsOn(final boolean isMetricsOn) {
    this.isMetricsOn = isMetricsOn;
  }

  public void setRandomSeed(@Nullable final Long randomSeed) {
    this.randomSeed = randomSeed;
  }

  /**
   * Parses the job feed module to use from the {@code method} key of the feed configuration.
   * @return An {@link AbstractModule} describing parameters for the job feed
   */
  private AbstractModule parseFeedConfig() {
    final Object method = jobFeedConfig == null ? null : jobFeedConfig.get(Constants.FEED_METHOD);
    final Class<? extends AbstractModule> moduleClass = Constants.FEED_MODULE_MAP.get(
        method == null ? GeneratorFeedModule.METHOD : method.toString());
    if (moduleClass == null) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Invalid job feed method {0}, choose from {1}.", method, Constants.FEED_MODULE_MAP.keySet()));
    }

    LOG.log(Level.INFO, MessageFormat.format(
        "Initializing the job feed module: {0}", moduleClass.getName()));

    // Convert the feed config dictionary to JSON then to the specified module class
    final Map<String, Object> moduleConfig = jobFeedConfig == null ? new HashMap<>() : new HashMap<>(jobFeedConfig);
    moduleConfig.remove(Constants.FEED_METHOD);
    try {
      return GSON.fromJson(GSON.toJsonTree(moduleConfig), moduleClass);
    } catch (final JsonParseException e) {
      throw new IllegalArgumentException("Invalid job feed configuration " + jobFeedConfig, e);
    }
  }

  /**
   * This is the reader that reads in the JSON configuration for simulations.
   */
  public final class Reader {
    private Reader() {
    }

    /**
     * Reads in the JSON configuration at the specified {@code configurationPath}.
     *
     * @param configurationPath the configuration path
     * @return {@link SimulatorModule} object
     * @throws IOException when the reader fails to read the file
     * @throws IllegalArgumentException when the configuration is invalid
     */
    public SimulatorModule readConfiguration(final String configurationPath) throws IOException {
      try (java.io.Reader reader = Files.newBufferedReader(Paths.get(configurationPath), StandardCharsets.UTF_8)) {
        final SimulatorModule module = GSON.fromJson(reader, SimulatorModule.class);
        if (module == null) {
          throw new IllegalArgumentException("Empty configuration " + configurationPath);
        }

        module.validate();
        return module;
      } catch (final JsonParseException e) {
        throw new IllegalArgumentException("Malformed configuration " + configurationPath, e);
      }
    }
  }
}
