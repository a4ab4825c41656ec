package org.hybridcloud.dtss.metrics;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.hybridcloud.dtss.config.parameters.IsMetricsOn;
import org.hybridcloud.dtss.config.parameters.RootMetricsOutputDirectory;
import org.hybridcloud.dtss.config.parameters.RunId;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Where, and whether, a run writes its result files.
 */
@Singleton
public final class MetricsConfiguration {
  private final String runId;
  private final String metricsOutputDir;
  private final boolean isMetricsOn;

  @Inject
  private MetricsConfiguration(
      @IsMetricsOn final boolean isMetricsOn,
      @RunId final String runId,
      @Nullable @RootMetricsOutputDirectory final String rootMetricsOutputDir) {
    this.runId = runId;
    this.isMetricsOn = isMetricsOn;

    if (isMetricsOn) {
      if (rootMetricsOutputDir == null || rootMetricsOutputDir.trim().isEmpty()) {
        throw new IllegalArgumentException("RootMetricsOutputDirectory must be configured if metrics is on!");
      }

      this.metricsOutputDir = Paths.get(rootMetricsOutputDir, runId).toString();
    } else {
      this.metricsOutputDir = null;
    }
  }

  public static MetricsConfiguration metricsOff() {
    return new MetricsConfiguration(false, "none", null);
  }

  /**
   * Creates the run's output directory if metrics are on.
   */
  public void createMetricsDirectory() {
    if (!isMetricsOn) {
      return;
    }

    try {
      Files.createDirectories(Paths.get(metricsOutputDir));
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Nullable
  public String getMetricsFilePath(final String... pathNames) {
    if (isMetricsOn) {
      return Paths.get(metricsOutputDir, pathNames).toAbsolutePath().toString();
    }

    return null;
  }

  public String getRunId() {
    return runId;
  }

  public boolean isMetricsOn() {
    return isMetricsOn;
  }
}
