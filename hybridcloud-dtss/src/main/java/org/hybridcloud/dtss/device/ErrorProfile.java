package org.hybridcloud.dtss.device;

import java.text.MessageFormat;

/**
 * Calibration-derived average error rates of a quantum device.
 */
public final class ErrorProfile {
  private final double avgSingleQubitError;
  private final double avgReadoutError;
  private final double avgTwoQubitError;

  public ErrorProfile(final double avgSingleQubitError,
                      final double avgReadoutError,
                      final double avgTwoQubitError) {
    checkRate(avgSingleQubitError, "single qubit");
    checkRate(avgReadoutError, "readout");
    checkRate(avgTwoQubitError, "two qubit");
    this.avgSingleQubitError = avgSingleQubitError;
    this.avgReadoutError = avgReadoutError;
    this.avgTwoQubitError = avgTwoQubitError;
  }

  private static void checkRate(final double rate, final String kind) {
    if (!(rate >= 0 && rate <= 1)) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Average {0} error must be in [0, 1], got {1}.", kind, rate));
    }
  }

  public double getAvgSingleQubitError() {
    return avgSingleQubitError;
  }

  public double getAvgReadoutError() {
    return avgReadoutError;
  }

  public double getAvgTwoQubitError() {
    return avgTwoQubitError;
  }

  /**
   * @return the mean of the three averages, used to rank devices when no score is configured
   */
  public double getMeanError() {
    return (avgSingleQubitError + avgReadoutError + avgTwoQubitError) / 3D;
  }

  @Override
  public String toString() {
    return String.format("single=%.6f, readout=%.6f, twoQubit=%.6f",
        avgSingleQubitError, avgReadoutError, avgTwoQubitError);
  }
}
