package org.hybridcloud.dtss.stats;

import java.util.Arrays;

/**
 * Summary statistics over a sample of job metrics.
 */
public final class StatUtils {
  private final double[] data;
  private final int size;

  public StatUtils(final double[] data) {
    if (data.length == 0) {
      throw new IllegalArgumentException("Cannot summarize an empty sample.");
    }

    this.data = Arrays.copyOf(data, data.length);
    this.size = data.length;
  }

  public double getVariance() {
    final double mean = getMean();
    double temp = 0;
    for (final double a : data) {
      temp += (a - mean) * (a - mean);
    }

    return temp / size;
  }

  public double getStdDev() {
    return Math.sqrt(getVariance());
  }

  public double getMean() {
    double sum = 0.0;
    for (final double a : data) {
      sum += a;
    }

    return sum / size;
  }

  public double getMedian() {
    final double[] sorted = Arrays.copyOf(data, size);
    Arrays.sort(sorted);
    if (size % 2 == 0) {
      return (sorted[(size / 2) - 1] + sorted[size / 2]) / 2.0;
    }

    return sorted[size / 2];
  }

  public int getSize() {
    return size;
  }
}
