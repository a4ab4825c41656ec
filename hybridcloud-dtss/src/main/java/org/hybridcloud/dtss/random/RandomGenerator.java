package org.hybridcloud.dtss.random;

import java.text.MessageFormat;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A wrapper around the {@link Random} class with the draws the simulator needs.
 */
public final class RandomGenerator {
  private static final Logger LOG = Logger.getLogger(RandomGenerator.class.getName());

  private final Random random;

  RandomGenerator(final long seed) {
    random = new Random(seed);
    LOG.log(Level.FINE, MessageFormat.format("Initializing RandomGenerator object with seed {0}.", seed));
  }

  /**
   * @return a uniformly drawn integer in {@code [inclusiveMin, inclusiveMax]}
   */
  public int randomInt(final int inclusiveMin, final int inclusiveMax) {
    if (inclusiveMax < inclusiveMin) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Invalid range [{0}, {1}].", inclusiveMin, inclusiveMax));
    }

    return inclusiveMin + random.nextInt(inclusiveMax - inclusiveMin + 1);
  }

  public double randomDouble(final double inclusiveMin, final double inclusiveMax) {
    return inclusiveMin + (inclusiveMax - inclusiveMin) * random.nextDouble();
  }

  /**
   * Draws from an exponential distribution.
   * @param rate the rate, i.e. one over the mean
   */
  public double exponential(final double rate) {
    if (!(rate > 0)) {
      throw new IllegalArgumentException("Rate must be positive: " + rate);
    }

    return -Math.log(1D - random.nextDouble()) / rate;
  }

  public <T> T choice(final List<T> items) {
    if (items.isEmpty()) {
      throw new IllegalArgumentException("Cannot choose from an empty list.");
    }

    return items.get(random.nextInt(items.size()));
  }
}
