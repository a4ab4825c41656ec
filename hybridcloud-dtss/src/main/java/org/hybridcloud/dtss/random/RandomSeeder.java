package org.hybridcloud.dtss.random;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.hybridcloud.dtss.config.parameters.RandomSeed;

import javax.annotation.Nullable;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generates new {@link RandomGenerator} objects with seeds derived from one root seed,
 * so that a fixed seed replays the same simulation.
 */
@Singleton
public final class RandomSeeder {
  private static final Logger LOG = Logger.getLogger(RandomSeeder.class.getName());

  private final Random random;

  @Inject
  private RandomSeeder(@Nullable @RandomSeed final Long seed) {
    if (seed != null) {
      LOG.log(Level.INFO, String.format("Initializing RandomSeeder object with seed %d.", seed));
      this.random = new Random(seed);
    } else {
      LOG.log(Level.INFO, "Initializing RandomSeeder object without a seed.");
      this.random = new Random();
    }
  }

  @VisibleForTesting
  public static RandomSeeder withSeed(@Nullable final Long seed) {
    return new RandomSeeder(seed);
  }

  public RandomGenerator newRandomGenerator() {
    return new RandomGenerator(random.nextLong());
  }
}
