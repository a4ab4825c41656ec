package org.hybridcloud.dtss.feed;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.hybridcloud.dtss.broker.BrokerFactory;
import org.hybridcloud.dtss.config.parameters.JobArrivalRate;
import org.hybridcloud.dtss.config.parameters.MaxJobs;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.random.RandomGenerator;
import org.hybridcloud.dtss.random.RandomSeeder;
import org.hybridcloud.dtss.time.Clock;

import javax.annotation.Nullable;
import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A job feed that draws random jobs with exponential inter-arrival times.
 * Without a job limit it never runs dry, so the simulation needs a duration.
 */
@Singleton
public final class GeneratorJobFeed extends JobFeed {
  private static final Logger LOG = Logger.getLogger(GeneratorJobFeed.class.getName());

  public static final String METHOD = "generator";

  public static final double DEFAULT_ARRIVAL_RATE = 3D;

  static final int MIN_SHOTS = 10000;
  static final int MAX_SHOTS = 15000;
  static final int MIN_DEPTH = 5;
  static final int MAX_DEPTH = 20;
  static final int MIN_QUBITS = 5;
  static final int MAX_QUBITS = 20;
  static final int MIN_PRIORITY = 1;
  static final int MAX_PRIORITY = 2;

  private final RandomGenerator random;
  private final double arrivalRate;
  private final Integer maxJobs;
  private int nextJobId = 1;

  @Inject
  private GeneratorJobFeed(@Nullable @JobArrivalRate final Double arrivalRate,
                           @Nullable @MaxJobs final Integer maxJobs,
                           final Clock clock,
                           final JobRecordLedger ledger,
                           final BrokerFactory brokerFactory,
                           final RandomSeeder randomSeeder) {
    super(clock, ledger, brokerFactory);
    this.arrivalRate = arrivalRate == null ? DEFAULT_ARRIVAL_RATE : arrivalRate;
    if (!(this.arrivalRate > 0)) {
      throw new IllegalArgumentException("The job arrival rate must be positive: " + arrivalRate);
    }

    if (maxJobs != null && maxJobs < 0) {
      throw new IllegalArgumentException("maxJobs cannot be negative: " + maxJobs);
    }

    this.maxJobs = maxJobs;
    this.random = randomSeeder.newRandomGenerator();
  }

  @VisibleForTesting
  public static GeneratorJobFeed newFeed(@Nullable final Double arrivalRate,
                                         @Nullable final Integer maxJobs,
                                         final Clock clock,
                                         final JobRecordLedger ledger,
                                         final BrokerFactory brokerFactory,
                                         final RandomSeeder randomSeeder) {
    return new GeneratorJobFeed(arrivalRate, maxJobs, clock, ledger, brokerFactory, randomSeeder);
  }

  @Override
  public void start() {
    super.start();
    LOG.log(Level.INFO, MessageFormat.format("Generating jobs at rate {0}, limit {1}.",
        arrivalRate, maxJobs == null ? "none" : maxJobs));
    scheduleNext();
  }

  private void scheduleNext() {
    if (isExhausted()) {
      return;
    }

    clock.scheduleAlarm(random.exponential(arrivalRate), alarm -> {
      dispatch(nextJob());
      scheduleNext();
    });
  }

  @VisibleForTesting
  QuantumJob nextJob() {
    final int numShots = random.randomInt(MIN_SHOTS, MAX_SHOTS);
    final int depth = random.randomInt(MIN_DEPTH, MAX_DEPTH);
    final int numQubits = random.randomInt(MIN_QUBITS, MAX_QUBITS);
    final int priority = random.randomInt(MIN_PRIORITY, MAX_PRIORITY);
    return QuantumJob.Builder.newBuilder()
        .setJobId(nextJobId++)
        .setNumShots(numShots)
        .setDepth(depth)
        .setNumQubits(numQubits)
        .setPriority(priority)
        .setArrivalTime(clock.getTime())
        .build();
  }

  @Override
  protected boolean isExhausted() {
    return maxJobs != null && nextJobId > maxJobs;
  }

  public double getArrivalRate() {
    return arrivalRate;
  }
}
