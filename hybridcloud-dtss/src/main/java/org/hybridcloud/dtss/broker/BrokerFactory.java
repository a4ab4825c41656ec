package org.hybridcloud.dtss.broker;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.hybridcloud.dtss.cloud.HybridCloud;
import org.hybridcloud.dtss.cloud.MultiDeviceAllocator;
import org.hybridcloud.dtss.config.parameters.BrokerStrategy;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.metrics.MetricsManager;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.random.RandomGenerator;
import org.hybridcloud.dtss.random.RandomSeeder;
import org.hybridcloud.dtss.time.Clock;

/**
 * Creates the broker of each arriving job with the configured {@link BrokerType}.
 */
@Singleton
public final class BrokerFactory {
  private final BrokerType brokerType;
  private final Clock clock;
  private final HybridCloud cloud;
  private final MultiDeviceAllocator bulkAllocator;
  private final JobRecordLedger ledger;
  private final MetricsManager metricsManager;
  private final RandomGenerator random;

  @Inject
  public BrokerFactory(@BrokerStrategy final BrokerType brokerType,
                       final Clock clock,
                       final HybridCloud cloud,
                       final MultiDeviceAllocator bulkAllocator,
                       final JobRecordLedger ledger,
                       final MetricsManager metricsManager,
                       final RandomSeeder randomSeeder) {
    this.brokerType = brokerType;
    this.clock = clock;
    this.cloud = cloud;
    this.bulkAllocator = bulkAllocator;
    this.ledger = ledger;
    this.metricsManager = metricsManager;
    this.random = randomSeeder.newRandomGenerator();
  }

  public Broker newBroker(final QuantumJob job) {
    switch (brokerType) {
      case CAPACITY_AWARE:
        return new CapacityAwareBroker(job, clock, cloud.getDevices(), bulkAllocator, ledger, metricsManager);
      case SERIAL:
        return new SerialBroker(job, clock, cloud.getDevices(), random, ledger);
      default:
        throw new IllegalArgumentException("Unsupported broker type " + brokerType);
    }
  }

  public BrokerType getBrokerType() {
    return brokerType;
  }
}
