package org.hybridcloud.dtss.broker;

import org.apache.commons.math3.util.Precision;
import org.hybridcloud.dtss.device.Device;
import org.hybridcloud.dtss.device.DeviceType;
import org.hybridcloud.dtss.job.JobPhase;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.random.RandomGenerator;
import org.hybridcloud.dtss.time.Clock;
import org.hybridcloud.dtss.time.Poller;

import javax.annotation.Nullable;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends the job once to a uniformly random device, waiting out its maintenance,
 * and runs it under the device mutex. No phases, iterations or capacity checks.
 */
public final class SerialBroker implements Broker {
  private static final Logger LOG = Logger.getLogger(SerialBroker.class.getName());

  static final double MAINTENANCE_RETRY_INTERVAL = 1D;

  private final QuantumJob job;
  private final Clock clock;
  private final List<Device> devices;
  private final RandomGenerator random;
  private final JobRecordLedger ledger;

  public SerialBroker(final QuantumJob job,
                      final Clock clock,
                      final List<? extends Device> devices,
                      final RandomGenerator random,
                      final JobRecordLedger ledger) {
    this.job = job;
    this.clock = clock;
    this.devices = new ArrayList<>(devices);
    this.random = random;
    this.ledger = ledger;
  }

  /**
   * @param type the device type to draw from, or null for any device
   */
  @Override
  @Nullable
  public Device selectDevice(@Nullable final DeviceType type, final ResourceDemand demand) {
    final List<Device> candidates = new ArrayList<>();
    for (final Device device : devices) {
      if (type == null || device.getType() == type) {
        candidates.add(device);
      }
    }

    return candidates.isEmpty() ? null : random.choice(candidates);
  }

  @Override
  public CompletableFuture<Void> run() {
    final Device device = selectDevice(null, ResourceDemand.qubits(job.getNumQubits()));
    if (device == null) {
      final CompletableFuture<Void> failed = new CompletableFuture<>();
      failed.completeExceptionally(new IllegalStateException("The cloud has no devices."));
      return failed;
    }

    final JobPhase phase = device.getType() == DeviceType.QPU ? JobPhase.QPU : JobPhase.CPU;
    job.setPhase(phase);
    return Poller.pollUntil(clock, MAINTENANCE_RETRY_INTERVAL,
        () -> device.isUnderMaintenance() ? null : device,
        () -> LOG.log(Level.FINE, () -> MessageFormat.format("{0}: job {1} waiting, {2} under maintenance.",
            clock.getTime(), job.getJobId(), device.getName())))
        .thenCompose(d -> d.getMutex().withLease(Device.JOB_PRIORITY, lease -> d.processJob(job)))
        .thenRun(() -> {
          ledger.logJobEvent(job.getJobId(), phase.finishEvent(), Precision.round(clock.getTime(), 4));
          job.completeIteration();
        });
  }
}
