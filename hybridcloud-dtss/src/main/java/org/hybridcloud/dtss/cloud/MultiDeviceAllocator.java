package org.hybridcloud.dtss.cloud;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.apache.commons.math3.util.Precision;
import org.hybridcloud.dtss.config.parameters.BulkAllocationMode;
import org.hybridcloud.dtss.device.Device;
import org.hybridcloud.dtss.device.QuantumDevice;
import org.hybridcloud.dtss.exceptions.ResourceException;
import org.hybridcloud.dtss.job.JobPhase;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.time.Clock;
import org.hybridcloud.dtss.time.Poller;
import org.hybridcloud.dtss.topology.TopologyAllocator;

import javax.annotation.Nullable;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the quantum phase of a job that no single QPU can hold by splitting its qubits
 * across several devices. The shares run in lockstep: after every share is held, each
 * adjacent pair of devices exchanges its qubits, then the job runs for the slowest
 * device's processing time. The estimated fidelity is recorded once all shares are released.
 */
@Singleton
public final class MultiDeviceAllocator {
  private static final Logger LOG = Logger.getLogger(MultiDeviceAllocator.class.getName());

  public static final String DEVICE_PROCESS_EVENT = "devc_proc";
  public static final String DEVICE_FINISH_EVENT = "devc_finish";
  public static final String COMM_TIME_EVENT = "comm_time";

  static final double RETRY_INTERVAL = 1D;
  static final double COMM_TIME_PER_QUBIT = 0.02;
  static final double FEEDBACK_DELAY = 0.02;
  static final double COMM_PENALTY = 0.94;

  private final Clock clock;
  private final TopologyAllocator allocator;
  private final JobRecordLedger ledger;
  private final AllocationMode mode;

  @Inject
  public MultiDeviceAllocator(final Clock clock,
                              final TopologyAllocator allocator,
                              final JobRecordLedger ledger,
                              @BulkAllocationMode final AllocationMode mode) {
    this.clock = clock;
    this.allocator = allocator;
    this.ledger = ledger;
    this.mode = mode;
  }

  /**
   * Splits the job across {@code devices} once at least two of them are eligible.
   * @return a future completed with the estimated fidelity once every share has been released
   */
  public CompletableFuture<Double> allocate(final QuantumJob job, final List<QuantumDevice> devices) {
    final int jobId = job.getJobId();
    if (devices.size() < 2) {
      final CompletableFuture<Double> failed = new CompletableFuture<>();
      failed.completeExceptionally(new ResourceException(MessageFormat.format(
          "Job {0} needs {1} qubits but the cloud has fewer than two quantum devices.",
          jobId, job.getNumQubits())));
      return failed;
    }

    ledger.logJobEvent(jobId, JobPhase.QPU.arriveEvent(), Precision.round(clock.getTime(), 4));
    return Poller.pollUntil(clock, RETRY_INTERVAL, () -> findEligible(job, devices),
        () -> LOG.log(Level.FINE, () -> MessageFormat.format(
            "{0}: not enough connected devices for job {1}, retrying.", clock.getTime(), jobId)))
        .thenCompose(eligible -> {
          final List<Share> shares = split(job.getNumQubits(), choose(job.getNumQubits(), eligible));
          return acquireAll(job, shares, 0)
              .whenComplete((v, failure) -> {
                if (failure != null) {
                  releaseHeld(job, shares);
                }
              })
              .thenApply(v -> shares);
        })
        .thenCompose(shares -> {
          ledger.logJobEvent(jobId, JobPhase.QPU.startEvent(), Precision.round(clock.getTime(), 4));
          return communicate(job, shares, 0).thenApply(v -> shares);
        })
        .thenCompose(shares -> {
          double processTime = 0;
          for (final Share share : shares) {
            processTime = Math.max(processTime, share.device.getProfile().processTime(job));
          }

          return clock.timeout(processTime).thenApply(v -> shares);
        })
        .thenApply(shares -> {
          for (final Share share : shares) {
            share.device.getQubits().put(share.qubits);
            allocator.release(share.device.getGraph(), share.nodes);
            ledger.logJobEvent(jobId, DEVICE_FINISH_EVENT, Precision.round(clock.getTime(), 4));
          }

          final double fidelity = estimateFidelity(job, shares);
          ledger.logJobEvent(jobId, QuantumDevice.FIDELITY_EVENT, Precision.round(fidelity, 4));
          return fidelity;
        });
  }

  /**
   * A device is eligible when its free qubits cover an even share over all devices
   * and a qubit set of that size can be selected on it.
   * @return the eligible devices in list order, or null if fewer than two are eligible
   */
  @Nullable
  private List<QuantumDevice> findEligible(final QuantumJob job, final List<QuantumDevice> devices) {
    final int evenShare = ceilDiv(job.getNumQubits(), devices.size());
    final List<QuantumDevice> eligible = new ArrayList<>();
    for (final QuantumDevice device : devices) {
      if (device.getFreeQubits() >= evenShare && allocator.select(device.getGraph(), evenShare) != null) {
        eligible.add(device);
      }
    }

    return eligible.size() < 2 ? null : eligible;
  }

  List<QuantumDevice> choose(final int required, final List<QuantumDevice> eligible) {
    if (mode == AllocationMode.FAST) {
      return eligible;
    }

    final List<QuantumDevice> ranked = new ArrayList<>(eligible);
    ranked.sort(Comparator.comparingDouble(d -> d.getProfile().getErrorScore()));

    int covered = 0;
    for (int i = 0; i < ranked.size(); i++) {
      covered += ranked.get(i).getFreeQubits();
      if (covered >= required) {
        return new ArrayList<>(ranked.subList(0, i + 1));
      }
    }

    return ranked;
  }

  /**
   * Splits evenly, the remainder going one qubit each to the first devices.
   */
  private static List<Share> split(final int required, final List<QuantumDevice> devices) {
    final int base = required / devices.size();
    final int remainder = required % devices.size();
    final List<Share> shares = new ArrayList<>(devices.size());
    for (int i = 0; i < devices.size(); i++) {
      shares.add(new Share(devices.get(i), base + (i < remainder ? 1 : 0)));
    }

    return shares;
  }

  private CompletableFuture<Void> acquireAll(final QuantumJob job, final List<Share> shares, final int index) {
    if (index == shares.size()) {
      return CompletableFuture.completedFuture(null);
    }

    final Share share = shares.get(index);
    return share.device.getMutex()
        .withLease(Device.JOB_PRIORITY, lease -> acquire(job, share))
        .thenCompose(v -> acquireAll(job, shares, index + 1));
  }

  private CompletableFuture<Void> acquire(final QuantumJob job, final Share share) {
    final QuantumDevice device = share.device;
    return device.getQubits().get(share.qubits)
        .thenCompose(v -> {
          share.qubitsHeld = true;
          return Poller.pollUntil(clock, RETRY_INTERVAL,
              () -> allocator.selectAndReserve(device.getGraph(), share.qubits));
        })
        .thenAccept(nodes -> {
          share.nodes = nodes;
          ledger.logJobEvent(job.getJobId(), QuantumDevice.DEVICE_NAME_EVENT, device.getName());
          ledger.logJobEvent(job.getJobId(), DEVICE_PROCESS_EVENT, Precision.round(clock.getTime(), 4));
          LOG.log(Level.FINE, () -> MessageFormat.format("{0}: job {1} holds {2} qubits on {3} (error score {4}).",
              clock.getTime(), job.getJobId(), share.qubits, device.getName(), device.getProfile().getErrorScore()));
        });
  }

  /**
   * Returns the qubits and nodes of every share acquired before a later share failed.
   */
  private void releaseHeld(final QuantumJob job, final List<Share> shares) {
    for (final Share share : shares) {
      if (share.nodes != null) {
        allocator.release(share.device.getGraph(), share.nodes);
        share.nodes = null;
      }

      if (share.qubitsHeld) {
        share.device.getQubits().put(share.qubits);
        share.qubitsHeld = false;
        LOG.log(Level.INFO, () -> MessageFormat.format("{0}: returned {1} qubits of job {2} to {3}.",
            clock.getTime(), share.qubits, job.getJobId(), share.device.getName()));
      }
    }
  }

  /**
   * Exchanges qubits between each adjacent pair of devices in allocation order.
   */
  private CompletableFuture<Void> communicate(final QuantumJob job, final List<Share> shares, final int index) {
    if (index + 1 >= shares.size()) {
      return CompletableFuture.completedFuture(null);
    }

    final double commTime = COMM_TIME_PER_QUBIT * (shares.get(index).qubits + shares.get(index + 1).qubits);
    ledger.logJobEvent(job.getJobId(), COMM_TIME_EVENT, Precision.round(commTime, 4));
    return clock.timeout(commTime)
        .thenCompose(v -> clock.timeout(FEEDBACK_DELAY))
        .thenCompose(v -> communicate(job, shares, index + 1));
  }

  /**
   * The mean single-device estimate over the shares, with the readout term taken over
   * the square root of the even share, times a penalty per device link.
   */
  static double estimateFidelity(final QuantumJob job, final List<Share> shares) {
    final int devices = shares.size();
    final double readoutQubits = Math.sqrt(job.getNumQubits() / devices);
    double sum = 0;
    for (final Share share : shares) {
      sum += share.device.getProfile().estimateFidelity(job.getDepth(), readoutQubits);
    }

    return sum / devices * Math.pow(COMM_PENALTY, devices - 1);
  }

  private static int ceilDiv(final int numerator, final int denominator) {
    return (numerator + denominator - 1) / denominator;
  }

  public AllocationMode getMode() {
    return mode;
  }

  static final class Share {
    private final QuantumDevice device;
    private final int qubits;
    private List<Integer> nodes;
    private boolean qubitsHeld;

    Share(final QuantumDevice device, final int qubits) {
      this.device = device;
      this.qubits = qubits;
    }

    QuantumDevice getDevice() {
      return device;
    }

    int getQubits() {
      return qubits;
    }
  }
}
