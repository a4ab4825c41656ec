package org.hybridcloud.dtss.broker;

import com.codahale.metrics.Timer;
import org.apache.commons.math3.util.Precision;
import org.hybridcloud.dtss.cloud.MultiDeviceAllocator;
import org.hybridcloud.dtss.device.ComputeDevice;
import org.hybridcloud.dtss.device.Device;
import org.hybridcloud.dtss.device.DeviceType;
import org.hybridcloud.dtss.device.QuantumDevice;
import org.hybridcloud.dtss.job.JobPhase;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.metrics.MetricsManager;
import org.hybridcloud.dtss.metrics.job.JobRecord;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.time.Clock;
import org.hybridcloud.dtss.time.Poller;

import javax.annotation.Nullable;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs every iteration of a job as a quantum phase then a classical phase, each on the device
 * of its type with the most free capacity. When no device qualifies the broker polls again
 * every {@value #SELECTION_RETRY_INTERVAL}. A job larger than every QPU runs its quantum phase
 * through the {@link MultiDeviceAllocator}.
 *
 * <p>After each phase the broker records its finish time and the phase's wait, service
 * and turnaround under iteration-indexed keys. After the last iteration it records the makespan.</p>
 */
public final class CapacityAwareBroker implements Broker {
  private static final Logger LOG = Logger.getLogger(CapacityAwareBroker.class.getName());

  static final double SELECTION_RETRY_INTERVAL = 0.5;

  private final QuantumJob job;
  private final Clock clock;
  private final List<Device> devices;
  private final MultiDeviceAllocator bulkAllocator;
  private final JobRecordLedger ledger;
  private final MetricsManager metricsManager;

  private BrokerState state = BrokerState.ARRIVED;

  public CapacityAwareBroker(final QuantumJob job,
                             final Clock clock,
                             final List<? extends Device> devices,
                             final MultiDeviceAllocator bulkAllocator,
                             final JobRecordLedger ledger,
                             final MetricsManager metricsManager) {
    this.job = job;
    this.clock = clock;
    this.devices = new ArrayList<>(devices);
    this.bulkAllocator = bulkAllocator;
    this.ledger = ledger;
    this.metricsManager = metricsManager;
  }

  @Override
  public CompletableFuture<Void> run() {
    final Timer.Context jobTimer = metricsManager.startJobTimer();
    transition(BrokerState.SELECT_QPU);
    return runIteration().whenComplete((v, e) -> {
      jobTimer.stop();
      if (e != null && !state.isTerminal()) {
        transition(BrokerState.FAILED);
      }
    });
  }

  private CompletableFuture<Void> runIteration() {
    return runQuantumPhase()
        .thenCompose(v -> {
          transition(BrokerState.SELECT_CPU);
          return runClassicalPhase();
        })
        .thenCompose(v -> {
          job.completeIteration();
          LOG.log(Level.FINE, () -> MessageFormat.format("{0}: job {1} iteration {2}/{3} complete.",
              clock.getTime(), job.getJobId(), job.getIteration(), job.getIterations()));
          if (!job.isLastIterationDone()) {
            transition(BrokerState.SELECT_QPU);
            return runIteration();
          }

          recordMakespan();
          transition(BrokerState.DONE);
          return CompletableFuture.completedFuture(null);
        });
  }

  private CompletableFuture<Void> runQuantumPhase() {
    job.setPhase(JobPhase.QPU);
    final List<QuantumDevice> quantumDevices = getQuantumDevices();
    if (!fitsAnyQuantumDevice(quantumDevices)) {
      LOG.log(Level.FINE, () -> MessageFormat.format(
          "Job {0} needs {1} qubits, more than any single QPU, splitting it across devices.",
          job.getJobId(), job.getNumQubits()));
      transition(BrokerState.QPU_RUN);
      return bulkAllocator.allocate(job, quantumDevices).thenRun(() -> completePhase(JobPhase.QPU));
    }

    return awaitDevice(DeviceType.QPU, ResourceDemand.of(JobPhase.QPU, job))
        .thenCompose(device -> {
          transition(BrokerState.QPU_RUN);
          final QuantumDevice qpu = (QuantumDevice) device;
          return qpu.processJob(job).thenRun(() -> {
            completePhase(JobPhase.QPU);
            qpu.estimateFidelity(job);
          });
        });
  }

  private CompletableFuture<Void> runClassicalPhase() {
    job.setPhase(JobPhase.CPU);
    return awaitDevice(DeviceType.CPU, ResourceDemand.of(JobPhase.CPU, job))
        .thenCompose(device -> {
          transition(BrokerState.CPU_RUN);
          return device.processJob(job);
        })
        .thenRun(() -> completePhase(JobPhase.CPU));
  }

  private CompletableFuture<Device> awaitDevice(final DeviceType type, final ResourceDemand demand) {
    return Poller.pollUntil(clock, SELECTION_RETRY_INTERVAL, () -> selectDevice(type, demand),
        () -> metricsManager.onSelectionRetry(type));
  }

  /**
   * Picks the device with the most free capacity among those of {@code type} that are out of
   * maintenance and can take {@code demand}. CPU ties go to the most free memory bandwidth,
   * remaining ties to the first device in list order.
   */
  @Override
  @Nullable
  public Device selectDevice(final DeviceType type, final ResourceDemand demand) {
    Device best = null;
    for (final Device device : devices) {
      if (device.getType() != type || device.isUnderMaintenance() || !canTake(device, demand)) {
        continue;
      }

      if (best == null || hasMoreFree(device, best)) {
        best = device;
      }
    }

    return best;
  }

  private static boolean canTake(final Device device, final ResourceDemand demand) {
    if (device instanceof QuantumDevice) {
      final QuantumDevice qpu = (QuantumDevice) device;
      return qpu.getFreeQubits() >= demand.getQubits() && qpu.getQubitCount() >= demand.getQubits();
    }

    final ComputeDevice cpu = (ComputeDevice) device;
    return cpu.getCpuUnits().getLevel() >= demand.getCpuUnits() && cpu.getMemBw().getLevel() >= demand.getMemBw();
  }

  private static boolean hasMoreFree(final Device candidate, final Device best) {
    if (candidate instanceof QuantumDevice) {
      return ((QuantumDevice) candidate).getFreeQubits() > ((QuantumDevice) best).getFreeQubits();
    }

    final ComputeDevice c = (ComputeDevice) candidate;
    final ComputeDevice b = (ComputeDevice) best;
    if (c.getCpuUnits().getLevel() != b.getCpuUnits().getLevel()) {
      return c.getCpuUnits().getLevel() > b.getCpuUnits().getLevel();
    }

    return c.getMemBw().getLevel() > b.getMemBw().getLevel();
  }

  private List<QuantumDevice> getQuantumDevices() {
    final List<QuantumDevice> quantumDevices = new ArrayList<>();
    for (final Device device : devices) {
      if (device instanceof QuantumDevice) {
        quantumDevices.add((QuantumDevice) device);
      }
    }

    return quantumDevices;
  }

  private boolean fitsAnyQuantumDevice(final List<QuantumDevice> quantumDevices) {
    for (final QuantumDevice device : quantumDevices) {
      if (device.getQubitCount() >= job.getNumQubits()) {
        return true;
      }
    }

    return false;
  }

  private void completePhase(final JobPhase phase) {
    ledger.logJobEvent(job.getJobId(), phase.finishEvent(), Precision.round(clock.getTime(), 4));
    recordPhaseMetrics(phase, job.getIteration());
  }

  /**
   * Records wait, service and turnaround of the latest run of {@code phase}.
   * Missing timestamps are logged and skipped.
   */
  private void recordPhaseMetrics(final JobPhase phase, final int iteration) {
    final JobRecord record = ledger.getRecord(job.getJobId());
    final OptionalDouble arrive = record == null ? OptionalDouble.empty() : record.getLastTime(phase.arriveEvent());
    final OptionalDouble start = record == null ? OptionalDouble.empty() : record.getLastTime(phase.startEvent());
    final OptionalDouble finish = record == null ? OptionalDouble.empty() : record.getLastTime(phase.finishEvent());
    if (!arrive.isPresent() || !start.isPresent() || !finish.isPresent()) {
      LOG.log(Level.WARNING, MessageFormat.format(
          "{0}: missing timestamps for job {1} {2} (arrive={3}, start={4}, finish={5}).",
          clock.getTime(), job.getJobId(), phase, arrive, start, finish));
      return;
    }

    final double wait = Precision.round(start.getAsDouble() - arrive.getAsDouble(), 4);
    final double service = Precision.round(finish.getAsDouble() - start.getAsDouble(), 4);
    final double turnaround = Precision.round(finish.getAsDouble() - arrive.getAsDouble(), 4);
    final String prefix = phase.getKey();
    ledger.logJobEvent(job.getJobId(), prefix + "_wait_" + iteration, wait);
    ledger.logJobEvent(job.getJobId(), prefix + "_svc_" + iteration, service);
    ledger.logJobEvent(job.getJobId(), prefix + "_turn_" + iteration, turnaround);
    metricsManager.onPhaseCompleted(phase, wait, service, turnaround);
    LOG.log(Level.FINE, () -> MessageFormat.format(
        "{0}: job {1} {2} metrics (iteration {3}): wait={4}, svc={5}, turn={6}",
        clock.getTime(), job.getJobId(), phase, iteration, wait, service, turnaround));
  }

  /**
   * Makespan runs from the job's arrival, or its first quantum arrival if the arrival
   * was not recorded, to its last classical finish.
   */
  private void recordMakespan() {
    final JobRecord record = ledger.getRecord(job.getJobId());
    if (record == null) {
      return;
    }

    OptionalDouble begin = record.getFirstTime(JobRecordLedger.ARRIVAL_EVENT);
    if (!begin.isPresent()) {
      begin = record.getFirstTime(JobPhase.QPU.arriveEvent());
    }

    final OptionalDouble end = record.getLastTime(JobPhase.CPU.finishEvent());
    if (!begin.isPresent() || !end.isPresent()) {
      LOG.log(Level.WARNING, "Cannot compute the makespan of job " + job.getJobId());
      return;
    }

    final double makespan = Precision.round(end.getAsDouble() - begin.getAsDouble(), 4);
    ledger.logJobEvent(job.getJobId(), JobRecordLedger.MAKESPAN_EVENT, makespan);
    LOG.log(Level.FINE, () -> MessageFormat.format("{0}: job {1} makespan {2}.",
        clock.getTime(), job.getJobId(), makespan));
  }

  private void transition(final BrokerState to) {
    state = state.transition(to);
  }

  public BrokerState getState() {
    return state;
  }
}
