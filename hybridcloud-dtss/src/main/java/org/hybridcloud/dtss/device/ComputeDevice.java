package org.hybridcloud.dtss.device;

import org.apache.commons.math3.util.Precision;
import org.hybridcloud.dtss.event.DeviceEvent;
import org.hybridcloud.dtss.event.DeviceEventBus;
import org.hybridcloud.dtss.event.EventType;
import org.hybridcloud.dtss.exceptions.ResourceException;
import org.hybridcloud.dtss.job.JobPhase;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.random.RandomGenerator;
import org.hybridcloud.dtss.resource.ResourceContainer;
import org.hybridcloud.dtss.time.Clock;

import java.text.MessageFormat;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A classical device with two containers, CPU units and memory bandwidth.
 * A job takes a random number of CPU units and its memory bandwidth for a random duration.
 */
public final class ComputeDevice extends Device {
  private static final Logger LOG = Logger.getLogger(ComputeDevice.class.getName());

  public static final String CPU_UNITS_EVENT = "cpu_units";
  public static final String CPU_MEM_BW_EVENT = "cpu_mem_bw";

  static final int MIN_CPU_UNITS = 4;
  static final int MAX_CPU_UNITS = 10;
  static final double MIN_DURATION = 1D;
  static final double MAX_DURATION = 3D;

  private final ResourceContainer cpuUnits;
  private final ResourceContainer memBw;
  private final RandomGenerator random;
  private final JobRecordLedger ledger;
  private final DeviceEventBus eventBus;

  public ComputeDevice(final String name,
                       final int cpuCapacity,
                       final int memBwCapacity,
                       final Clock clock,
                       final RandomGenerator random,
                       final JobRecordLedger ledger,
                       final DeviceEventBus eventBus) {
    super(name, clock);
    this.cpuUnits = new ResourceContainer(name + "-cpu", clock, cpuCapacity);
    this.memBw = new ResourceContainer(name + "-mem-bw", clock, memBwCapacity);
    this.random = random;
    this.ledger = ledger;
    this.eventBus = eventBus;
  }

  @Override
  public DeviceType getType() {
    return DeviceType.CPU;
  }

  @Override
  public CompletableFuture<Void> processJob(final QuantumJob job) {
    final int jobId = job.getJobId();
    ledger.logJobEvent(jobId, QuantumDevice.DEVICE_NAME_EVENT, name);
    ledger.logJobEvent(jobId, JobPhase.CPU.arriveEvent(), Precision.round(clock.getTime(), 4));

    final double duration = random.randomDouble(MIN_DURATION, MAX_DURATION);
    final int units = random.randomInt(MIN_CPU_UNITS, MAX_CPU_UNITS);
    final int bandwidth = job.getMemBw();
    ledger.logJobEvent(jobId, CPU_UNITS_EVENT, units);
    ledger.logJobEvent(jobId, CPU_MEM_BW_EVENT, bandwidth);

    final CompletableFuture<Void> held;
    try {
      held = cpuUnits.get(units).thenCompose(v -> acquireMemBw(units, bandwidth));
    } catch (final ResourceException e) {
      final CompletableFuture<Void> failed = new CompletableFuture<>();
      failed.completeExceptionally(e);
      return failed;
    }

    return held.thenCompose(v -> {
      ledger.logJobEvent(jobId, JobPhase.CPU.startEvent(), Precision.round(clock.getTime(), 4));
      LOG.log(Level.FINE, () -> MessageFormat.format("{0}: job {1} runs on {2} for {3}.",
          clock.getTime(), jobId, name, duration));
      return clock.timeout(duration);
    }).thenRun(() -> {
      eventBus.publish(EventType.DEVICE_FINISH, new DeviceEvent(name, jobId, clock.getTime()));
      cpuUnits.put(units);
      memBw.put(bandwidth);
    });
  }

  /**
   * Takes the memory bandwidth once the CPU units are held, giving the units back
   * if the bandwidth request is structurally invalid.
   */
  private CompletableFuture<Void> acquireMemBw(final int units, final int bandwidth) {
    try {
      return memBw.get(bandwidth);
    } catch (final ResourceException e) {
      LOG.log(Level.WARNING, MessageFormat.format(
          "Returning {0} CPU units to {1} after a failed bandwidth request.", units, name));
      cpuUnits.put(units);
      throw e;
    }
  }

  public ResourceContainer getCpuUnits() {
    return cpuUnits;
  }

  public ResourceContainer getMemBw() {
    return memBw;
  }
}
