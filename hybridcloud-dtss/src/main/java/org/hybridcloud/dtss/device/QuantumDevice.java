package org.hybridcloud.dtss.device;

import org.apache.commons.math3.util.Precision;
import org.hybridcloud.dtss.event.DeviceEvent;
import org.hybridcloud.dtss.event.DeviceEventBus;
import org.hybridcloud.dtss.event.EventType;
import org.hybridcloud.dtss.exceptions.ResourceException;
import org.hybridcloud.dtss.job.JobPhase;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.resource.ResourceContainer;
import org.hybridcloud.dtss.time.Clock;
import org.hybridcloud.dtss.time.Poller;
import org.hybridcloud.dtss.topology.TopologyAllocator;
import org.hybridcloud.dtss.topology.TopologyGraph;

import java.text.MessageFormat;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A quantum device: a qubit container over its own {@link TopologyGraph}.
 * A job is admitted once the device is out of maintenance and the allocator finds
 * enough free qubits, holds them for the profile's processing time and then gives them back.
 */
public final class QuantumDevice extends Device {
  private static final Logger LOG = Logger.getLogger(QuantumDevice.class.getName());

  public static final String DEVICE_NAME_EVENT = "devc_name";
  public static final String QPU_UNITS_EVENT = "qpu_units";
  public static final String FIDELITY_EVENT = "fidelity";

  static final double ADMISSION_RETRY_INTERVAL = 1D;

  private final DeviceProfile profile;
  private final TopologyGraph graph;
  private final ResourceContainer qubits;
  private final TopologyAllocator allocator;
  private final JobRecordLedger ledger;
  private final DeviceEventBus eventBus;

  private boolean maintLock = false;

  public QuantumDevice(final String name,
                       final DeviceProfile profile,
                       final Clock clock,
                       final TopologyAllocator allocator,
                       final JobRecordLedger ledger,
                       final DeviceEventBus eventBus) {
    super(name, clock);
    this.profile = profile;
    this.graph = profile.getTopology().build();
    this.qubits = new ResourceContainer(name + "-qubits", clock, graph.getQubitCount());
    this.allocator = allocator;
    this.ledger = ledger;
    this.eventBus = eventBus;
  }

  @Override
  public DeviceType getType() {
    return DeviceType.QPU;
  }

  @Override
  public CompletableFuture<Void> processJob(final QuantumJob job) {
    final int jobId = job.getJobId();
    final int required = job.getNumQubits();
    if (required > graph.getQubitCount()) {
      final CompletableFuture<Void> failed = new CompletableFuture<>();
      failed.completeExceptionally(new ResourceException(MessageFormat.format(
          "Job {0} needs {1} qubits, {2} only has {3}.", jobId, required, name, graph.getQubitCount())));
      return failed;
    }

    LOG.log(Level.FINE, () -> MessageFormat.format("{0}: {1} received job {2} requiring {3} qubits, {4} free.",
        clock.getTime(), name, jobId, required, qubits.getLevel()));
    ledger.logJobEvent(jobId, DEVICE_NAME_EVENT, name);
    ledger.logJobEvent(jobId, JobPhase.QPU.arriveEvent(), Precision.round(clock.getTime(), 4));
    eventBus.publish(EventType.DEVICE_START, new DeviceEvent(name, jobId, clock.getTime()));

    return admit(job).thenCompose(nodes -> {
      ledger.logJobEvent(jobId, QPU_UNITS_EVENT, required);
      ledger.logJobEvent(jobId, JobPhase.QPU.startEvent(), Precision.round(clock.getTime(), 4));
      final double processTime = profile.processTime(job);
      LOG.log(Level.FINE, () -> MessageFormat.format("{0}: job {1} takes {2} on {3}.",
          clock.getTime(), jobId, processTime, name));
      return clock.timeout(processTime).thenApply(v -> nodes);
    }).thenAccept(nodes -> {
      eventBus.publish(EventType.DEVICE_FINISH, new DeviceEvent(name, jobId, clock.getTime()));
      qubits.put(required);
      allocator.release(graph, nodes);
      LOG.log(Level.FINE, () -> MessageFormat.format("{0}: job {1} completed on {2}.", clock.getTime(), jobId, name));
    });
  }

  /**
   * Polls until a qubit set can be selected, takes the units and reserves the set.
   * If the set was taken meanwhile and no other set fits, the units go back and polling resumes.
   */
  private CompletableFuture<List<Integer>> admit(final QuantumJob job) {
    final int required = job.getNumQubits();
    return Poller.pollUntil(clock, ADMISSION_RETRY_INTERVAL,
        () -> maintLock ? null : allocator.select(graph, required),
        () -> LOG.log(Level.FINER, () -> MessageFormat.format(
            "{0}: job {1} is waiting for {2}.", clock.getTime(), job.getJobId(), name)))
        .thenCompose(selected -> qubits.get(required)
            .thenApply(v -> allocator.reserveOrReselect(graph, selected)))
        .thenCompose(nodes -> {
          if (nodes != null) {
            return CompletableFuture.completedFuture(nodes);
          }

          qubits.put(required);
          return clock.timeout(ADMISSION_RETRY_INTERVAL).thenCompose(v -> admit(job));
        });
  }

  /**
   * Estimates the fidelity of {@code job} run entirely on this device and records it.
   */
  public double estimateFidelity(final QuantumJob job) {
    final double fidelity = profile.estimateFidelity(job.getDepth(), job.getNumQubits());
    ledger.logJobEvent(job.getJobId(), FIDELITY_EVENT, Precision.round(fidelity, 4));
    return fidelity;
  }

  @Override
  public boolean isUnderMaintenance() {
    return maintLock;
  }

  void setMaintLock(final boolean maintLock) {
    this.maintLock = maintLock;
  }

  public DeviceProfile getProfile() {
    return profile;
  }

  public int getQubitCount() {
    return graph.getQubitCount();
  }

  public int getFreeQubits() {
    return qubits.getLevel();
  }

  /**
   * The qubit container. Also used by the multi-device allocator to take shares directly.
   */
  public ResourceContainer getQubits() {
    return qubits;
  }

  public TopologyGraph getGraph() {
    return graph;
  }
}
