package org.hybridcloud.dtss.device;

import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.resource.PriorityMutex;
import org.hybridcloud.dtss.time.Clock;

import java.util.concurrent.CompletableFuture;

/**
 * A device of the hybrid cloud. Every device owns a {@link PriorityMutex} that serializes
 * allocation transactions and maintenance on it.
 */
public abstract class Device {
  /**
   * Priority of maintenance on the device mutex.
   */
  public static final int MAINTENANCE_PRIORITY = 1;

  /**
   * Priority of job allocations on the device mutex.
   */
  public static final int JOB_PRIORITY = 2;

  protected final String name;
  protected final Clock clock;
  protected final PriorityMutex mutex;

  protected Device(final String name, final Clock clock) {
    this.name = name;
    this.clock = clock;
    this.mutex = new PriorityMutex(name, clock);
  }

  public String getName() {
    return name;
  }

  public PriorityMutex getMutex() {
    return mutex;
  }

  public abstract DeviceType getType();

  /**
   * @return whether the device currently refuses to admit jobs
   */
  public boolean isUnderMaintenance() {
    return false;
  }

  /**
   * Runs one phase of {@code job} on the device, from admission to the release of its resources.
   * @return a future completed once the device resources have been returned
   */
  public abstract CompletableFuture<Void> processJob(QuantumJob job);

  @Override
  public String toString() {
    return getType() + ":" + name;
  }
}
