package org.hybridcloud.dtss.broker;

import org.hybridcloud.dtss.device.Device;
import org.hybridcloud.dtss.device.DeviceType;

import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;

/**
 * Schedules one job onto the devices of the cloud. One broker is created per job.
 */
public interface Broker {
  /**
   * @return a device of {@code type} that can take {@code demand} now, or null if there is none
   */
  @Nullable
  Device selectDevice(DeviceType type, ResourceDemand demand);

  /**
   * Runs the job to completion.
   * @return a future completed when the job is done, or exceptionally if it failed
   */
  CompletableFuture<Void> run();
}
