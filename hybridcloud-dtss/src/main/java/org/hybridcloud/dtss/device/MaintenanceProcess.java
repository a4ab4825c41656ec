package org.hybridcloud.dtss.device;

import org.hybridcloud.dtss.random.RandomGenerator;
import org.hybridcloud.dtss.time.Clock;

import java.text.MessageFormat;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically takes a quantum device out of service. After a random warm-up, each cycle waits
 * the maintenance interval, closes the device to new jobs, holds its mutex at maintenance
 * priority for the maintenance duration and reopens it. Jobs already holding qubits keep running.
 */
public final class MaintenanceProcess {
  private static final Logger LOG = Logger.getLogger(MaintenanceProcess.class.getName());

  static final int MIN_WARM_UP = 60;
  static final int MAX_WARM_UP = 120;

  private final QuantumDevice device;
  private final Clock clock;
  private final double interval;
  private final double duration;
  private final RandomGenerator random;

  private int completedCycles = 0;

  public MaintenanceProcess(final QuantumDevice device,
                            final Clock clock,
                            final double interval,
                            final double duration,
                            final RandomGenerator random) {
    if (!(interval > 0) || !(duration > 0)) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Maintenance of {0} needs a positive interval and duration, got {1} and {2}.",
          device.getName(), interval, duration));
    }

    this.device = device;
    this.clock = clock;
    this.interval = interval;
    this.duration = duration;
    this.random = random;
  }

  public void start() {
    final int warmUp = random.randomInt(MIN_WARM_UP, MAX_WARM_UP);
    LOG.log(Level.INFO, MessageFormat.format(
        "Maintenance of {0} starts after {1}, every {2} for {3}.", device.getName(), warmUp, interval, duration));
    clock.timeout(warmUp).thenRun(this::nextCycle);
  }

  private void nextCycle() {
    clock.timeout(interval)
        .thenCompose(v -> runMaintenance())
        .whenComplete((v, e) -> {
          if (e != null) {
            LOG.log(Level.SEVERE, "Maintenance of " + device.getName() + " failed.", e);
            return;
          }

          completedCycles++;
          nextCycle();
        });
  }

  private CompletableFuture<Void> runMaintenance() {
    device.setMaintLock(true);
    LOG.log(Level.FINE, () -> MessageFormat.format("{0}: {1} enters maintenance.", clock.getTime(), device.getName()));
    return device.getMutex().withLease(Device.MAINTENANCE_PRIORITY, lease -> clock.timeout(duration)
        .thenRun(() -> {
          device.setMaintLock(false);
          LOG.log(Level.FINE, () -> MessageFormat.format(
              "{0}: {1} leaves maintenance.", clock.getTime(), device.getName()));
        }));
  }

  public int getCompletedCycles() {
    return completedCycles;
  }
}
