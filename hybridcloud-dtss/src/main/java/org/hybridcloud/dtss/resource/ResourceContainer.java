package org.hybridcloud.dtss.resource;

import org.hybridcloud.dtss.exceptions.ResourceException;
import org.hybridcloud.dtss.time.Clock;

import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * A counting semaphore over a bounded integer level in {@code [0, capacity]},
 * modelling qubits, CPU units or memory bandwidth of a device.
 *
 * <p>Waiters are served strictly in arrival order: after every {@link #put(int)} the head of
 * the queue is re-checked against the level, and a later, smaller request never overtakes it.
 * Structural misuse (negative amounts, requests above capacity, releases above capacity)
 * throws {@link ResourceException} synchronously to the caller.</p>
 */
public final class ResourceContainer {
  private final String name;
  private final int capacity;
  private final Clock clock;
  private final Deque<PendingGet> waiters = new ArrayDeque<>();

  private int level;

  public ResourceContainer(final String name, final Clock clock, final int capacity) {
    this(name, clock, capacity, capacity);
  }

  public ResourceContainer(final String name, final Clock clock, final int capacity, final int initialLevel) {
    if (capacity < 0 || initialLevel < 0 || initialLevel > capacity) {
      throw new ResourceException(MessageFormat.format(
          "Invalid container {0}: capacity {1}, initial level {2}.", name, capacity, initialLevel));
    }

    this.name = name;
    this.clock = clock;
    this.capacity = capacity;
    this.level = initialLevel;
  }

  /**
   * Acquires {@code amount} units.
   * @return a future completed once the units have been taken from the level
   * @throws ResourceException if the amount is negative or above capacity
   */
  public CompletableFuture<Void> get(final int amount) {
    if (amount < 0 || amount > capacity) {
      throw new ResourceException(MessageFormat.format(
          "Cannot get {0} units from {1} with capacity {2}.", amount, name, capacity));
    }

    if (waiters.isEmpty() && level >= amount) {
      level -= amount;
      return CompletableFuture.completedFuture(null);
    }

    final PendingGet pending = new PendingGet(amount);
    waiters.addLast(pending);
    return pending.granted;
  }

  /**
   * Returns {@code amount} units and wakes queued waiters in arrival order.
   * @throws ResourceException if the amount is negative or the level would exceed capacity
   */
  public void put(final int amount) {
    if (amount < 0 || level + amount > capacity) {
      throw new ResourceException(MessageFormat.format(
          "Cannot put {0} units into {1} at level {2} with capacity {3}.", amount, name, level, capacity));
    }

    level += amount;

    while (!waiters.isEmpty() && waiters.peekFirst().amount <= level) {
      final PendingGet head = waiters.pollFirst();
      level -= head.amount;
      clock.scheduleAlarm(0, alarm -> head.granted.complete(null));
    }
  }

  public int getLevel() {
    return level;
  }

  public int getCapacity() {
    return capacity;
  }

  public int getWaiterCount() {
    return waiters.size();
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return MessageFormat.format("{0}[{1}/{2}]", name, level, capacity);
  }

  private static final class PendingGet {
    private final int amount;
    private final CompletableFuture<Void> granted = new CompletableFuture<>();

    private PendingGet(final int amount) {
      this.amount = amount;
    }
  }
}
