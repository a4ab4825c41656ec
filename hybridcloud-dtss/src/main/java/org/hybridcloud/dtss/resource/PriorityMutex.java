package org.hybridcloud.dtss.resource;

import org.hybridcloud.dtss.exceptions.StateException;
import org.hybridcloud.dtss.time.Clock;

import java.text.MessageFormat;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A single-holder lock whose waiters are served by priority, lowest number first,
 * then by arrival order. Used to serialize allocation transactions on a device.
 * Ownership passes to the next waiter at release time; the waiter itself is resumed
 * by the clock at the same simulation time, after the releasing process continues.
 */
public final class PriorityMutex {
  private static final Comparator<Waiter> WAITER_ORDER =
      Comparator.<Waiter>comparingInt(w -> w.priority).thenComparingLong(w -> w.arrival);

  private final String name;
  private final Clock clock;
  private final PriorityQueue<Waiter> waiters = new PriorityQueue<>(WAITER_ORDER);

  private long nextArrival = 0;
  private MutexLease holder = null;

  public PriorityMutex(final String name, final Clock clock) {
    this.name = name;
    this.clock = clock;
  }

  /**
   * Requests the mutex.
   * @param priority the request priority, a lower number is served first
   * @return a future completed with the lease once this request holds the mutex
   */
  public CompletableFuture<MutexLease> request(final int priority) {
    if (holder == null && waiters.isEmpty()) {
      holder = new MutexLease(this, priority);
      return CompletableFuture.completedFuture(holder);
    }

    final Waiter waiter = new Waiter(priority, nextArrival++);
    waiters.add(waiter);
    return waiter.granted;
  }

  /**
   * Runs {@code body} while holding the mutex. The lease is released when the future
   * returned by {@code body} completes, normally or exceptionally,
   * or when {@code body} itself throws.
   */
  public <T> CompletableFuture<T> withLease(
      final int priority, final Function<MutexLease, CompletableFuture<T>> body) {
    return request(priority).thenCompose(lease -> {
      final CompletableFuture<T> scope;
      try {
        scope = body.apply(lease);
      } catch (final RuntimeException e) {
        lease.release();
        throw e;
      }

      return scope.whenComplete((result, failure) -> lease.release());
    });
  }

  void onLeaseReleased(final MutexLease lease) {
    if (lease != holder) {
      throw new StateException(MessageFormat.format(
          "Lease released on mutex {0} is not the current holder.", name));
    }

    final Waiter next = waiters.poll();
    if (next == null) {
      holder = null;
      return;
    }

    final MutexLease nextLease = new MutexLease(this, next.priority);
    holder = nextLease;
    clock.scheduleAlarm(0, alarm -> next.granted.complete(nextLease));
  }

  public boolean isLocked() {
    return holder != null;
  }

  public int getQueueLength() {
    return waiters.size();
  }

  public String getName() {
    return name;
  }

  private static final class Waiter {
    private final int priority;
    private final long arrival;
    private final CompletableFuture<MutexLease> granted = new CompletableFuture<>();

    private Waiter(final int priority, final long arrival) {
      this.priority = priority;
      this.arrival = arrival;
    }
  }
}
