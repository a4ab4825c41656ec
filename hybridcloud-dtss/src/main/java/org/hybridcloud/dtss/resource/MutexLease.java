package org.hybridcloud.dtss.resource;

/**
 * The scoped handle of a {@link PriorityMutex} holder.
 * Closing the lease releases the mutex; closing it again has no effect.
 */
public final class MutexLease implements AutoCloseable {
  private final PriorityMutex mutex;
  private final int priority;
  private boolean released = false;

  MutexLease(final PriorityMutex mutex, final int priority) {
    this.mutex = mutex;
    this.priority = priority;
  }

  public int getPriority() {
    return priority;
  }

  public boolean isReleased() {
    return released;
  }

  public void release() {
    if (released) {
      return;
    }

    released = true;
    mutex.onLeaseReleased(this);
  }

  @Override
  public void close() {
    release();
  }
}
