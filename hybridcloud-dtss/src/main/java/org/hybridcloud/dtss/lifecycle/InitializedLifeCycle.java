package org.hybridcloud.dtss.lifecycle;

/**
 * A lifecycle component that is usable as soon as it is constructed.
 */
public abstract class InitializedLifeCycle extends LifeCycle {
  protected InitializedLifeCycle() {
    lifeCycleState = LifeCycleState.INITED;
  }

  @Override
  public void init() {
    // Already initialized on construction
  }
}
