package org.hybridcloud.dtss.lifecycle;

/**
 * A simulator component with an init/start/stop lifecycle,
 * driven by the {@link org.hybridcloud.dtss.Launcher}.
 */
public abstract class LifeCycle {
  protected LifeCycleState lifeCycleState = LifeCycleState.NOT_INITED;

  public void init() {
    lifeCycleState = lifeCycleState.transition(LifeCycleState.INITED);
  }

  public void start() {
    lifeCycleState = lifeCycleState.transition(LifeCycleState.STARTED);
  }

  public void stop() {
    lifeCycleState = lifeCycleState.transition(LifeCycleState.STOPPED);
  }

  public LifeCycleState getState() {
    return lifeCycleState;
  }
}
