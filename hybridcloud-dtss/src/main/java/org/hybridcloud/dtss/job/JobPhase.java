package org.hybridcloud.dtss.job;

/**
 * The two phases of every job iteration, in execution order.
 * The key prefixes the phase's events in the job record ledger.
 */
public enum JobPhase {
  QPU("qpu"),
  CPU("cpu");

  private final String key;

  JobPhase(final String key) {
    this.key = key;
  }

  public String getKey() {
    return key;
  }

  public String arriveEvent() {
    return key + "_arrive";
  }

  public String startEvent() {
    return key + "_start";
  }

  public String finishEvent() {
    return key + "_finish";
  }
}
