package org.hybridcloud.dtss.metrics.job;

/**
 * The state of a job when the simulation ended.
 */
public enum JobEndState {
  NOT_ARRIVED,
  IN_PROGRESS,
  COMPLETED,
  FAILED
}
