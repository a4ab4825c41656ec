package org.hybridcloud.dtss.job;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.annotations.SerializedName;

import javax.annotation.Nullable;
import java.text.MessageFormat;

/**
 * A hybrid job: an iterative loop of a quantum circuit execution followed by classical
 * post-processing. The descriptor is immutable; the broker advances its phase and iteration.
 * Deserialized from the job feed through its {@link Builder}.
 */
public final class QuantumJob {
  public static final int DEFAULT_ITERATIONS = 1;
  public static final int DEFAULT_CPU_UNITS = 8;
  public static final int DEFAULT_MEM_BW = 20;

  public static final class Constants {
    public static final String JOB_ID = "job_id";

    public static final String NUM_QUBITS = "num_qubits";

    public static final String DEPTH = "depth";

    public static final String NUM_SHOTS = "num_shots";

    public static final String PRIORITY = "priority";

    public static final String ARRIVAL_TIME = "arrival_time";

    public static final String ITERATIONS = "iterations";

    public static final String CPU_UNITS = "cpu_units";

    public static final String MEM_BW = "mem_bw";

    private Constants() {
    }
  }

  @VisibleForTesting
  public static final class Builder {
    @SerializedName(Constants.JOB_ID)
    private Integer jobId;

    @SerializedName(Constants.NUM_QUBITS)
    private Integer numQubits;

    @SerializedName(Constants.DEPTH)
    private Integer depth;

    @SerializedName(Constants.NUM_SHOTS)
    private Integer numShots;

    @SerializedName(Constants.PRIORITY)
    private Integer priority;

    // Blank means the job arrives when it is read
    @SerializedName(Constants.ARRIVAL_TIME)
    private Double arrivalTime;

    @SerializedName(Constants.ITERATIONS)
    private Integer iterations;

    @SerializedName(Constants.CPU_UNITS)
    private Integer cpuUnits;

    @SerializedName(Constants.MEM_BW)
    private Integer memBw;

    public static Builder newBuilder() {
      return new Builder();
    }

    public Builder setJobId(final Integer jobId) {
      this.jobId = jobId;
      return this;
    }

    public Builder setNumQubits(final Integer numQubits) {
      this.numQubits = numQubits;
      return this;
    }

    public Builder setDepth(final Integer depth) {
      this.depth = depth;
      return this;
    }

    public Builder setNumShots(final Integer numShots) {
      this.numShots = numShots;
      return this;
    }

    public Builder setPriority(final Integer priority) {
      this.priority = priority;
      return this;
    }

    public Builder setArrivalTime(@Nullable final Double arrivalTime) {
      this.arrivalTime = arrivalTime;
      return this;
    }

    public Builder setIterations(@Nullable final Integer iterations) {
      this.iterations = iterations;
      return this;
    }

    public Builder setCpuUnits(@Nullable final Integer cpuUnits) {
      this.cpuUnits = cpuUnits;
      return this;
    }

    public Builder setMemBw(@Nullable final Integer memBw) {
      this.memBw = memBw;
      return this;
    }

    @Nullable
    public Double getArrivalTime() {
      return arrivalTime;
    }

    public QuantumJob build() {
      return new QuantumJob(this);
    }
  }

  private final int jobId;
  private final int numQubits;
  private final int depth;
  private final int numShots;
  private final int priority;
  private final Double arrivalTime;
  private final int iterations;
  private final int cpuUnits;
  private final int memBw;

  private JobPhase phase = JobPhase.QPU;
  private int iteration = 0;

  private QuantumJob(final Builder builder) {
    this.jobId = required(builder.jobId, Constants.JOB_ID, builder.jobId);
    this.numQubits = positive(required(builder.numQubits, Constants.NUM_QUBITS, jobId), Constants.NUM_QUBITS, jobId);
    this.depth = positive(required(builder.depth, Constants.DEPTH, jobId), Constants.DEPTH, jobId);
    this.numShots = positive(required(builder.numShots, Constants.NUM_SHOTS, jobId), Constants.NUM_SHOTS, jobId);
    this.priority = required(builder.priority, Constants.PRIORITY, jobId);
    this.arrivalTime = builder.arrivalTime;
    this.iterations = positive(
        builder.iterations == null ? DEFAULT_ITERATIONS : builder.iterations, Constants.ITERATIONS, jobId);
    this.cpuUnits = positive(
        builder.cpuUnits == null ? DEFAULT_CPU_UNITS : builder.cpuUnits, Constants.CPU_UNITS, jobId);
    this.memBw = positive(builder.memBw == null ? DEFAULT_MEM_BW : builder.memBw, Constants.MEM_BW, jobId);
  }

  private static int required(@Nullable final Integer value, final String field, @Nullable final Integer jobId) {
    if (value == null) {
      throw new IllegalArgumentException(MessageFormat.format("Job {0} is missing {1}.", jobId, field));
    }

    return value;
  }

  private static int positive(final int value, final String field, final int jobId) {
    if (value <= 0) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Job {0}: {1} must be positive, got {2}.", jobId, field, value));
    }

    return value;
  }

  public int getJobId() {
    return jobId;
  }

  public int getNumQubits() {
    return numQubits;
  }

  public int getDepth() {
    return depth;
  }

  public int getNumShots() {
    return numShots;
  }

  public int getPriority() {
    return priority;
  }

  /**
   * @return the arrival time from the feed, null if the job arrives when it is read
   */
  @Nullable
  public Double getArrivalTime() {
    return arrivalTime;
  }

  public int getIterations() {
    return iterations;
  }

  public int getCpuUnits() {
    return cpuUnits;
  }

  public int getMemBw() {
    return memBw;
  }

  public JobPhase getPhase() {
    return phase;
  }

  public void setPhase(final JobPhase phase) {
    this.phase = phase;
  }

  public int getIteration() {
    return iteration;
  }

  public void completeIteration() {
    iteration++;
  }

  public boolean isLastIterationDone() {
    return iteration >= iterations;
  }

  @Override
  public String toString() {
    return MessageFormat.format(
        "QuantumJob'{'id={0}, qubits={1}, depth={2}, shots={3}, priority={4}, iteration={5}/{6}'}'",
        jobId, numQubits, depth, numShots, priority, iteration, iterations);
  }
}
