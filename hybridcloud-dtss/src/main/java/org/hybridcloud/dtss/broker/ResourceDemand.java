package org.hybridcloud.dtss.broker;

import org.hybridcloud.dtss.job.JobPhase;
import org.hybridcloud.dtss.job.QuantumJob;

import java.text.MessageFormat;

/**
 * What a job phase needs from a device to be admitted: qubits on a QPU,
 * or CPU units and memory bandwidth on a CPU.
 */
public final class ResourceDemand {
  private final int qubits;
  private final int cpuUnits;
  private final int memBw;

  private ResourceDemand(final int qubits, final int cpuUnits, final int memBw) {
    this.qubits = qubits;
    this.cpuUnits = cpuUnits;
    this.memBw = memBw;
  }

  public static ResourceDemand qubits(final int qubits) {
    return new ResourceDemand(Math.max(1, qubits), 0, 0);
  }

  public static ResourceDemand compute(final int cpuUnits, final int memBw) {
    return new ResourceDemand(0, cpuUnits, memBw);
  }

  public static ResourceDemand of(final JobPhase phase, final QuantumJob job) {
    switch (phase) {
      case QPU:
        return qubits(job.getNumQubits());
      case CPU:
        return compute(job.getCpuUnits(), job.getMemBw());
      default:
        throw new IllegalArgumentException("Unknown phase " + phase);
    }
  }

  public int getQubits() {
    return qubits;
  }

  public int getCpuUnits() {
    return cpuUnits;
  }

  public int getMemBw() {
    return memBw;
  }

  @Override
  public String toString() {
    return MessageFormat.format("'{'qubits={0}, cpu={1}, memBw={2}'}'", qubits, cpuUnits, memBw);
  }
}
