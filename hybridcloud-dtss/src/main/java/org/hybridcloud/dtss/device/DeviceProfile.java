package org.hybridcloud.dtss.device;

import com.google.gson.annotations.SerializedName;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.topology.TopologyDescriptor;

import javax.annotation.Nullable;
import java.text.MessageFormat;

/**
 * The static parameters of one quantum device model. Every preset of the
 * {@link DeviceCatalog} is one profile; devices of the same model share it.
 */
public final class DeviceProfile {
  private static final double LAYER_MULTIPLIER = 100D;
  private static final double SHOT_MULTIPLIER = 10D;
  private static final double SECONDS_PER_TIME_UNIT = 60D;
  private static final double TIME_PER_QUBIT = 100D;

  /**
   * The JSON form of a profile, as read from the catalog.
   */
  public static final class Builder {
    @SerializedName("name")
    private String name;

    @SerializedName("family")
    private String family;

    @SerializedName("topology")
    private TopologyDescriptor topology;

    @SerializedName("clops")
    private Integer clops;

    @SerializedName("quantumVolume")
    private Integer quantumVolume;

    @SerializedName("maintenanceInterval")
    private Double maintenanceInterval;

    @SerializedName("maintenanceDuration")
    private Double maintenanceDuration;

    // Classpath resource of an IBM calibration export
    @SerializedName("calibration")
    private String calibration;

    @SerializedName("errors")
    private ErrorRates errors;

    @SerializedName("errorScore")
    private Double errorScore;

    @SerializedName("processTimeOverride")
    private Double processTimeOverride;

    public static Builder newBuilder() {
      return new Builder();
    }

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setFamily(final String family) {
      this.family = family;
      return this;
    }

    public Builder setTopology(final TopologyDescriptor topology) {
      this.topology = topology;
      return this;
    }

    public Builder setThroughput(final int clops, final int quantumVolume) {
      this.clops = clops;
      this.quantumVolume = quantumVolume;
      return this;
    }

    public Builder setMaintenance(final double interval, final double duration) {
      this.maintenanceInterval = interval;
      this.maintenanceDuration = duration;
      return this;
    }

    public Builder setCalibration(final String calibration) {
      this.calibration = calibration;
      return this;
    }

    public Builder setErrors(final double single, final double readout, final double twoQubit) {
      this.errors = new ErrorRates(single, readout, twoQubit);
      return this;
    }

    public Builder setErrorScore(@Nullable final Double errorScore) {
      this.errorScore = errorScore;
      return this;
    }

    public Builder setProcessTimeOverride(@Nullable final Double processTimeOverride) {
      this.processTimeOverride = processTimeOverride;
      return this;
    }

    public DeviceProfile build() {
      return new DeviceProfile(this);
    }
  }

  private static final class ErrorRates {
    @SerializedName("single")
    private double single;

    @SerializedName("readout")
    private double readout;

    @SerializedName("twoQubit")
    private double twoQubit;

    private ErrorRates(final double single, final double readout, final double twoQubit) {
      this.single = single;
      this.readout = readout;
      this.twoQubit = twoQubit;
    }
  }

  private final String name;
  private final String family;
  private final TopologyDescriptor topology;
  private final Integer clops;
  private final Integer quantumVolume;
  private final Double maintenanceInterval;
  private final Double maintenanceDuration;
  private final ErrorProfile errorProfile;
  private final double errorScore;
  private final Double processTimeOverride;

  private DeviceProfile(final Builder builder) {
    if (builder.name == null || builder.name.trim().isEmpty()) {
      throw new IllegalArgumentException("A device profile needs a name.");
    }

    if (builder.topology == null) {
      throw new IllegalArgumentException("Device profile " + builder.name + " has no topology.");
    }

    if ((builder.clops == null) != (builder.quantumVolume == null)) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Device profile {0} must set both clops and quantumVolume, or neither.", builder.name));
    }

    if (builder.clops != null && (builder.clops <= 0 || builder.quantumVolume <= 1)) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Device profile {0} has invalid throughput: clops={1}, quantumVolume={2}.",
          builder.name, builder.clops, builder.quantumVolume));
    }

    if ((builder.maintenanceInterval == null) != (builder.maintenanceDuration == null)) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Device profile {0} must set both maintenance interval and duration, or neither.", builder.name));
    }

    this.name = builder.name;
    this.family = builder.family == null ? "generic" : builder.family;
    this.topology = builder.topology;
    this.clops = builder.clops;
    this.quantumVolume = builder.quantumVolume;
    this.maintenanceInterval = builder.maintenanceInterval;
    this.maintenanceDuration = builder.maintenanceDuration;
    this.processTimeOverride = builder.processTimeOverride;

    if (builder.calibration != null) {
      this.errorProfile = CalibrationReader.readResource(builder.calibration);
    } else if (builder.errors != null) {
      this.errorProfile = new ErrorProfile(builder.errors.single, builder.errors.readout, builder.errors.twoQubit);
    } else {
      this.errorProfile = new ErrorProfile(0, 0, 0);
    }

    this.errorScore = builder.errorScore != null ? builder.errorScore : errorProfile.getMeanError();
  }

  /**
   * @return how long {@code job} occupies its qubits on a device of this model
   */
  public double processTime(final QuantumJob job) {
    if (processTimeOverride != null) {
      return processTimeOverride;
    }

    if (clops == null) {
      return job.getNumQubits() * TIME_PER_QUBIT;
    }

    final double layers = Math.log(quantumVolume) / Math.log(2);
    return LAYER_MULTIPLIER * SHOT_MULTIPLIER * job.getNumShots() * layers / clops / SECONDS_PER_TIME_UNIT;
  }

  /**
   * @return {@code (1 - avgSingle)^depth * (1 - avgReadout)^qubits}
   */
  public double estimateFidelity(final int depth, final double qubits) {
    return Math.pow(1 - errorProfile.getAvgSingleQubitError(), depth)
        * Math.pow(1 - errorProfile.getAvgReadoutError(), qubits);
  }

  public String getName() {
    return name;
  }

  public String getFamily() {
    return family;
  }

  public TopologyDescriptor getTopology() {
    return topology;
  }

  @Nullable
  public Integer getClops() {
    return clops;
  }

  @Nullable
  public Integer getQuantumVolume() {
    return quantumVolume;
  }

  public boolean hasMaintenanceSchedule() {
    return maintenanceInterval != null;
  }

  @Nullable
  public Double getMaintenanceInterval() {
    return maintenanceInterval;
  }

  @Nullable
  public Double getMaintenanceDuration() {
    return maintenanceDuration;
  }

  public ErrorProfile getErrorProfile() {
    return errorProfile;
  }

  /**
   * @return the ranking score of the model, lower is better
   */
  public double getErrorScore() {
    return errorScore;
  }

  @Override
  public String toString() {
    return MessageFormat.format("DeviceProfile'{'name={0}, family={1}, errors=[{2}]'}'",
        name, family, errorProfile);
  }
}
