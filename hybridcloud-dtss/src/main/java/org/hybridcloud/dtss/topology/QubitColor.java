package org.hybridcloud.dtss.topology;

/**
 * Allocation color of a qubit in a {@link TopologyGraph}.
 */
public enum QubitColor {
  FREE,
  BUSY
}
