package org.hybridcloud.dtss.topology;

/**
 * How a {@link TopologyDescriptor} produces its graph.
 */
public enum TopologyType {
  /**
   * Edge list read from a JSON classpath resource.
   */
  EDGE_LIST,
  LINE,
  RING,
  GRID
}
