package org.hybridcloud.dtss.topology;

import java.text.MessageFormat;

/**
 * A static coupling between two physical qubits.
 * Equality is undirected: {@code (a, b)} equals {@code (b, a)}.
 */
public final class Edge {
  private final int source;

  private final int target;

  public Edge(final int source, final int target) {
    if (source == target) {
      throw new IllegalArgumentException("Self loops are not allowed on qubit " + source);
    }

    this.source = source;
    this.target = target;
  }

  public int getSource() {
    return source;
  }

  public int getTarget() {
    return target;
  }

  public boolean touches(final int node) {
    return source == node || target == node;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final Edge that = (Edge) o;
    return Math.min(source, target) == Math.min(that.source, that.target)
        && Math.max(source, target) == Math.max(that.source, that.target);
  }

  @Override
  public int hashCode() {
    return 31 * Math.min(source, target) + Math.max(source, target);
  }

  @Override
  public String toString() {
    return MessageFormat.format("({0}, {1})", source, target);
  }
}
