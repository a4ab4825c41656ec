package org.hybridcloud.dtss.topology;

import com.google.common.collect.ImmutableList;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The qubit connectivity of one quantum device: its static edge list,
 * the current adjacency and the free/busy color of every qubit.
 * Owned by its device and mutated only through the {@link TopologyAllocator},
 * which serializes every mutation under its global lock.
 */
public final class TopologyGraph {
  private final List<Integer> nodes;
  private final List<Edge> staticEdges;
  private final Map<Integer, Set<Integer>> adjacency = new LinkedHashMap<>();
  private final Map<Integer, QubitColor> colors = new LinkedHashMap<>();

  private TopologyGraph(final int qubitCount, final List<Edge> edges) {
    final List<Integer> nodeList = new ArrayList<>(qubitCount);
    for (int node = 0; node < qubitCount; node++) {
      nodeList.add(node);
      adjacency.put(node, new LinkedHashSet<>());
      colors.put(node, QubitColor.FREE);
    }

    this.nodes = Collections.unmodifiableList(nodeList);
    this.staticEdges = ImmutableList.copyOf(edges);

    final Set<Edge> seen = new HashSet<>();
    for (final Edge edge : staticEdges) {
      if (!adjacency.containsKey(edge.getSource()) || !adjacency.containsKey(edge.getTarget())) {
        throw new IllegalArgumentException(MessageFormat.format(
            "Edge {0} refers to a qubit outside of [0, {1}).", edge, qubitCount));
      }

      if (!seen.add(edge)) {
        throw new IllegalArgumentException(MessageFormat.format("Duplicate edge {0}.", edge));
      }

      addEdge(edge.getSource(), edge.getTarget());
    }
  }

  /**
   * @param qubitCount the number of qubits, labelled {@code 0..qubitCount-1}
   * @param edges the static coupling edges, without duplicates in either direction
   */
  public static TopologyGraph fromEdges(final int qubitCount, final List<Edge> edges) {
    return new TopologyGraph(qubitCount, edges);
  }

  public List<Integer> getNodes() {
    return nodes;
  }

  public int getQubitCount() {
    return nodes.size();
  }

  public List<Edge> getStaticEdges() {
    return staticEdges;
  }

  public QubitColor getColor(final int node) {
    return colors.get(node);
  }

  public boolean isFree(final int node) {
    return colors.get(node) == QubitColor.FREE;
  }

  /**
   * @return the free qubits in graph order
   */
  public List<Integer> getFreeNodes() {
    final List<Integer> free = new ArrayList<>();
    for (final Integer node : nodes) {
      if (isFree(node)) {
        free.add(node);
      }
    }

    return free;
  }

  public int getFreeCount() {
    int count = 0;
    for (final QubitColor color : colors.values()) {
      if (color == QubitColor.FREE) {
        count++;
      }
    }

    return count;
  }

  public Set<Integer> getNeighbors(final int node) {
    return Collections.unmodifiableSet(adjacency.get(node));
  }

  /**
   * @return the edges currently present, in adjacency order
   */
  public Set<Edge> getCurrentEdges() {
    final Set<Edge> edges = new LinkedHashSet<>();
    for (final Map.Entry<Integer, Set<Integer>> entry : adjacency.entrySet()) {
      for (final Integer neighbor : entry.getValue()) {
        edges.add(new Edge(entry.getKey(), neighbor));
      }
    }

    return edges;
  }

  void setColor(final int node, final QubitColor color) {
    colors.put(node, color);
  }

  void addEdge(final int u, final int v) {
    adjacency.get(u).add(v);
    adjacency.get(v).add(u);
  }

  void removeEdge(final int u, final int v) {
    adjacency.get(u).remove(v);
    adjacency.get(v).remove(u);
  }

  boolean hasEdge(final int u, final int v) {
    return adjacency.get(u).contains(v);
  }
}
