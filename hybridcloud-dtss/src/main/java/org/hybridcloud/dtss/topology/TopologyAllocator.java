package org.hybridcloud.dtss.topology;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.hybridcloud.dtss.exceptions.ResourceException;

import javax.annotation.Nullable;
import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds, reserves and releases qubit subsets on the {@link TopologyGraph}s of all devices.
 *
 * <p>Every operation runs inside one critical section shared by all devices.
 * {@link #release(TopologyGraph, Collection)} restores edges from the current coloring of the
 * whole graph rather than from what the matching reservation removed, so it is only correct
 * while all graph mutations are serialized here.</p>
 */
@Singleton
public final class TopologyAllocator {
  private static final Logger LOG = Logger.getLogger(TopologyAllocator.class.getName());

  private final ReentrantLock graphLock = new ReentrantLock();

  @Inject
  public TopologyAllocator() {
  }

  /**
   * Selects {@code n} free qubits. Starting from each free qubit in graph order, walks the
   * current graph breadth first and collects the free qubits it meets until it has {@code n}.
   * The returned qubits are reachable from the start qubit but are not guaranteed
   * to be pairwise connected among themselves.
   * @return exactly {@code n} qubits, or null if no start qubit yields that many
   */
  @Nullable
  public List<Integer> select(final TopologyGraph graph, final int n) {
    try (GraphSection ignored = enterGraphSection()) {
      return selectLocked(graph, n);
    }
  }

  /**
   * Colors {@code nodes} busy and cuts every edge leaving the reserved set.
   * @throws ResourceException if any of the qubits is already busy
   */
  public void reserve(final TopologyGraph graph, final Collection<Integer> nodes) {
    try (GraphSection ignored = enterGraphSection()) {
      reserveLocked(graph, nodes);
    }
  }

  /**
   * Colors {@code nodes} free and re-adds every static edge whose endpoints are both free.
   */
  public void release(final TopologyGraph graph, final Collection<Integer> nodes) {
    try (GraphSection ignored = enterGraphSection()) {
      for (final Integer node : nodes) {
        graph.setColor(node, QubitColor.FREE);
      }

      for (final Edge edge : graph.getStaticEdges()) {
        if (graph.isFree(edge.getSource()) && graph.isFree(edge.getTarget())
            && !graph.hasEdge(edge.getSource(), edge.getTarget())) {
          graph.addEdge(edge.getSource(), edge.getTarget());
        }
      }
    }
  }

  /**
   * Atomically selects and reserves {@code n} qubits.
   * @return the reserved qubits, or null if no selection was possible
   */
  @Nullable
  public List<Integer> selectAndReserve(final TopologyGraph graph, final int n) {
    try (GraphSection ignored = enterGraphSection()) {
      final List<Integer> nodes = selectLocked(graph, n);
      if (nodes != null) {
        reserveLocked(graph, nodes);
      }

      return nodes;
    }
  }

  /**
   * Reserves {@code preferred} if all of its qubits are still free,
   * otherwise selects and reserves a fresh set of the same size.
   * @return the reserved qubits, or null if neither was possible
   */
  @Nullable
  public List<Integer> reserveOrReselect(final TopologyGraph graph, final List<Integer> preferred) {
    try (GraphSection ignored = enterGraphSection()) {
      boolean allFree = true;
      for (final Integer node : preferred) {
        allFree &= graph.isFree(node);
      }

      if (allFree) {
        reserveLocked(graph, preferred);
        return preferred;
      }

      LOG.log(Level.FINE, () -> MessageFormat.format(
          "Selected qubits {0} were taken meanwhile, selecting again.", preferred));
      final List<Integer> nodes = selectLocked(graph, preferred.size());
      if (nodes != null) {
        reserveLocked(graph, nodes);
      }

      return nodes;
    }
  }

  @Nullable
  private List<Integer> selectLocked(final TopologyGraph graph, final int n) {
    final List<Integer> candidates = graph.getFreeNodes();
    if (candidates.size() < n) {
      return null;
    }

    final Set<Integer> candidateSet = new HashSet<>(candidates);
    for (final Integer start : candidates) {
      final Set<Integer> selected = new LinkedHashSet<>();
      selected.add(start);

      for (final Integer reached : breadthFirst(graph, start)) {
        if (selected.size() >= n) {
          break;
        }

        if (candidateSet.contains(reached)) {
          selected.add(reached);
        }
      }

      if (selected.size() == n) {
        return new ArrayList<>(selected);
      }
    }

    return null;
  }

  /**
   * @return the qubits discovered by a breadth first walk from {@code start}, in discovery order,
   * excluding {@code start} itself
   */
  private static List<Integer> breadthFirst(final TopologyGraph graph, final int start) {
    final List<Integer> discovered = new ArrayList<>();
    final Set<Integer> visited = new HashSet<>();
    final Deque<Integer> queue = new ArrayDeque<>();
    visited.add(start);
    queue.add(start);

    while (!queue.isEmpty()) {
      final Integer node = queue.poll();
      for (final Integer neighbor : graph.getNeighbors(node)) {
        if (visited.add(neighbor)) {
          discovered.add(neighbor);
          queue.add(neighbor);
        }
      }
    }

    return discovered;
  }

  private static void reserveLocked(final TopologyGraph graph, final Collection<Integer> nodes) {
    for (final Integer node : nodes) {
      if (!graph.isFree(node)) {
        throw new ResourceException(MessageFormat.format("Qubit {0} is already reserved.", node));
      }
    }

    final Set<Integer> reserved = new HashSet<>(nodes);
    for (final Integer node : nodes) {
      graph.setColor(node, QubitColor.BUSY);
    }

    for (final Integer node : nodes) {
      for (final Integer neighbor : new ArrayList<>(graph.getNeighbors(node))) {
        if (!reserved.contains(neighbor)) {
          graph.removeEdge(node, neighbor);
        }
      }
    }
  }

  private GraphSection enterGraphSection() {
    graphLock.lock();
    return new GraphSection();
  }

  /**
   * Scope of the global graph critical section, released on close.
   */
  private final class GraphSection implements AutoCloseable {
    private GraphSection() {
    }

    @Override
    public void close() {
      graphLock.unlock();
    }
  }
}
