package org.hybridcloud.dtss.topology;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;

/**
 * Describes the static connectivity of a device model, either as an edge-list resource
 * or as a generated shape. Serialized from JSON in the device catalog.
 */
public final class TopologyDescriptor {
  private static final Gson GSON = new Gson();

  @SerializedName("type")
  private TopologyType type;

  @SerializedName("resource")
  private String resource;

  @SerializedName("qubits")
  private Integer qubits;

  @SerializedName("rows")
  private Integer rows;

  @SerializedName("cols")
  private Integer cols;

  private TopologyDescriptor() {
  }

  public static TopologyDescriptor edgeList(final String resource) {
    final TopologyDescriptor d = new TopologyDescriptor();
    d.type = TopologyType.EDGE_LIST;
    d.resource = resource;
    return d;
  }

  public static TopologyDescriptor line(final int qubits) {
    return shape(TopologyType.LINE, qubits);
  }

  public static TopologyDescriptor ring(final int qubits) {
    return shape(TopologyType.RING, qubits);
  }

  public static TopologyDescriptor grid(final int rows, final int cols) {
    final TopologyDescriptor d = new TopologyDescriptor();
    d.type = TopologyType.GRID;
    d.rows = rows;
    d.cols = cols;
    return d;
  }

  private static TopologyDescriptor shape(final TopologyType type, final int qubits) {
    final TopologyDescriptor d = new TopologyDescriptor();
    d.type = type;
    d.qubits = qubits;
    return d;
  }

  /**
   * Builds a fresh graph with every qubit free.
   */
  public TopologyGraph build() {
    if (type == null) {
      throw new IllegalArgumentException("Topology type must be set.");
    }

    switch (type) {
      case EDGE_LIST:
        return readEdgeList();
      case LINE:
        return TopologyGraph.fromEdges(requirePositive(qubits, "qubits"), chain(requirePositive(qubits, "qubits"), false));
      case RING:
        final int ringSize = requirePositive(qubits, "qubits");
        if (ringSize < 3) {
          throw new IllegalArgumentException("A ring needs at least 3 qubits, got " + ringSize);
        }
        return TopologyGraph.fromEdges(ringSize, chain(ringSize, true));
      case GRID:
        return grid();
      default:
        throw new IllegalArgumentException("Unsupported topology type " + type);
    }
  }

  private static List<Edge> chain(final int qubits, final boolean closed) {
    final List<Edge> edges = new ArrayList<>();
    for (int q = 0; q + 1 < qubits; q++) {
      edges.add(new Edge(q, q + 1));
    }

    if (closed) {
      edges.add(new Edge(qubits - 1, 0));
    }

    return edges;
  }

  private TopologyGraph grid() {
    final int r = requirePositive(rows, "rows");
    final int c = requirePositive(cols, "cols");
    final List<Edge> edges = new ArrayList<>();
    for (int row = 0; row < r; row++) {
      for (int col = 0; col < c; col++) {
        final int q = row * c + col;
        if (col + 1 < c) {
          edges.add(new Edge(q, q + 1));
        }
        if (row + 1 < r) {
          edges.add(new Edge(q, q + c));
        }
      }
    }

    return TopologyGraph.fromEdges(r * c, edges);
  }

  private TopologyGraph readEdgeList() {
    if (resource == null) {
      throw new IllegalArgumentException("An EDGE_LIST topology needs a resource.");
    }

    final EdgeListFile file;
    try (InputStream in = TopologyDescriptor.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("Topology resource not found: " + resource);
      }

      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        file = GSON.fromJson(reader, EdgeListFile.class);
      }
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    } catch (final JsonParseException e) {
      throw new IllegalArgumentException("Malformed topology resource " + resource, e);
    }

    if (file == null || file.edges == null) {
      throw new IllegalArgumentException("Topology resource has no edges: " + resource);
    }

    final List<Edge> edges = new ArrayList<>(file.edges.size());
    int maxNode = -1;
    for (final int[] pair : file.edges) {
      if (pair.length != 2) {
        throw new IllegalArgumentException(MessageFormat.format(
            "Malformed edge in {0}: expected a pair of qubits.", resource));
      }

      edges.add(new Edge(pair[0], pair[1]));
      maxNode = Math.max(maxNode, Math.max(pair[0], pair[1]));
    }

    final int qubitCount = file.qubits != null ? file.qubits : maxNode + 1;
    return TopologyGraph.fromEdges(qubitCount, edges);
  }

  private static int requirePositive(@Nullable final Integer value, final String field) {
    if (value == null || value <= 0) {
      throw new IllegalArgumentException(MessageFormat.format(
          "Topology {0} must be a positive number, got {1}.", field, value));
    }

    return value;
  }

  public TopologyType getType() {
    return type;
  }

  @Nullable
  public String getResource() {
    return resource;
  }

  private static final class EdgeListFile {
    @SerializedName("qubits")
    private Integer qubits;

    @SerializedName("edges")
    private List<int[]> edges;
  }
}
