package com.flamingo.ai.graphrag.graph;

import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import com.flamingo.ai.graphrag.domain.model.GraphEdge;
import com.flamingo.ai.graphrag.domain.model.NeighborHit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable in-memory graph, used for local runs from a JSON fixture and as the store in tests.
 *
 * <p>Traversal is breadth-first: a neighbor is reported at the hop where it is first reached, once
 * per edge that reaches it at that hop. Nodes without text are traversed through but not reported.
 */
@Slf4j
public class InMemoryGraphStore implements GraphStore {

  private final Map<String, Partition> partitions;
  private final boolean directed;

  private InMemoryGraphStore(Map<String, Partition> partitions, boolean directed) {
    this.partitions = partitions;
    this.directed = directed;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public List<ChunkRecord> scanByLabel(String namespace) {
    Partition partition = partitions.get(namespace);
    if (partition == null) {
      log.debug("Namespace {} not present in in-memory graph", namespace);
      return List.of();
    }
    return partition.nodes.values().stream().filter(ChunkRecord::hasText).toList();
  }

  @Override
  public List<NeighborHit> neighbors(String namespace, Collection<String> nodeIds, int maxHops) {
    Partition partition = partitions.get(namespace);
    if (partition == null || nodeIds.isEmpty() || maxHops < 1) {
      return List.of();
    }

    List<NeighborHit> hits = new ArrayList<>();
    for (String seedId : nodeIds) {
      if (!partition.nodes.containsKey(seedId)) {
        continue;
      }
      Set<String> visited = new HashSet<>();
      visited.add(seedId);
      List<String> frontier = List.of(seedId);

      for (int hop = 1; hop <= maxHops && !frontier.isEmpty(); hop++) {
        Set<String> reachedThisHop = new HashSet<>();
        for (String current : frontier) {
          for (GraphEdge edge : partition.edgesFrom(current, directed)) {
            String next = edge.otherEnd(current);
            if (visited.contains(next)) {
              continue;
            }
            reachedThisHop.add(next);
            ChunkRecord node = partition.nodes.get(next);
            if (node != null && node.hasText()) {
              hits.add(new NeighborHit(seedId, edge, node, hop));
            }
          }
        }
        visited.addAll(reachedThisHop);
        frontier = List.copyOf(reachedThisHop);
      }
    }
    return hits;
  }

  @Override
  public boolean verifyConnectivity() {
    return true;
  }

  @Override
  public String describe() {
    int nodes = partitions.values().stream().mapToInt(p -> p.nodes.size()).sum();
    return "in-memory(" + partitions.size() + " namespaces, " + nodes + " nodes)";
  }

  private static final class Partition {
    private final Map<String, ChunkRecord> nodes = new LinkedHashMap<>();
    private final Map<String, List<GraphEdge>> outgoing = new HashMap<>();
    private final Map<String, List<GraphEdge>> incoming = new HashMap<>();

    private List<GraphEdge> edgesFrom(String nodeId, boolean directedOnly) {
      List<GraphEdge> out = outgoing.getOrDefault(nodeId, List.of());
      if (directedOnly) {
        return out;
      }
      List<GraphEdge> all = new ArrayList<>(out);
      all.addAll(incoming.getOrDefault(nodeId, List.of()));
      return all;
    }
  }

  /** Accumulates nodes and edges; {@link #build()} freezes them. */
  public static final class Builder {
    private final Map<String, Partition> partitions = new LinkedHashMap<>();
    private boolean directed;

    public Builder directed(boolean directed) {
      this.directed = directed;
      return this;
    }

    public Builder node(String namespace, ChunkRecord node) {
      NamespaceValidator.requireValid(namespace);
      Partition partition = partitions.computeIfAbsent(namespace, ns -> new Partition());
      if (partition.nodes.putIfAbsent(node.id(), node) != null) {
        throw new IllegalArgumentException(
            "Duplicate node id '" + node.id() + "' in namespace " + namespace);
      }
      return this;
    }

    public Builder edge(String namespace, GraphEdge edge) {
      Partition partition = partitions.get(namespace);
      if (partition == null
          || !partition.nodes.containsKey(edge.sourceId())
          || !partition.nodes.containsKey(edge.targetId())) {
        throw new IllegalArgumentException(
            "Edge " + edge + " references a node missing from namespace " + namespace);
      }
      partition.outgoing.computeIfAbsent(edge.sourceId(), id -> new ArrayList<>()).add(edge);
      partition.incoming.computeIfAbsent(edge.targetId(), id -> new ArrayList<>()).add(edge);
      return this;
    }

    public Builder edge(String namespace, String sourceId, String targetId, String relationType) {
      return edge(namespace, new GraphEdge(sourceId, targetId, relationType));
    }

    public InMemoryGraphStore build() {
      return new InMemoryGraphStore(new LinkedHashMap<>(partitions), directed);
    }
  }
}
