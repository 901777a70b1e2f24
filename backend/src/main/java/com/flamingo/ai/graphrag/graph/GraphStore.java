package com.flamingo.ai.graphrag.graph;

import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import com.flamingo.ai.graphrag.domain.model.NeighborHit;
import java.util.Collection;
import java.util.List;

/**
 * Read-only query capability over the chunk graph.
 *
 * <p>Abstracts the store so retrieval can run against Neo4j in production and against an in-memory
 * graph in tests. Implementations never write and need no locking; every method may be called
 * concurrently.
 *
 * <p>Failures are reported as {@link com.flamingo.ai.graphrag.exception.GraphQueryFailedException}
 * for a single failed or timed-out query and as {@link
 * com.flamingo.ai.graphrag.exception.GraphStoreUnavailableException} when the store cannot be
 * reached at all.
 */
public interface GraphStore {

  /**
   * Scans every node in a namespace whose text is not null.
   *
   * @param namespace the node label that partitions the graph
   * @return nodes with text, in no guaranteed order
   */
  List<ChunkRecord> scanByLabel(String namespace);

  /**
   * Traverses relationships of any type from the given nodes, up to {@code maxHops} edges away.
   * Neighbors without text are omitted; a node is never reported as its own neighbor. The same
   * neighbor may be reported several times when several paths reach it.
   *
   * @param namespace the node label that partitions the graph
   * @param nodeIds ids of the start nodes
   * @param maxHops maximum number of traversed edges, at least 1
   * @return one hit per (start node, neighbor, last edge, hop) found
   */
  List<NeighborHit> neighbors(String namespace, Collection<String> nodeIds, int maxHops);

  /** Returns true when the store answers a trivial query. Never throws. */
  boolean verifyConnectivity();

  /** Short human-readable description, e.g. {@code neo4j(bolt://localhost:7687)}. */
  String describe();
}
