package com.flamingo.ai.graphrag.graph;

import com.flamingo.ai.graphrag.config.RetrievalConfig;
import com.flamingo.ai.graphrag.domain.enums.ChunkType;
import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import com.flamingo.ai.graphrag.domain.model.GraphEdge;
import com.flamingo.ai.graphrag.domain.model.NeighborHit;
import com.flamingo.ai.graphrag.exception.GraphQueryFailedException;
import com.flamingo.ai.graphrag.exception.GraphStoreUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Neo4j implementation of {@link GraphStore}. All queries run in read transactions bounded by
 * {@code retrieval.graph.query-timeout}.
 *
 * <p>The namespace is used as a node label. Labels cannot be query parameters, so every namespace
 * is validated by {@link NamespaceValidator} before it is interpolated.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "retrieval.graph.store", havingValue = "neo4j", matchIfMissing = true)
public class Neo4jGraphStore implements GraphStore {

  private static final String SCAN_QUERY =
      """
      MATCH (n:`%s`)
      WHERE n.text IS NOT NULL
      RETURN n.id AS id, n.text AS text, n.type AS type, n.parent_id AS parent_id,
             n[$embeddingProperty] AS embedding
      """;

  // One row per (seed, node, last edge) at the node's shortest distance, paths kept in-namespace.
  private static final String NEIGHBORS_QUERY =
      """
      UNWIND $ids AS seedId
      MATCH (s:`%1$s` {id: seedId})
      MATCH p = (s)-[*1..%2$d]-%3$s(n:`%1$s`)
      WHERE n <> s AND n.text IS NOT NULL AND all(x IN nodes(p) WHERE x:`%1$s`)
      WITH seedId, n, last(relationships(p)) AS r, min(length(p)) AS hop
      WITH seedId, n, min(hop) AS minHop, collect({r: r, hop: hop}) AS reached
      UNWIND [x IN reached WHERE x.hop = minHop | x.r] AS r
      RETURN seedId, n.id AS id, n.text AS text, n.type AS type, n.parent_id AS parent_id,
             startNode(r).id AS source_id, endNode(r).id AS target_id, type(r) AS rel_type,
             minHop AS hop
      """;

  private static final String SIMILARITY_QUERY =
      """
      UNWIND $ids AS nodeId
      MATCH (n:`%s` {id: nodeId})
      WHERE n[$embeddingProperty] IS NOT NULL
        AND size(n[$embeddingProperty]) = size($queryEmbedding)
      RETURN n.id AS id, gds.similarity.cosine(n[$embeddingProperty], $queryEmbedding) AS sim
      """;

  private final Driver driver;
  private final RetrievalConfig.Graph graphConfig;

  public Neo4jGraphStore(Driver driver, RetrievalConfig retrievalConfig) {
    this.driver = driver;
    this.graphConfig = retrievalConfig.getGraph();
    log.info(
        "Neo4j graph store initialized: directed={}, queryTimeout={}, embeddingProperty={}",
        graphConfig.isDirected(),
        graphConfig.getQueryTimeout(),
        graphConfig.getEmbeddingProperty());
  }

  @Override
  @Timed(value = "graph.scan", description = "Time for a namespace scan")
  @CircuitBreaker(name = "graph", fallbackMethod = "scanFallback")
  public List<ChunkRecord> scanByLabel(String namespace) {
    String cypher = SCAN_QUERY.formatted(NamespaceValidator.requireValid(namespace));
    Map<String, Object> params = Map.of("embeddingProperty", graphConfig.getEmbeddingProperty());

    List<ChunkRecord> nodes = read(cypher, params, "scan " + namespace, this::toChunk);
    log.debug("Scanned {} nodes with text in namespace {}", nodes.size(), namespace);
    return nodes;
  }

  @Override
  @Timed(value = "graph.neighbors", description = "Time for neighbor traversal")
  @CircuitBreaker(name = "graph", fallbackMethod = "neighborsFallback")
  public List<NeighborHit> neighbors(String namespace, Collection<String> nodeIds, int maxHops) {
    if (nodeIds.isEmpty() || maxHops < 1) {
      return List.of();
    }
    String cypher = neighborsQuery(namespace, maxHops, graphConfig.isDirected());
    Map<String, Object> params = Map.of("ids", List.copyOf(nodeIds));

    List<NeighborHit> hits =
        read(
            cypher,
            params,
            "neighbors " + namespace,
            record ->
                new NeighborHit(
                    record.get("seedId").asString(),
                    new GraphEdge(
                        record.get("source_id").asString(),
                        record.get("target_id").asString(),
                        record.get("rel_type").asString()),
                    toChunk(record),
                    record.get("hop").asInt()));
    log.debug(
        "Found {} neighbor edges for {} seeds within {} hops",
        hits.size(),
        nodeIds.size(),
        maxHops);
    return hits;
  }

  static String neighborsQuery(String namespace, int maxHops, boolean directed) {
    return NEIGHBORS_QUERY.formatted(
        NamespaceValidator.requireValid(namespace), maxHops, directed ? ">" : "");
  }

  /**
   * Computes cosine similarity server side for the given nodes. Nodes without an embedding of the
   * query's dimension are absent from the returned map.
   */
  @Timed(value = "graph.similarity", description = "Time for store-side similarity")
  @CircuitBreaker(name = "graph", fallbackMethod = "similarityFallback")
  public Map<String, Double> cosineSimilarities(
      String namespace, Collection<String> nodeIds, List<Float> queryEmbedding) {
    if (nodeIds.isEmpty()) {
      return Map.of();
    }
    String cypher = SIMILARITY_QUERY.formatted(NamespaceValidator.requireValid(namespace));
    Map<String, Object> params =
        Map.of(
            "ids", List.copyOf(nodeIds),
            "embeddingProperty", graphConfig.getEmbeddingProperty(),
            "queryEmbedding", List.copyOf(queryEmbedding));

    Map<String, Double> similarities = new HashMap<>();
    read(cypher, params, "similarity " + namespace, record -> record)
        .forEach(
            record -> similarities.put(record.get("id").asString(), record.get("sim").asDouble()));
    return similarities;
  }

  @Override
  public boolean verifyConnectivity() {
    try {
      driver.verifyConnectivity();
      return true;
    } catch (Exception e) {
      log.warn("Neo4j connectivity check failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public String describe() {
    return "neo4j";
  }

  private <T> List<T> read(
      String cypher,
      Map<String, Object> params,
      String operation,
      Function<Record, T> mapper) {
    TransactionConfig txConfig =
        TransactionConfig.builder().withTimeout(graphConfig.getQueryTimeout()).build();
    try (Session session = driver.session(SessionConfig.defaultConfig())) {
      return session.executeRead(
          tx -> {
            List<T> rows = new ArrayList<>();
            tx.run(cypher, params).forEachRemaining(record -> rows.add(mapper.apply(record)));
            return rows;
          },
          txConfig);
    } catch (ServiceUnavailableException | SessionExpiredException e) {
      throw new GraphStoreUnavailableException("Neo4j unreachable during " + operation, e);
    } catch (Neo4jException e) {
      throw new GraphQueryFailedException("Neo4j query failed during " + operation, e);
    }
  }

  private ChunkRecord toChunk(Record record) {
    Value embedding = record.containsKey("embedding") ? record.get("embedding") : null;
    return new ChunkRecord(
        record.get("id").asString(),
        record.get("text").asString(null),
        ChunkType.fromValue(record.get("type").asString(null)),
        record.get("parent_id").asString(null),
        embedding == null || embedding.isNull() ? null : embedding.asList(Value::asFloat));
  }

  @SuppressWarnings("unused")
  private List<ChunkRecord> scanFallback(String namespace, Throwable t) {
    throw translate("scan " + namespace, t);
  }

  @SuppressWarnings("unused")
  private List<NeighborHit> neighborsFallback(
      String namespace, Collection<String> nodeIds, int maxHops, Throwable t) {
    throw translate("neighbors " + namespace, t);
  }

  @SuppressWarnings("unused")
  private Map<String, Double> similarityFallback(
      String namespace, Collection<String> nodeIds, List<Float> queryEmbedding, Throwable t) {
    throw translate("similarity " + namespace, t);
  }

  private RuntimeException translate(String operation, Throwable t) {
    if (t instanceof CallNotPermittedException) {
      log.error("Graph circuit breaker open, rejecting {}", operation);
      return new GraphStoreUnavailableException("Graph circuit breaker is open", t);
    }
    if (t instanceof RuntimeException runtime) {
      return runtime;
    }
    return new GraphQueryFailedException("Graph " + operation + " failed", t);
  }
}
