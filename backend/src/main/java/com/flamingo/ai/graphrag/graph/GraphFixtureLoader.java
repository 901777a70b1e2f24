package com.flamingo.ai.graphrag.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.graphrag.domain.enums.ChunkType;
import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import com.flamingo.ai.graphrag.domain.model.GraphEdge;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

/**
 * Reads a JSON graph snapshot into an {@link InMemoryGraphStore}.
 *
 * <pre>{@code
 * {
 *   "namespaces": {
 *     "Test_rel_2": {
 *       "nodes": [{"id": "a", "text": "...", "type": "clause", "parent_id": null,
 *                  "embedding": [0.1, 0.2]}],
 *       "edges": [{"source_id": "a", "target_id": "b", "relation_type": "CITES"}]
 *     }
 *   }
 * }
 * }</pre>
 */
@Slf4j
@RequiredArgsConstructor
public class GraphFixtureLoader {

  private final ObjectMapper objectMapper;

  public InMemoryGraphStore load(Resource resource, boolean directed) {
    try (InputStream in = resource.getInputStream()) {
      InMemoryGraphStore store = load(in, directed);
      log.info("Loaded graph fixture {}: {}", resource.getDescription(), store.describe());
      return store;
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read graph fixture " + resource.getDescription(), e);
    }
  }

  public InMemoryGraphStore load(InputStream in, boolean directed) throws IOException {
    Fixture fixture = objectMapper.readValue(in, Fixture.class);
    InMemoryGraphStore.Builder builder = InMemoryGraphStore.builder().directed(directed);
    if (fixture.namespaces() == null) {
      return builder.build();
    }
    fixture
        .namespaces()
        .forEach(
            (namespace, partition) -> {
              for (NodeJson node : nullToEmpty(partition.nodes())) {
                builder.node(
                    namespace,
                    new ChunkRecord(
                        node.id(),
                        node.text(),
                        ChunkType.fromValue(node.type()),
                        node.parentId(),
                        node.embedding()));
              }
              for (EdgeJson edge : nullToEmpty(partition.edges())) {
                builder.edge(
                    namespace,
                    new GraphEdge(edge.sourceId(), edge.targetId(), edge.relationType()));
              }
            });
    return builder.build();
  }

  private static <T> List<T> nullToEmpty(List<T> list) {
    return list == null ? List.of() : list;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Fixture(Map<String, PartitionJson> namespaces) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record PartitionJson(List<NodeJson> nodes, List<EdgeJson> edges) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record NodeJson(
      String id,
      String text,
      String type,
      @JsonProperty("parent_id") String parentId,
      List<Float> embedding) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record EdgeJson(
      @JsonProperty("source_id") String sourceId,
      @JsonProperty("target_id") String targetId,
      @JsonProperty("relation_type") String relationType) {}
}
