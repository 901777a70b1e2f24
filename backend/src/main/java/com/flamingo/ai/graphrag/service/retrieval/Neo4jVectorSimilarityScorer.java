package com.flamingo.ai.graphrag.service.retrieval;

import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import com.flamingo.ai.graphrag.graph.Neo4jGraphStore;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Delegates cosine similarity to Neo4j ({@code gds.similarity.cosine}). */
@Component
@ConditionalOnProperty(name = "retrieval.similarity.mode", havingValue = "store")
@RequiredArgsConstructor
public class Neo4jVectorSimilarityScorer implements VectorSimilarityScorer {

  private final Neo4jGraphStore neo4jGraphStore;

  @Override
  public Map<String, Double> similarities(
      String namespace, List<Float> queryVector, Collection<ChunkRecord> nodes) {
    List<String> ids = nodes.stream().map(ChunkRecord::id).toList();
    return neo4jGraphStore.cosineSimilarities(namespace, ids, queryVector);
  }
}
