package com.flamingo.ai.graphrag.service.retrieval;

import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Computes cosine similarity between a query vector and node embeddings. Implementations differ
 * only in where the arithmetic happens.
 */
public interface VectorSimilarityScorer {

  /**
   * @param namespace namespace the nodes belong to
   * @param queryVector the query embedding
   * @param nodes nodes to score
   * @return similarity per node id; nodes without an embedding are absent
   */
  Map<String, Double> similarities(
      String namespace, List<Float> queryVector, Collection<ChunkRecord> nodes);
}
