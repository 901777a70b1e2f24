package com.flamingo.ai.graphrag.service.retrieval;

import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Scores with the embeddings already carried by the scanned nodes. */
@Component
@ConditionalOnProperty(
    name = "retrieval.similarity.mode",
    havingValue = "in-process",
    matchIfMissing = true)
@Slf4j
public class InProcessVectorSimilarityScorer implements VectorSimilarityScorer {

  @Override
  public Map<String, Double> similarities(
      String namespace, List<Float> queryVector, Collection<ChunkRecord> nodes) {
    Map<String, Double> similarities = new HashMap<>();
    int mismatched = 0;
    for (ChunkRecord node : nodes) {
      if (!node.hasEmbedding()) {
        continue;
      }
      if (node.embedding().size() != queryVector.size()) {
        mismatched++;
        continue;
      }
      similarities.put(node.id(), CosineSimilarity.between(queryVector, node.embedding()));
    }
    if (mismatched > 0) {
      log.warn(
          "{} nodes in {} have embeddings of a different dimension than the query ({}), skipped",
          mismatched,
          namespace,
          queryVector.size());
    }
    return similarities;
  }
}
