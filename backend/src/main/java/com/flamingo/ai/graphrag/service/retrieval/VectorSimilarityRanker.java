package com.flamingo.ai.graphrag.service.retrieval;

import com.flamingo.ai.graphrag.config.RetrievalConfig;
import com.flamingo.ai.graphrag.domain.model.Candidate;
import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Orders candidates by cosine similarity between their embedding and the query embedding. */
@Component
@RequiredArgsConstructor
@Slf4j
public class VectorSimilarityRanker {

  private static final Comparator<Candidate> SIMILARITY_ORDER =
      Comparator.comparingDouble(Candidate::getEmbeddingScore)
          .reversed()
          .thenComparing(Candidate::getChunkId);

  private final VectorSimilarityScorer similarityScorer;
  private final RetrievalConfig retrievalConfig;

  /**
   * Embedding scan: turns every node with an embedding into a seed scored by similarity and keeps
   * the best {@code retrieval.embedding.top-k}.
   */
  public List<Candidate> scan(String namespace, List<Float> queryVector, List<ChunkRecord> nodes) {
    List<Candidate> seeds = nodes.stream().map(node -> Candidate.seedOf(node, 0.0)).toList();
    return rank(namespace, queryVector, seeds, index(nodes));
  }

  /**
   * Filters out candidates without an embedding, sorts the rest by similarity descending (chunk id
   * ascending on ties) and keeps the best {@code retrieval.embedding.top-k}.
   */
  public List<Candidate> rank(
      String namespace,
      List<Float> queryVector,
      List<Candidate> candidates,
      Map<String, ChunkRecord> nodesById) {
    Map<String, Double> similarities = similarities(namespace, queryVector, candidates, nodesById);
    List<Candidate> ranked =
        candidates.stream()
            .filter(candidate -> similarities.containsKey(candidate.getChunkId()))
            .map(
                candidate ->
                    candidate.toBuilder()
                        .embeddingScore(similarities.get(candidate.getChunkId()))
                        .build())
            .sorted(SIMILARITY_ORDER)
            .limit(retrievalConfig.getEmbedding().getTopK())
            .toList();
    log.debug("Embedding rank kept {} of {} candidates", ranked.size(), candidates.size());
    return ranked;
  }

  /**
   * Annotates every candidate with its similarity without filtering or reordering. Candidates
   * without an embedding keep a null embedding score.
   */
  public List<Candidate> score(
      String namespace,
      List<Float> queryVector,
      List<Candidate> candidates,
      Map<String, ChunkRecord> nodesById) {
    Map<String, Double> similarities = similarities(namespace, queryVector, candidates, nodesById);
    return candidates.stream()
        .map(
            candidate ->
                candidate.toBuilder()
                    .embeddingScore(similarities.get(candidate.getChunkId()))
                    .build())
        .toList();
  }

  public static Map<String, ChunkRecord> index(Collection<ChunkRecord> nodes) {
    return nodes.stream()
        .collect(
            Collectors.toMap(
                ChunkRecord::id, node -> node, (first, second) -> first));
  }

  private Map<String, Double> similarities(
      String namespace,
      List<Float> queryVector,
      List<Candidate> candidates,
      Map<String, ChunkRecord> nodesById) {
    List<ChunkRecord> nodes =
        candidates.stream()
            .map(candidate -> nodesById.get(candidate.getChunkId()))
            .filter(node -> node != null && node.hasEmbedding())
            .toList();
    if (nodes.isEmpty()) {
      return Map.of();
    }
    return similarityScorer.similarities(namespace, queryVector, nodes);
  }
}
