package com.flamingo.ai.graphrag.service.rerank;

import com.flamingo.ai.graphrag.domain.model.Candidate;
import java.util.List;

/**
 * Result of a cross-encoder pass. Has the same shape whether the model scored the candidates or the
 * positional fallback did.
 *
 * @param candidates reranked candidates, each carrying its {@code rerankScore}
 * @param scores the scores in candidate order
 * @param warning non-null when the fallback was used
 */
public record RerankOutcome(List<Candidate> candidates, List<Double> scores, String warning) {

  public RerankOutcome {
    candidates = List.copyOf(candidates);
    scores = List.copyOf(scores);
  }

  public boolean isFallback() {
    return warning != null;
  }
}
