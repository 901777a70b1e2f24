package com.flamingo.ai.graphrag.service.retrieval;

import com.flamingo.ai.graphrag.domain.model.Candidate;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Linear fusion of lexical and embedding scores.
 *
 * <p>Lexical scores are divided by the largest lexical score in the set; embedding scores are
 * mapped from [-1, 1] to [0, 1]. {@code hybrid = alpha * lexical + (1 - alpha) * embedding}.
 */
@Component
public class ScoreFusionEngine {

  private static final Comparator<Candidate> FUSED_ORDER =
      Comparator.comparingDouble(Candidate::getHybridScore)
          .reversed()
          .thenComparing(Candidate::isSeed, Comparator.reverseOrder())
          .thenComparing(Candidate::getChunkId);

  /**
   * Sets {@code hybridScore} on every candidate and returns them sorted by it.
   *
   * @param candidates candidates with lexical and (optionally) embedding scores
   * @param alpha lexical weight in [0, 1]
   */
  public List<Candidate> fuse(List<Candidate> candidates, double alpha) {
    if (alpha < 0.0 || alpha > 1.0 || Double.isNaN(alpha)) {
      throw new IllegalArgumentException("alpha must be within [0, 1], got " + alpha);
    }
    double maxLexical =
        candidates.stream().mapToDouble(Candidate::getLexicalScore).max().orElse(0.0);
    double divisor = maxLexical > 0.0 ? maxLexical : 1.0;

    return candidates.stream()
        .map(
            candidate -> {
              double lexical = candidate.getLexicalScore() / divisor;
              Double embedding = candidate.getEmbeddingScore();
              double embeddingNorm = embedding == null ? 0.0 : (embedding + 1.0) / 2.0;
              double hybrid = alpha * lexical + (1.0 - alpha) * embeddingNorm;
              return candidate.toBuilder().hybridScore(hybrid).build();
            })
        .sorted(FUSED_ORDER)
        .toList();
  }
}
