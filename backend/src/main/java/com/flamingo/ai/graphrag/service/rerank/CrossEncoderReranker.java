package com.flamingo.ai.graphrag.service.rerank;

import com.flamingo.ai.graphrag.domain.model.Candidate;
import com.flamingo.ai.graphrag.exception.ProviderUnavailableException;
import com.flamingo.ai.graphrag.service.provider.CrossEncoderService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reorders candidates by cross-encoder relevance.
 *
 * <p>When the model is unavailable, fails or answers with the wrong number of scores, the input
 * order is kept and synthetic descending scores {@code 1.0 - i * 0.1} are assigned instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrossEncoderReranker {

  static final double FALLBACK_STEP = 0.1;

  private final CrossEncoderService crossEncoderService;
  private final MeterRegistry meterRegistry;

  /**
   * Reranks candidates against the query and returns the best {@code topN}.
   *
   * @param query the query text
   * @param candidates candidates in their current order
   * @param topN number of candidates to keep, at least 1
   */
  @Timed(value = "rerank.crossencoder", description = "Time for cross-encoder reranking")
  public RerankOutcome rerank(String query, List<Candidate> candidates, int topN) {
    if (candidates.isEmpty()) {
      log.debug("No candidates to rerank");
      return new RerankOutcome(List.of(), List.of(), null);
    }

    List<String> texts = candidates.stream().map(Candidate::getText).toList();
    List<Double> scores;
    try {
      scores = crossEncoderService.scoreBatch(query, texts);
    } catch (ProviderUnavailableException e) {
      return fallback(candidates, topN, "cross-encoder unavailable: " + e.getMessage());
    } catch (RuntimeException e) {
      return fallback(candidates, topN, "cross-encoder failed: " + e.getMessage());
    }
    if (scores == null || scores.size() != candidates.size()) {
      return fallback(
          candidates,
          topN,
          "cross-encoder returned "
              + (scores == null ? 0 : scores.size())
              + " scores for "
              + candidates.size()
              + " candidates");
    }

    List<Scored> scored = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      scored.add(new Scored(candidates.get(i), scores.get(i)));
    }
    // List.sort is stable, so equal scores keep input order
    scored.sort(Comparator.comparingDouble(Scored::score).reversed());

    List<Scored> kept = scored.subList(0, Math.min(topN, scored.size()));
    meterRegistry.counter("rerank.crossencoder.invocations").increment();
    log.debug(
        "Cross-encoder reranked {} candidates, top score: {}",
        candidates.size(),
        String.format("%.3f", kept.get(0).score()));

    return new RerankOutcome(
        kept.stream()
            .map(s -> s.candidate().toBuilder().rerankScore(s.score()).build())
            .toList(),
        kept.stream().map(Scored::score).toList(),
        null);
  }

  private RerankOutcome fallback(List<Candidate> candidates, int topN, String reason) {
    log.warn("Cross-encoder fallback, keeping input order: {}", reason);
    meterRegistry.counter("rerank.crossencoder.fallback").increment();

    int kept = Math.min(topN, candidates.size());
    List<Candidate> reranked = new ArrayList<>(kept);
    List<Double> scores = new ArrayList<>(kept);
    for (int i = 0; i < kept; i++) {
      double score = 1.0 - i * FALLBACK_STEP;
      scores.add(score);
      reranked.add(candidates.get(i).toBuilder().rerankScore(score).build());
    }
    return new RerankOutcome(reranked, scores, reason);
  }

  private record Scored(Candidate candidate, double score) {}
}
