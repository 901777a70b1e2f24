package com.flamingo.ai.graphrag.service.provider;

import com.flamingo.ai.graphrag.exception.ProviderUnavailableException;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.scoring.ScoringModel;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Scores (query, passage) pairs with the configured cross-encoder. Higher is more relevant. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrossEncoderService {

  static final String PROVIDER = "cross-encoder";

  private final LazyModelHandle<ScoringModel> scoringModel;

  @Timed(value = "crossencoder.score", description = "Time to score one pair")
  @CircuitBreaker(name = "cross-encoder", fallbackMethod = "scoreFallback")
  public double score(String query, String text) {
    return scoringModel.get().score(orEmpty(text), query).content();
  }

  /**
   * Scores every text against the query in one model call.
   *
   * @return one score per text, in input order
   */
  @Timed(value = "crossencoder.score.batch", description = "Time to score a batch of pairs")
  @CircuitBreaker(name = "cross-encoder", fallbackMethod = "scoreBatchFallback")
  public List<Double> scoreBatch(String query, List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = texts.stream().map(t -> TextSegment.from(orEmpty(t))).toList();
    List<Double> scores = scoringModel.get().scoreAll(segments, query).content();
    log.debug("Cross-encoder scored {} pairs", scores.size());
    return scores;
  }

  public boolean isModelLoaded() {
    return scoringModel.isLoaded();
  }

  private static String orEmpty(String text) {
    return text == null || text.isBlank() ? "" : text;
  }

  @SuppressWarnings("unused")
  private double scoreFallback(String query, String text, Throwable t) {
    throw translate(t);
  }

  @SuppressWarnings("unused")
  private List<Double> scoreBatchFallback(String query, List<String> texts, Throwable t) {
    throw translate(t);
  }

  private RuntimeException translate(Throwable t) {
    if (t instanceof ProviderUnavailableException unavailable) {
      return unavailable;
    }
    log.warn("Cross-encoder scoring failed: {}", t.getMessage());
    return new ProviderUnavailableException(
        PROVIDER, "Cross-encoder scoring failed: " + t.getMessage(), t);
  }
}
