package com.flamingo.ai.graphrag.service.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.graphrag.domain.model.Candidate;
import com.flamingo.ai.graphrag.exception.ProviderUnavailableException;
import com.flamingo.ai.graphrag.service.provider.CrossEncoderService;
import com.flamingo.ai.graphrag.service.provider.LazyModelHandle;
import dev.langchain4j.model.scoring.ScoringModel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("CrossEncoderReranker Tests")
class CrossEncoderRerankerTest {

  @Mock private CrossEncoderService crossEncoderService;

  private SimpleMeterRegistry meterRegistry;
  private CrossEncoderReranker reranker;

  private final List<Candidate> candidates =
      List.of(
          candidate("a", "thuế suất VAT"), candidate("b", "hóa đơn"), candidate("c", "dịch vụ"));

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    reranker = new CrossEncoderReranker(crossEncoderService, meterRegistry);
  }

  @Nested
  @DisplayName("Model scoring")
  class ModelScoring {

    @Test
    @DisplayName("Should reorder by score and keep the best topN")
    void shouldReorderAndTruncate() {
      when(crossEncoderService.scoreBatch(anyString(), anyList()))
          .thenReturn(List.of(0.2, 0.9, 0.5));

      RerankOutcome outcome = reranker.rerank("hóa đơn", candidates, 2);

      assertThat(outcome.isFallback()).isFalse();
      assertThat(outcome.candidates()).extracting(Candidate::getChunkId).containsExactly("b", "c");
      assertThat(outcome.scores()).containsExactly(0.9, 0.5);
      assertThat(outcome.candidates())
          .extracting(Candidate::getRerankScore)
          .containsExactly(0.9, 0.5);
      assertThat(meterRegistry.counter("rerank.crossencoder.invocations").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Equal scores should keep their input order")
    void equalScoresShouldKeepInputOrder() {
      when(crossEncoderService.scoreBatch(anyString(), anyList()))
          .thenReturn(List.of(0.4, 0.7, 0.4));

      RerankOutcome outcome = reranker.rerank("q", candidates, 5);

      assertThat(outcome.candidates())
          .extracting(Candidate::getChunkId)
          .containsExactly("b", "a", "c");
    }
  }

  @Nested
  @DisplayName("Fallback")
  class Fallback {

    @Test
    @DisplayName("Should keep input order with descending synthetic scores when unavailable")
    void shouldFallBackWhenUnavailable() {
      when(crossEncoderService.scoreBatch(anyString(), anyList()))
          .thenThrow(new ProviderUnavailableException("cross-encoder", "model not loaded"));

      RerankOutcome outcome = reranker.rerank("q", candidates, 5);

      assertThat(outcome.isFallback()).isTrue();
      assertThat(outcome.warning()).contains("model not loaded");
      assertThat(outcome.candidates())
          .extracting(Candidate::getChunkId)
          .containsExactly("a", "b", "c");
      assertThat(outcome.scores()).containsExactly(1.0, 0.9, 0.8);
      assertThat(meterRegistry.counter("rerank.crossencoder.fallback").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fall back when the scoring model itself throws")
    void shouldFallBackWhenModelThrows() {
      ScoringModel scoringModel = mock(ScoringModel.class);
      when(scoringModel.scoreAll(anyList(), anyString()))
          .thenThrow(new IllegalStateException("model crashed"));
      CrossEncoderReranker unproxied =
          new CrossEncoderReranker(
              new CrossEncoderService(new LazyModelHandle<>("cross-encoder", () -> scoringModel)),
              meterRegistry);

      RerankOutcome outcome = unproxied.rerank("q", candidates, 3);

      assertThat(outcome.isFallback()).isTrue();
      assertThat(outcome.warning()).contains("cross-encoder failed").contains("model crashed");
      assertThat(outcome.candidates())
          .extracting(Candidate::getChunkId)
          .containsExactly("a", "b", "c");
      assertThat(outcome.scores()).containsExactly(1.0, 0.9, 0.8);
    }

    @Test
    @DisplayName("Should fall back when the model returns the wrong number of scores")
    void shouldFallBackOnScoreCountMismatch() {
      when(crossEncoderService.scoreBatch(anyString(), anyList())).thenReturn(List.of(0.3));

      RerankOutcome outcome = reranker.rerank("q", candidates, 2);

      assertThat(outcome.isFallback()).isTrue();
      assertThat(outcome.candidates()).extracting(Candidate::getChunkId).containsExactly("a", "b");
      assertThat(outcome.scores()).containsExactly(1.0, 0.9);
    }
  }

  @Test
  @DisplayName("Should return an empty outcome without calling the model")
  void shouldHandleEmptyInput() {
    RerankOutcome outcome = reranker.rerank("q", List.of(), 3);

    assertThat(outcome.candidates()).isEmpty();
    assertThat(outcome.scores()).isEmpty();
    assertThat(outcome.isFallback()).isFalse();
    verifyNoInteractions(crossEncoderService);
  }

  private static Candidate candidate(String id, String text) {
    return Candidate.builder().chunkId(id).text(text).lexicalScore(1.0).seed(true).build();
  }
}
