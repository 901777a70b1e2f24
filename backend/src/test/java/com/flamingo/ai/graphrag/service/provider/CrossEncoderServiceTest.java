package com.flamingo.ai.graphrag.service.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("CrossEncoderService Tests")
class CrossEncoderServiceTest {

  @Mock private ScoringModel scoringModel;

  @Test
  @DisplayName("Should score a batch in one call, sending null text as empty")
  void shouldScoreBatchInOneCall() {
    when(scoringModel.scoreAll(anyList(), eq("thuế suất")))
        .thenReturn(Response.from(List.of(0.9, 0.1)));
    CrossEncoderService service =
        new CrossEncoderService(new LazyModelHandle<>("cross-encoder", () -> scoringModel));

    List<Double> scores =
        service.scoreBatch("thuế suất", Arrays.asList("thuế suất VAT", null));

    assertThat(scores).containsExactly(0.9, 0.1);
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
    verify(scoringModel).scoreAll(captor.capture(), eq("thuế suất"));
    assertThat(captor.getValue())
        .extracting(TextSegment::text)
        .containsExactly("thuế suất VAT", "");
    assertThat(service.isModelLoaded()).isTrue();
  }

  @Test
  @DisplayName("Should return no scores for no texts without loading the model")
  void shouldSkipEmptyBatch() {
    LazyModelHandle<ScoringModel> handle =
        new LazyModelHandle<>("cross-encoder", () -> scoringModel);

    assertThat(new CrossEncoderService(handle).scoreBatch("q", List.of())).isEmpty();
    assertThat(handle.isLoaded()).isFalse();
  }
}
