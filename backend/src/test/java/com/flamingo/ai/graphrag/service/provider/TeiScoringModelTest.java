package com.flamingo.ai.graphrag.service.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.graphrag.config.RetrievalConfig;
import dev.langchain4j.data.segment.TextSegment;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@DisplayName("TeiScoringModel Tests")
class TeiScoringModelTest {

  private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

  private TeiScoringModel model(String responseBody) {
    WebClient webClient =
        WebClient.builder()
            .baseUrl("http://tei.local")
            .exchangeFunction(
                request -> {
                  lastRequest.set(request);
                  return Mono.just(
                      ClientResponse.create(HttpStatus.OK)
                          .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                          .body(responseBody)
                          .build());
                })
            .build();
    return new TeiScoringModel(webClient, new RetrievalConfig.Reranking.Tei());
  }

  private static List<TextSegment> segments(String... texts) {
    return Arrays.stream(texts).map(TextSegment::from).toList();
  }

  @Test
  @DisplayName("Should map scores sorted by relevance back to input order")
  void shouldRestoreInputOrder() {
    TeiScoringModel model =
        model(
            "[{\"index\": 2, \"score\": 0.9}, {\"index\": 0, \"score\": 0.4},"
                + " {\"index\": 1, \"score\": 0.1}]");

    List<Double> scores = model.scoreAll(segments("a", "b", "c"), "thuế suất").content();

    assertThat(scores).containsExactly(0.4, 0.1, 0.9);
    assertThat(lastRequest.get().url().getPath()).isEqualTo("/rerank");
  }

  @Test
  @DisplayName("Should reject a response with the wrong number of scores")
  void shouldRejectWrongSize() {
    TeiScoringModel model = model("[{\"index\": 0, \"score\": 0.4}]");

    assertThatThrownBy(() -> model.scoreAll(segments("a", "b"), "q"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("1 scores for 2 texts");
  }

  @Test
  @DisplayName("Should reject an out-of-range index")
  void shouldRejectOutOfRangeIndex() {
    TeiScoringModel model = model("[{\"index\": 5, \"score\": 0.4}]");

    assertThatThrownBy(() -> model.scoreAll(segments("a"), "q"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("out-of-range");
  }
}
