package com.flamingo.ai.graphrag.service.provider;

import com.flamingo.ai.graphrag.config.RetrievalConfig;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * {@link ScoringModel} backed by a Hugging Face TEI (Text Embeddings Inference) {@code /rerank}
 * endpoint serving a cross-encoder such as {@code BAAI/bge-reranker-base}.
 */
@Slf4j
public class TeiScoringModel implements ScoringModel {

  private final WebClient webClient;
  private final int readTimeoutMs;
  private final boolean rawScores;
  private final boolean truncate;

  public TeiScoringModel(RetrievalConfig.Reranking.Tei tei) {
    this(
        WebClient.builder()
            .baseUrl(tei.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build(),
        tei);
    log.info(
        "TEI scoring model initialized: baseUrl={}, model={}", tei.getBaseUrl(), tei.getModelId());
  }

  TeiScoringModel(WebClient webClient, RetrievalConfig.Reranking.Tei tei) {
    this.webClient = webClient;
    this.readTimeoutMs = tei.getReadTimeoutMs();
    this.rawScores = tei.isRawScores();
    this.truncate = tei.isTruncate();
  }

  /** Returns one score per segment in input order; TEI itself answers sorted by score. */
  @Override
  public Response<List<Double>> scoreAll(List<TextSegment> segments, String query) {
    List<String> texts = segments.stream().map(TextSegment::text).toList();
    List<RerankResult> results = rerank(query, texts);
    if (results == null || results.size() != texts.size()) {
      throw new IllegalStateException(
          "TEI returned "
              + (results == null ? 0 : results.size())
              + " scores for "
              + texts.size()
              + " texts");
    }

    Double[] ordered = new Double[texts.size()];
    for (RerankResult result : results) {
      if (result.index() < 0 || result.index() >= ordered.length) {
        throw new IllegalStateException("TEI returned out-of-range index " + result.index());
      }
      ordered[result.index()] = result.score();
    }
    if (Arrays.asList(ordered).contains(null)) {
      throw new IllegalStateException("TEI response is missing scores for some texts");
    }
    return Response.from(new ArrayList<>(Arrays.asList(ordered)));
  }

  private List<RerankResult> rerank(String query, List<String> texts) {
    var request = new TeiRerankRequest(query, texts, rawScores, truncate);
    return webClient
        .post()
        .uri("/rerank")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(request)
        .retrieve()
        .bodyToFlux(RerankResult.class)
        .collectList()
        .timeout(Duration.ofMillis(readTimeoutMs))
        .block();
  }

  record TeiRerankRequest(String query, List<String> texts, boolean raw_scores, boolean truncate) {}

  /** TEI rerank response element. */
  record RerankResult(int index, double score) {}
}
