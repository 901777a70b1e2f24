package com.flamingo.ai.graphrag.config;

import com.flamingo.ai.graphrag.service.provider.LazyModelHandle;
import com.flamingo.ai.graphrag.service.provider.TeiScoringModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models. Models are wrapped in {@link LazyModelHandle}s so that a
 * missing API key or an unreachable model server surfaces on first use, not at startup.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:}")
  private String openAiBaseUrl;

  @Bean
  public LazyModelHandle<EmbeddingModel> embeddingModelHandle(RetrievalConfig retrievalConfig) {
    RetrievalConfig.Embedding embedding = retrievalConfig.getEmbedding();
    return new LazyModelHandle<>(
        "embedding",
        () -> {
          validateApiKey();
          OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder =
              OpenAiEmbeddingModel.builder()
                  .apiKey(openAiApiKey)
                  .modelName(embedding.getModelName())
                  .dimensions(embedding.getDimensions())
                  .timeout(embedding.getTimeout());
          if (openAiBaseUrl != null && !openAiBaseUrl.isBlank()) {
            builder.baseUrl(openAiBaseUrl);
          }
          return builder.build();
        });
  }

  @Bean
  public LazyModelHandle<ScoringModel> scoringModelHandle(RetrievalConfig retrievalConfig) {
    RetrievalConfig.Reranking reranking = retrievalConfig.getReranking();
    if ("tei".equalsIgnoreCase(reranking.getStrategy())) {
      return new LazyModelHandle<>("cross-encoder", () -> new TeiScoringModel(reranking.getTei()));
    }
    log.info(
        "Cross-encoder strategy '{}': reranking will use the fallback order",
        reranking.getStrategy());
    return LazyModelHandle.unavailable(
        "cross-encoder", "Cross-encoder disabled by retrieval.reranking.strategy");
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
