package com.flamingo.ai.graphrag.service.provider;

import com.flamingo.ai.graphrag.config.RetrievalConfig;
import com.flamingo.ai.graphrag.exception.ProviderUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generates text embeddings with the configured LangChain4j embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  static final String PROVIDER = "embedding";

  private final LazyModelHandle<EmbeddingModel> embeddingModel;
  private final RetrievalConfig retrievalConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a single text. Texts longer than {@code retrieval.embedding.max-input-chars} are
   * truncated.
   *
   * @throws IllegalArgumentException if the text is null or blank
   * @throws ProviderUnavailableException if the model cannot be loaded or fails
   */
  @Timed(value = "embedding.duration", description = "Time to embed one text")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  public List<Float> embed(String text) {
    String input = prepare(text);
    Response<Embedding> response = embeddingModel.get().embed(input);
    meterRegistry.counter("embedding.requests.success").increment();

    List<Float> vector = response.content().vectorAsList();
    log.debug("Embedding generated, input {} chars, dimension {}", input.length(), vector.size());
    return vector;
  }

  /** Embeds several texts in one model call; output order matches input order. */
  @Timed(value = "embedding.batch.duration", description = "Time to embed a batch of texts")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedBatchFallback")
  public List<List<Float>> embedBatch(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (String text : texts) {
      segments.add(TextSegment.from(prepare(text)));
    }
    Response<List<Embedding>> response = embeddingModel.get().embedAll(segments);
    List<Embedding> embeddings = response.content();
    if (embeddings.size() != texts.size()) {
      throw new IllegalStateException(
          "Embedding model returned "
              + embeddings.size()
              + " vectors for "
              + texts.size()
              + " texts");
    }
    meterRegistry.counter("embedding.requests.success").increment(texts.size());
    return embeddings.stream().map(Embedding::vectorAsList).toList();
  }

  public boolean isModelLoaded() {
    return embeddingModel.isLoaded();
  }

  private String prepare(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Cannot embed empty text");
    }
    int maxChars = retrievalConfig.getEmbedding().getMaxInputChars();
    if (text.length() > maxChars) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          text.length(),
          maxChars);
      return text.substring(0, maxChars);
    }
    return text;
  }

  @SuppressWarnings("unused")
  private List<Float> embedFallback(String text, Throwable t) {
    throw translate(t, 1);
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedBatchFallback(List<String> texts, Throwable t) {
    throw translate(t, texts.size());
  }

  private RuntimeException translate(Throwable t, int count) {
    if (t instanceof IllegalArgumentException illegalArgument) {
      return illegalArgument;
    }
    meterRegistry.counter("embedding.requests.failure").increment(count);
    if (t instanceof ProviderUnavailableException unavailable) {
      return unavailable;
    }
    log.error("Embedding failed: {}", t.getMessage());
    return new ProviderUnavailableException(PROVIDER, "Embedding failed: " + t.getMessage(), t);
  }
}
