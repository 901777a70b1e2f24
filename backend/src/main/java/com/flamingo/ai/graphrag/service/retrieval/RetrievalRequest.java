package com.flamingo.ai.graphrag.service.retrieval;

import com.flamingo.ai.graphrag.domain.enums.RetrievalMode;
import lombok.Builder;
import lombok.Value;

/**
 * A retrieval request. Null optional fields take their defaults from {@code retrieval.*}
 * configuration.
 */
@Value
@Builder
public class RetrievalRequest {

  String query;
  Integer topK;
  String namespace;
  RetrievalMode mode;

  /** Append a cross-encoder pass. */
  Boolean rerank;

  Integer rerankTopN;
  Integer hopDepth;

  /** Lexical weight for hybrid fusion. */
  Double alpha;
}
