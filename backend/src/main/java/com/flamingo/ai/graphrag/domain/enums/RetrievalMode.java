package com.flamingo.ai.graphrag.domain.enums;

import static com.flamingo.ai.graphrag.domain.enums.PipelineStage.EMBEDDING_RERANK;
import static com.flamingo.ai.graphrag.domain.enums.PipelineStage.EMBEDDING_SCAN;
import static com.flamingo.ai.graphrag.domain.enums.PipelineStage.EMBEDDING_SCORE;
import static com.flamingo.ai.graphrag.domain.enums.PipelineStage.GRAPH_EXPANSION;
import static com.flamingo.ai.graphrag.domain.enums.PipelineStage.LEXICAL_SEED;
import static com.flamingo.ai.graphrag.domain.enums.PipelineStage.SCORE_FUSION;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

/**
 * Named retrieval pipelines. Each mode is a fixed, ordered list of stages; a cross-encoder pass
 * may be appended to any of them per request.
 */
public enum RetrievalMode {
  LEXICAL_ONLY("lexical-only", "Word-match seeds only", List.of(LEXICAL_SEED)),

  EMBEDDING_ONLY(
      "embedding-only",
      "Cosine similarity over every node in the namespace",
      List.of(EMBEDDING_SCAN)),

  HYBRID_FUSION(
      "hybrid-fusion",
      "Word-match seeds fused with embedding similarity",
      List.of(LEXICAL_SEED, EMBEDDING_SCORE, SCORE_FUSION)),

  GRAPH_EXACT(
      "graph-exact",
      "Word-match seeds expanded through graph relationships",
      List.of(LEXICAL_SEED, GRAPH_EXPANSION)),

  GRAPH_EMBED(
      "graph-embed",
      "Embedding seeds expanded through graph relationships",
      List.of(EMBEDDING_SCAN, GRAPH_EXPANSION)),

  GRAPH_HYBRID(
      "graph-hybrid",
      "Word-match seeds, embedding rerank, then graph expansion",
      List.of(LEXICAL_SEED, EMBEDDING_RERANK, GRAPH_EXPANSION));

  private final String value;
  private final String description;
  private final List<PipelineStage> stages;

  RetrievalMode(String value, String description, List<PipelineStage> stages) {
    this.value = value;
    this.description = description;
    this.stages = stages;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public String getDescription() {
    return description;
  }

  public List<PipelineStage> getStages() {
    return stages;
  }

  public boolean usesEmbedding() {
    return stages.stream().anyMatch(PipelineStage::usesEmbedding);
  }

  /** Accepts the wire name ({@code graph-hybrid}) or the constant name ({@code GRAPH_HYBRID}). */
  @JsonCreator
  public static RetrievalMode fromValue(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (RetrievalMode mode : values()) {
      if (mode.value.equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown retrieval mode: " + raw);
  }
}
