package com.flamingo.ai.graphrag.domain.enums;

/** A single step of a retrieval pipeline. Modes are ordered lists of these. */
public enum PipelineStage {
  /** Word-containment scan that produces seed candidates. */
  LEXICAL_SEED("lexical-seed"),

  /** Embedding similarity over a full namespace scan; produces seed candidates. */
  EMBEDDING_SCAN("embedding-scan"),

  /** Embedding similarity that filters, reorders and truncates the current candidates. */
  EMBEDDING_RERANK("embedding-rerank"),

  /** Embedding similarity annotated onto every current candidate without reordering. */
  EMBEDDING_SCORE("embedding-score"),

  /** Linear fusion of normalized lexical and embedding scores. */
  SCORE_FUSION("score-fusion"),

  /** Multi-hop neighbor expansion from the current seeds. */
  GRAPH_EXPANSION("graph-expansion"),

  /** Pairwise cross-encoder rescoring. */
  CROSS_ENCODER("cross-encoder");

  private final String value;

  PipelineStage(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /** Whether this stage needs the query embedding. */
  public boolean usesEmbedding() {
    return this == EMBEDDING_SCAN || this == EMBEDDING_RERANK || this == EMBEDDING_SCORE;
  }
}
