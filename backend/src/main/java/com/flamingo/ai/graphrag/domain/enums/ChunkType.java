package com.flamingo.ai.graphrag.domain.enums;

import java.util.Locale;

/** Structural kind of an indexed chunk, as produced by the document structure parser. */
public enum ChunkType {
  DOCUMENT("document"),
  CHAPTER("chapter"),
  ARTICLE("article"),
  CLAUSE("clause"),
  POINT("point"),
  SUBPOINT("subpoint"),
  /** Any type the indexer emits that this engine does not distinguish. */
  OTHER("other");

  private final String value;

  ChunkType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /** Lenient lookup; null, blank and unknown values map to {@link #OTHER}. */
  public static ChunkType fromValue(String raw) {
    if (raw == null || raw.isBlank()) {
      return OTHER;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (ChunkType type : values()) {
      if (type.value.equals(normalized)) {
        return type;
      }
    }
    return OTHER;
  }
}
