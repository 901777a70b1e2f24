package com.flamingo.ai.graphrag.domain.model;

import com.flamingo.ai.graphrag.domain.enums.ChunkType;
import java.util.List;
import java.util.Objects;

/**
 * A graph node materialized by the document indexer. Read-only from the retrieval engine's point
 * of view.
 *
 * @param id unique node id
 * @param text node text, may be null for purely structural nodes
 * @param type structural chunk type
 * @param parentId id of the structural parent, null for roots
 * @param embedding fixed-dimension embedding, null when the node was never embedded
 */
public record ChunkRecord(
    String id, String text, ChunkType type, String parentId, List<Float> embedding) {

  public ChunkRecord {
    Objects.requireNonNull(id, "id");
    type = type != null ? type : ChunkType.OTHER;
    embedding = embedding != null ? List.copyOf(embedding) : null;
  }

  /** Convenience factory for a node without parent or embedding. */
  public static ChunkRecord of(String id, String text) {
    return new ChunkRecord(id, text, ChunkType.OTHER, null, null);
  }

  public boolean hasText() {
    return text != null;
  }

  public boolean hasEmbedding() {
    return embedding != null && !embedding.isEmpty();
  }

  public ChunkRecord withEmbedding(List<Float> newEmbedding) {
    return new ChunkRecord(id, text, type, parentId, newEmbedding);
  }
}
