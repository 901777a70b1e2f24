package com.flamingo.ai.graphrag.domain.model;

import java.util.Objects;

/** A typed relationship between two graph nodes. */
public record GraphEdge(String sourceId, String targetId, String relationType) {

  public GraphEdge {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(relationType, "relationType");
  }

  /** Returns the endpoint opposite to {@code nodeId}. */
  public String otherEnd(String nodeId) {
    return sourceId.equals(nodeId) ? targetId : sourceId;
  }
}
