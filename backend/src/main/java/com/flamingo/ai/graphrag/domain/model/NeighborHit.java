package com.flamingo.ai.graphrag.domain.model;

/**
 * One traversal result: {@code node} was reached from seed {@code seedId} in {@code hop} edge
 * traversals, the last of which was {@code edge}.
 */
public record NeighborHit(String seedId, GraphEdge edge, ChunkRecord node, int hop) {}
