package com.flamingo.ai.graphrag.service.retrieval;

import java.util.List;

/** Cosine similarity over float vectors. */
public final class CosineSimilarity {

  private CosineSimilarity() {}

  /**
   * Returns {@code dot(a, b) / (|a| * |b|)} in [-1, 1]; 0 when either vector has zero norm or the
   * dimensions differ.
   */
  public static double between(List<Float> a, List<Float> b) {
    if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
      return 0.0;
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
    // clamp rounding drift
    return Math.max(-1.0, Math.min(1.0, similarity));
  }
}
