package com.flamingo.ai.graphrag.domain.model;

/** A result candidate that entered the ranking through a graph relationship. */
public record GraphContextEntry(
    String nodeId, String relationType, String textPreview, String seedId, int hop) {

  /**
   * Builds an entry from a neighbor candidate, previewing at most {@code previewLength} code
   * points of its text.
   */
  public static GraphContextEntry from(Candidate neighbor, int previewLength) {
    return new GraphContextEntry(
        neighbor.getChunkId(),
        neighbor.getRelationType(),
        preview(neighbor.getText(), previewLength),
        neighbor.getSeedId(),
        neighbor.getHop());
  }

  static String preview(String text, int previewLength) {
    if (text == null) {
      return "";
    }
    if (text.codePointCount(0, text.length()) <= previewLength) {
      return text;
    }
    return text.substring(0, text.offsetByCodePoints(0, previewLength));
  }
}
