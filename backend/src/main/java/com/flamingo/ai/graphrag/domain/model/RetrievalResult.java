package com.flamingo.ai.graphrag.domain.model;

import java.util.List;

/**
 * Outcome of one retrieval request. Created fresh per request; all lists are unmodifiable copies.
 *
 * @param candidates ranked, deduplicated candidates, at most {@code top_k}
 * @param graphContext neighbors in {@code candidates} that were reached through the graph
 * @param modeUsed wire name of the pipeline mode that ran
 * @param embeddingUsed whether a query embedding was obtained and used
 * @param rerankApplied whether a cross-encoder pass ran (including its fallback)
 * @param stagesRun names of the stages that completed, in order
 * @param warnings human-readable degradation notes
 * @param error non-null when the retrieval failed on the graph store; candidates are then empty
 */
public record RetrievalResult(
    List<Candidate> candidates,
    List<GraphContextEntry> graphContext,
    String modeUsed,
    boolean embeddingUsed,
    boolean rerankApplied,
    List<String> stagesRun,
    List<String> warnings,
    String error) {

  public RetrievalResult {
    candidates = List.copyOf(candidates);
    graphContext = List.copyOf(graphContext);
    stagesRun = List.copyOf(stagesRun);
    warnings = List.copyOf(warnings);
  }

  /** An empty result flagged with the graph failure that aborted it. */
  public static RetrievalResult failed(
      String modeUsed, boolean embeddingUsed, List<String> warnings, String error) {
    return new RetrievalResult(
        List.of(), List.of(), modeUsed, embeddingUsed, false, List.of(), warnings, error);
  }

  public boolean isFailed() {
    return error != null;
  }
}
