package com.flamingo.ai.graphrag.service.retrieval;

import com.flamingo.ai.graphrag.domain.model.Candidate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Deduplicates candidates by chunk id and applies the final ranking order. */
@Component
public class CandidateMerger {

  /**
   * Merges candidate lists in arrival order. For a repeated chunk id a seed beats a neighbor, then
   * the higher effective score wins, then the first arrival is kept.
   */
  @SafeVarargs
  public final List<Candidate> merge(List<Candidate>... lists) {
    Map<String, Candidate> byId = new LinkedHashMap<>();
    for (List<Candidate> list : lists) {
      for (Candidate candidate : list) {
        byId.merge(candidate.getChunkId(), candidate, CandidateMerger::prefer);
      }
    }
    return byId.values().stream().sorted(Candidate.RANKING_ORDER).toList();
  }

  private static Candidate prefer(Candidate kept, Candidate offered) {
    if (kept.isSeed() != offered.isSeed()) {
      return kept.isSeed() ? kept : offered;
    }
    return offered.effectiveScore() > kept.effectiveScore() ? offered : kept;
  }
}
