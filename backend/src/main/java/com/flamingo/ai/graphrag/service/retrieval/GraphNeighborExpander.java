package com.flamingo.ai.graphrag.service.retrieval;

import com.flamingo.ai.graphrag.config.RetrievalConfig;
import com.flamingo.ai.graphrag.domain.enums.HopDiscountPolicy;
import com.flamingo.ai.graphrag.domain.model.Candidate;
import com.flamingo.ai.graphrag.domain.model.NeighborHit;
import com.flamingo.ai.graphrag.graph.GraphStore;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Expands seed candidates with their graph neighbors.
 *
 * <p>A neighbor inherits its seed's score multiplied by the hop discount. Each seed contributes at
 * most {@code retrieval.graph.neighbor-limit} neighbors, closest first. When several seeds or paths
 * reach the same node, the best scoring path wins.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GraphNeighborExpander {

  /** Per-seed order before capping. */
  private static final Comparator<NeighborHit> PER_SEED_ORDER =
      Comparator.comparingInt(NeighborHit::hop)
          .thenComparing(hit -> hit.node().id())
          .thenComparing(hit -> hit.edge().relationType());

  /** Which of two candidates for the same neighbor is kept. */
  private static final Comparator<Candidate> PATH_PREFERENCE =
      Comparator.comparingDouble(Candidate::getHybridScore)
          .reversed()
          .thenComparingInt(Candidate::getHop)
          .thenComparing(Candidate::getRelationType)
          .thenComparing(Candidate::getSeedId);

  private final GraphStore graphStore;
  private final RetrievalConfig retrievalConfig;

  /**
   * Returns neighbor candidates for the given seeds, never including a seed itself, in first
   * discovery order.
   *
   * @param namespace namespace to traverse
   * @param seeds current seed candidates
   * @param hopDepth maximum path length
   */
  @Timed(value = "retrieval.expand", description = "Time for graph neighbor expansion")
  public List<Candidate> expand(String namespace, List<Candidate> seeds, int hopDepth) {
    if (seeds.isEmpty()) {
      return List.of();
    }
    RetrievalConfig.Graph graph = retrievalConfig.getGraph();
    Map<String, Candidate> seedsById = new LinkedHashMap<>();
    seeds.forEach(seed -> seedsById.putIfAbsent(seed.getChunkId(), seed));

    List<NeighborHit> hits = graphStore.neighbors(namespace, seedsById.keySet(), hopDepth);

    Map<String, List<NeighborHit>> hitsBySeed =
        hits.stream()
            .filter(hit -> seedsById.containsKey(hit.seedId()))
            .filter(hit -> !seedsById.containsKey(hit.node().id()))
            .filter(hit -> hit.node().hasText())
            .collect(
                Collectors.groupingBy(
                    NeighborHit::seedId, LinkedHashMap::new, Collectors.toList()));

    Map<String, Candidate> best = new LinkedHashMap<>();
    for (Map.Entry<String, Candidate> entry : seedsById.entrySet()) {
      List<NeighborHit> seedHits = hitsBySeed.getOrDefault(entry.getKey(), List.of());
      for (Candidate neighbor :
          capPerSeed(seedHits, entry.getValue(), graph.getNeighborLimit(), graph)) {
        best.merge(
            neighbor.getChunkId(),
            neighbor,
            (kept, offered) -> PATH_PREFERENCE.compare(offered, kept) < 0 ? offered : kept);
      }
    }

    log.debug(
        "Graph expansion: {} seeds, {} paths, {} distinct neighbors (hops={})",
        seedsById.size(),
        hits.size(),
        best.size(),
        hopDepth);
    return new ArrayList<>(best.values());
  }

  private List<Candidate> capPerSeed(
      List<NeighborHit> seedHits, Candidate seed, int limit, RetrievalConfig.Graph graph) {
    // one entry per neighbor node, keeping its shortest path
    Map<String, NeighborHit> closest = new LinkedHashMap<>();
    seedHits.stream()
        .sorted(PER_SEED_ORDER)
        .forEach(hit -> closest.putIfAbsent(hit.node().id(), hit));

    return closest.values().stream()
        .limit(limit)
        .map(hit -> toCandidate(hit, seed, graph))
        .toList();
  }

  private Candidate toCandidate(NeighborHit hit, Candidate seed, RetrievalConfig.Graph graph) {
    HopDiscountPolicy policy = graph.getDiscountPolicy();
    double score =
        Math.max(seed.effectiveScore(), 0.0)
            * policy.factor(graph.getNeighborDiscount(), hit.hop());
    return Candidate.builder()
        .chunkId(hit.node().id())
        .text(hit.node().text())
        .chunkType(hit.node().type())
        .lexicalScore(0.0)
        .hybridScore(score)
        .seed(false)
        .relationType(hit.edge().relationType())
        .seedId(hit.seedId())
        .hop(hit.hop())
        .build();
  }
}
