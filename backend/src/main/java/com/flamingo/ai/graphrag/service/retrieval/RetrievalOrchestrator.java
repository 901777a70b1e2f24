package com.flamingo.ai.graphrag.service.retrieval;

import com.flamingo.ai.graphrag.config.RetrievalConfig;
import com.flamingo.ai.graphrag.domain.enums.PipelineStage;
import com.flamingo.ai.graphrag.domain.enums.RetrievalMode;
import com.flamingo.ai.graphrag.domain.model.Candidate;
import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import com.flamingo.ai.graphrag.domain.model.GraphContextEntry;
import com.flamingo.ai.graphrag.domain.model.RetrievalResult;
import com.flamingo.ai.graphrag.exception.GraphQueryFailedException;
import com.flamingo.ai.graphrag.exception.GraphStoreUnavailableException;
import com.flamingo.ai.graphrag.exception.InvalidInputException;
import com.flamingo.ai.graphrag.exception.ProviderUnavailableException;
import com.flamingo.ai.graphrag.graph.GraphStore;
import com.flamingo.ai.graphrag.graph.NamespaceValidator;
import com.flamingo.ai.graphrag.service.provider.EmbeddingService;
import com.flamingo.ai.graphrag.service.rerank.CrossEncoderReranker;
import com.flamingo.ai.graphrag.service.rerank.RerankOutcome;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a retrieval mode's stages in order and assembles the final, deduplicated result.
 *
 * <p>Stateless: everything a request touches lives in its own {@link PipelineContext}, so requests
 * run in parallel without coordination. Model failures degrade the affected stage and are reported
 * as warnings; a failed graph query yields an empty result carrying the error; an unreachable
 * graph store is thrown to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalOrchestrator {

  private final GraphStore graphStore;
  private final LexicalSeedSelector lexicalSeedSelector;
  private final VectorSimilarityRanker vectorSimilarityRanker;
  private final GraphNeighborExpander graphNeighborExpander;
  private final ScoreFusionEngine scoreFusionEngine;
  private final CandidateMerger candidateMerger;
  private final CrossEncoderReranker crossEncoderReranker;
  private final EmbeddingService embeddingService;
  private final RetrievalConfig retrievalConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Retrieves passages for a query.
   *
   * @param request the request; unset options take configured defaults
   * @return the ranked result, or an empty result with {@code error} set when a graph query failed
   * @throws InvalidInputException if the request is invalid; no stage has run
   * @throws GraphStoreUnavailableException if the graph store cannot be reached
   */
  @Timed(value = "retrieval.retrieve", description = "Time for a full retrieval request")
  public RetrievalResult retrieve(RetrievalRequest request) {
    return execute(validate(request));
  }

  /**
   * Retrieves passages for several queries. All query embeddings are computed with one batch call;
   * each request otherwise runs on its own and keeps its own warnings and error.
   *
   * @param requests the requests, in order
   * @return one result per request, in request order
   * @throws InvalidInputException if any request is invalid; no stage has run for any of them
   * @throws GraphStoreUnavailableException if the graph store cannot be reached
   */
  @Timed(value = "retrieval.retrieve.batch", description = "Time for a batch retrieval request")
  public List<RetrievalResult> retrieveAll(List<RetrievalRequest> requests) {
    if (requests == null || requests.isEmpty()) {
      throw new InvalidInputException("requests", "must not be empty");
    }
    int maxBatchSize = retrievalConfig.getRequest().getMaxBatchSize();
    if (requests.size() > maxBatchSize) {
      throw new InvalidInputException(
          "requests", "at most " + maxBatchSize + " per batch, got " + requests.size());
    }
    List<PipelineContext> contexts = requests.stream().map(this::validate).toList();
    embedAll(contexts);

    List<RetrievalResult> results = new ArrayList<>(contexts.size());
    for (PipelineContext ctx : contexts) {
      results.add(execute(ctx));
    }
    log.info("Batch retrieval complete: {} requests", results.size());
    return results;
  }

  private RetrievalResult execute(PipelineContext ctx) {
    meterRegistry.counter("retrieval.requests", "mode", ctx.mode.getValue()).increment();
    log.debug(
        "Retrieving mode={} namespace={} topK={} rerank={} query='{}'",
        ctx.mode.getValue(),
        ctx.namespace,
        ctx.topK,
        ctx.rerank,
        ctx.query);

    try {
      for (PipelineStage stage : ctx.mode.getStages()) {
        runStage(stage, ctx);
      }
    } catch (GraphStoreUnavailableException e) {
      meterRegistry.counter("retrieval.failures", "type", "graph_unavailable").increment();
      log.error(
          "Graph store unavailable during {} retrieval: {}", ctx.mode.getValue(), e.getMessage());
      throw e;
    } catch (GraphQueryFailedException e) {
      meterRegistry.counter("retrieval.failures", "type", "graph_query").increment();
      log.error("Graph query failed during {} retrieval: {}", ctx.mode.getValue(), e.getMessage());
      ctx.warnings.add("graph query failed: " + e.getMessage());
      return RetrievalResult.failed(
          ctx.mode.getValue(), ctx.embeddingUsed, ctx.warnings, e.getMessage());
    }

    List<Candidate> merged = candidateMerger.merge(ctx.candidates, ctx.neighbors);

    boolean rerankApplied = false;
    if (ctx.rerank) {
      RerankOutcome outcome = crossEncoderReranker.rerank(ctx.query, merged, ctx.rerankTopN);
      if (outcome.isFallback()) {
        degrade(PipelineStage.CROSS_ENCODER, outcome.warning(), ctx);
      }
      merged = outcome.candidates().stream().sorted(Candidate.RANKING_ORDER).toList();
      ctx.stagesRun.add(PipelineStage.CROSS_ENCODER.getValue());
      rerankApplied = true;
    }

    List<Candidate> finalCandidates = merged.subList(0, Math.min(ctx.topK, merged.size()));
    int previewLength = retrievalConfig.getRequest().getTextPreviewLength();
    List<GraphContextEntry> graphContext =
        finalCandidates.stream()
            .filter(candidate -> !candidate.isSeed())
            .map(candidate -> GraphContextEntry.from(candidate, previewLength))
            .toList();

    log.info(
        "Retrieval complete: mode={}, candidates={}, neighbors={}, embeddingUsed={}, warnings={}",
        ctx.mode.getValue(),
        finalCandidates.size(),
        graphContext.size(),
        ctx.embeddingUsed,
        ctx.warnings.size());

    return new RetrievalResult(
        finalCandidates,
        graphContext,
        ctx.mode.getValue(),
        ctx.embeddingUsed,
        rerankApplied,
        ctx.stagesRun,
        ctx.warnings,
        null);
  }

  private void runStage(PipelineStage stage, PipelineContext ctx) {
    switch (stage) {
      case LEXICAL_SEED -> ctx.candidates = lexicalSeedSelector.select(ctx.query, nodes(ctx));
      case EMBEDDING_SCAN -> {
        List<Float> vector = queryVector(stage, ctx);
        if (vector != null) {
          ctx.candidates = vectorSimilarityRanker.scan(ctx.namespace, vector, nodes(ctx));
        } else if (retrievalConfig.getEmbedding().isFallbackToLexicalSeeds()) {
          ctx.warnings.add("embedding scan replaced by lexical seeds");
          ctx.candidates = lexicalSeedSelector.select(ctx.query, nodes(ctx));
        } else {
          return;
        }
      }
      case EMBEDDING_RERANK -> {
        List<Float> vector = queryVector(stage, ctx);
        if (vector == null) {
          return;
        }
        ctx.candidates =
            vectorSimilarityRanker.rank(ctx.namespace, vector, ctx.candidates, nodesById(ctx));
      }
      case EMBEDDING_SCORE -> {
        List<Float> vector = queryVector(stage, ctx);
        if (vector == null) {
          return;
        }
        ctx.candidates =
            vectorSimilarityRanker.score(ctx.namespace, vector, ctx.candidates, nodesById(ctx));
      }
      case SCORE_FUSION -> {
        // without a query vector the lexical order stands
        if (!ctx.embeddingUsed) {
          return;
        }
        ctx.candidates = scoreFusionEngine.fuse(ctx.candidates, ctx.alpha);
      }
      case GRAPH_EXPANSION ->
          ctx.neighbors = graphNeighborExpander.expand(ctx.namespace, ctx.candidates, ctx.hopDepth);
      case CROSS_ENCODER -> throw new IllegalStateException("cross-encoder runs after merging");
    }
    ctx.stagesRun.add(stage.getValue());
    log.debug("Stage {} produced {} candidates", stage.getValue(), ctx.candidates.size());
  }

  /** The query embedding, computed at most once per request; null when unavailable. */
  private List<Float> queryVector(PipelineStage stage, PipelineContext ctx) {
    if (!ctx.embeddingAttempted) {
      ctx.embeddingAttempted = true;
      try {
        ctx.queryVector = embeddingService.embed(embeddingInput(ctx));
        ctx.embeddingUsed = true;
      } catch (ProviderUnavailableException e) {
        degrade(stage, "embedding unavailable: " + e.getMessage(), ctx);
      } catch (RuntimeException e) {
        degrade(stage, "embedding failed: " + e.getMessage(), ctx);
      }
    } else if (ctx.queryVector == null) {
      log.debug("Skipping {}: no query embedding", stage.getValue());
    }
    return ctx.queryVector;
  }

  /**
   * Embeds the queries of every context whose mode needs a vector in one provider call. On failure
   * each of those contexts degrades on its own at its first embedding stage.
   */
  private void embedAll(List<PipelineContext> contexts) {
    List<PipelineContext> pending =
        contexts.stream().filter(ctx -> ctx.mode.usesEmbedding()).toList();
    if (pending.isEmpty()) {
      return;
    }
    List<List<Float>> vectors;
    String failure;
    try {
      vectors = embeddingService.embedBatch(pending.stream().map(this::embeddingInput).toList());
      failure = null;
    } catch (ProviderUnavailableException e) {
      vectors = null;
      failure = "embedding unavailable: " + e.getMessage();
    } catch (RuntimeException e) {
      vectors = null;
      failure = "embedding failed: " + e.getMessage();
    }
    if (vectors != null && vectors.size() != pending.size()) {
      failure =
          "embedding returned " + vectors.size() + " vectors for " + pending.size() + " queries";
      vectors = null;
    }

    for (int i = 0; i < pending.size(); i++) {
      PipelineContext ctx = pending.get(i);
      ctx.embeddingAttempted = true;
      if (vectors != null) {
        ctx.queryVector = vectors.get(i);
        ctx.embeddingUsed = true;
      } else {
        degrade(firstEmbeddingStage(ctx.mode), failure, ctx);
      }
    }
    log.debug("Embedded {} batch queries, failure={}", pending.size(), failure);
  }

  private String embeddingInput(PipelineContext ctx) {
    String prefix = retrievalConfig.getEmbedding().getQueryPrefix();
    return prefix == null ? ctx.query : prefix + ctx.query;
  }

  private static PipelineStage firstEmbeddingStage(RetrievalMode mode) {
    return mode.getStages().stream()
        .filter(PipelineStage::usesEmbedding)
        .findFirst()
        .orElseThrow(() -> new IllegalStateException(mode.getValue() + " uses no embedding"));
  }

  private List<ChunkRecord> nodes(PipelineContext ctx) {
    if (ctx.nodes == null) {
      ctx.nodes = graphStore.scanByLabel(ctx.namespace);
    }
    return ctx.nodes;
  }

  private Map<String, ChunkRecord> nodesById(PipelineContext ctx) {
    if (ctx.nodesById == null) {
      ctx.nodesById = VectorSimilarityRanker.index(nodes(ctx));
    }
    return ctx.nodesById;
  }

  private void degrade(PipelineStage stage, String warning, PipelineContext ctx) {
    log.warn("Stage {} degraded: {}", stage.getValue(), warning);
    meterRegistry.counter("retrieval.degraded", "stage", stage.getValue()).increment();
    ctx.warnings.add(warning);
  }

  private PipelineContext validate(RetrievalRequest request) {
    RetrievalConfig.Request defaults = retrievalConfig.getRequest();
    RetrievalConfig.Graph graph = retrievalConfig.getGraph();

    String query = request.getQuery();
    if (query == null || query.isBlank()) {
      throw new InvalidInputException("query", "must not be blank");
    }

    int topK = request.getTopK() != null ? request.getTopK() : defaults.getDefaultTopK();
    if (topK < 1 || topK > defaults.getMaxTopK()) {
      throw new InvalidInputException(
          "top_k", "must be between 1 and " + defaults.getMaxTopK() + ", got " + topK);
    }

    String namespace =
        request.getNamespace() != null ? request.getNamespace() : defaults.getDefaultNamespace();
    NamespaceValidator.requireValid(namespace);

    int hopDepth = request.getHopDepth() != null ? request.getHopDepth() : graph.getHopDepth();
    if (hopDepth < 1 || hopDepth > graph.getMaxHopDepth()) {
      throw new InvalidInputException(
          "hop_depth", "must be between 1 and " + graph.getMaxHopDepth() + ", got " + hopDepth);
    }

    double alpha =
        request.getAlpha() != null ? request.getAlpha() : retrievalConfig.getFusion().getAlpha();
    if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
      throw new InvalidInputException("alpha", "must be between 0 and 1, got " + alpha);
    }

    RetrievalConfig.Reranking reranking = retrievalConfig.getReranking();
    int rerankTopN =
        request.getRerankTopN() != null ? request.getRerankTopN() : reranking.getTopN();
    if (rerankTopN < 1) {
      throw new InvalidInputException("rerank_top_n", "must be at least 1, got " + rerankTopN);
    }

    PipelineContext ctx = new PipelineContext();
    ctx.query = query.trim();
    ctx.topK = topK;
    ctx.namespace = namespace;
    ctx.mode = request.getMode() != null ? request.getMode() : defaults.getDefaultMode();
    ctx.rerank =
        request.getRerank() != null ? request.getRerank() : reranking.isEnabledByDefault();
    ctx.rerankTopN = rerankTopN;
    ctx.hopDepth = hopDepth;
    ctx.alpha = alpha;
    return ctx;
  }

  /** Mutable state of one request; never shared between threads. */
  private static final class PipelineContext {
    private String query;
    private int topK;
    private String namespace;
    private RetrievalMode mode;
    private boolean rerank;
    private int rerankTopN;
    private int hopDepth;
    private double alpha;

    private List<ChunkRecord> nodes;
    private Map<String, ChunkRecord> nodesById;
    private List<Float> queryVector;
    private boolean embeddingAttempted;
    private boolean embeddingUsed;

    private List<Candidate> candidates = List.of();
    private List<Candidate> neighbors = List.of();
    private final List<String> stagesRun = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
  }
}
