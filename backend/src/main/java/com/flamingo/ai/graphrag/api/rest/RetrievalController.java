package com.flamingo.ai.graphrag.api.rest;

import com.flamingo.ai.graphrag.api.dto.request.BatchRetrieveRequest;
import com.flamingo.ai.graphrag.api.dto.request.RerankRequest;
import com.flamingo.ai.graphrag.api.dto.request.RetrieveRequest;
import com.flamingo.ai.graphrag.api.dto.response.BatchRetrieveResponse;
import com.flamingo.ai.graphrag.api.dto.response.ModeDescription;
import com.flamingo.ai.graphrag.api.dto.response.RerankResponse;
import com.flamingo.ai.graphrag.api.dto.response.RetrieveResponse;
import com.flamingo.ai.graphrag.config.RetrievalConfig;
import com.flamingo.ai.graphrag.domain.enums.RetrievalMode;
import com.flamingo.ai.graphrag.domain.model.Candidate;
import com.flamingo.ai.graphrag.domain.model.RetrievalResult;
import com.flamingo.ai.graphrag.service.rerank.CrossEncoderReranker;
import com.flamingo.ai.graphrag.service.rerank.RerankOutcome;
import com.flamingo.ai.graphrag.service.retrieval.RetrievalOrchestrator;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for retrieval, standalone reranking and mode discovery. */
@RestController
@RequestMapping("/api/retrieval")
@RequiredArgsConstructor
public class RetrievalController {

  private final RetrievalOrchestrator retrievalOrchestrator;
  private final CrossEncoderReranker crossEncoderReranker;
  private final RetrievalConfig retrievalConfig;

  /** Retrieves ranked passages for a query. A failed graph query answers 502 with the result. */
  @PostMapping("/retrieve")
  public ResponseEntity<RetrieveResponse> retrieve(@Valid @RequestBody RetrieveRequest request) {
    RetrievalResult result = retrievalOrchestrator.retrieve(request.toRetrievalRequest());
    RetrieveResponse response = RetrieveResponse.from(result);
    if (result.isFailed()) {
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
    }
    return ResponseEntity.ok(response);
  }

  /**
   * Retrieves several queries with one embedding call. Each entry carries its own warnings and
   * error; a failed graph query in one entry does not fail the others.
   */
  @PostMapping("/retrieve/batch")
  public ResponseEntity<BatchRetrieveResponse> retrieveBatch(
      @Valid @RequestBody BatchRetrieveRequest request) {
    List<RetrievalResult> results =
        retrievalOrchestrator.retrieveAll(request.toRetrievalRequests());
    return ResponseEntity.ok(BatchRetrieveResponse.from(results));
  }

  /** Reranks caller-supplied chunks with the cross-encoder. */
  @PostMapping("/rerank")
  public ResponseEntity<RerankResponse> rerank(@Valid @RequestBody RerankRequest request) {
    List<Candidate> candidates =
        request.getChunks().stream()
            .map(chunk -> Candidate.builder().chunkId(chunk.getId()).text(chunk.getText()).build())
            .toList();
    int topN =
        request.getTopN() != null ? request.getTopN() : retrievalConfig.getReranking().getTopN();

    RerankOutcome outcome = crossEncoderReranker.rerank(request.getQuery(), candidates, topN);

    List<RerankResponse.RankedChunk> ranked = new ArrayList<>();
    for (int i = 0; i < outcome.candidates().size(); i++) {
      Candidate candidate = outcome.candidates().get(i);
      ranked.add(
          new RerankResponse.RankedChunk(
              candidate.getChunkId(), candidate.getText(), outcome.scores().get(i)));
    }
    return ResponseEntity.ok(
        RerankResponse.builder()
            .rerankedChunks(ranked)
            .scores(outcome.scores())
            .warnings(outcome.isFallback() ? List.of(outcome.warning()) : List.of())
            .build());
  }

  /** Lists the available retrieval modes and their stages. */
  @GetMapping("/modes")
  public ResponseEntity<List<ModeDescription>> modes() {
    return ResponseEntity.ok(
        Arrays.stream(RetrievalMode.values()).map(ModeDescription::from).toList());
  }
}
