package com.flamingo.ai.graphrag.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.graphrag.domain.enums.PipelineStage;
import com.flamingo.ai.graphrag.domain.enums.RetrievalMode;
import java.util.List;

/** A retrieval mode as advertised to callers. */
public record ModeDescription(
    String name,
    String description,
    List<String> stages,
    @JsonProperty("uses_embedding") boolean usesEmbedding) {

  public static ModeDescription from(RetrievalMode mode) {
    return new ModeDescription(
        mode.getValue(),
        mode.getDescription(),
        mode.getStages().stream().map(PipelineStage::getValue).toList(),
        mode.usesEmbedding());
  }
}
