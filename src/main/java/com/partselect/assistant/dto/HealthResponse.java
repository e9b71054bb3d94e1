package com.partselect.assistant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Readiness counters")
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("catalog_items") int catalogItems,
        @JsonProperty("rag_chunks") int ragChunks,
        @JsonProperty("llm_ready") boolean llmReady
) {
}
