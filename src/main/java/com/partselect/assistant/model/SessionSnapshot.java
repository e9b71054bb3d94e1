package com.partselect.assistant.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Read-only copy of one session's structured memory.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@Schema(description = "Structured memory kept for a session")
public record SessionSnapshot(
        @JsonProperty("last_intent") IntentType lastIntent,
        @JsonProperty("last_part") String lastPart,
        @JsonProperty("last_model") String lastModel,
        @JsonProperty("last_switch_refused_for") String lastSwitchRefusedFor
) {
    private static final SessionSnapshot EMPTY = new SessionSnapshot(null, null, null, null);

    public static SessionSnapshot empty() {
        return EMPTY;
    }
}
