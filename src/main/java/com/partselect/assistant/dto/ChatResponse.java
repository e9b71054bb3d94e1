package com.partselect.assistant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.partselect.assistant.model.SessionSnapshot;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Schema(description = "Assistant reply for one turn")
public class ChatResponse {
    @JsonProperty("response")
    @Schema(description = "Plain-language reply shown to the user")
    private String response;

    @JsonProperty("intent")
    @Schema(description = "Label of the branch that produced the reply", example = "installation")
    private String intent;

    @JsonProperty("memory")
    @Schema(description = "Session memory after the turn")
    private SessionSnapshot memory;
}
