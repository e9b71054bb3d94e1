package com.partselect.assistant.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One user turn sent to the assistant")
public class ChatRequest {
    @Schema(description = "Free-text user message", required = true, example = "How do I install PS11752778?")
    private String message;

    @Schema(description = "Optional part number the client already knows", example = "PS11752778")
    private String part;

    @Schema(description = "Optional appliance model number the client already knows", example = "WDT780SAEM1")
    private String model;

    @Builder.Default
    @Schema(description = "Appliance context currently selected in the UI", example = "dishwasher")
    private String appliance = "dishwasher";
}
