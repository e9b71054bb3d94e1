package com.partselect.assistant.controller;

import com.partselect.assistant.dto.ChatRequest;
import com.partselect.assistant.dto.ChatResponse;
import com.partselect.assistant.service.DialogueRouterService;
import com.partselect.assistant.service.SessionMemoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

@RestController
@Tag(name = "Chat", description = "Appliance parts assistant conversation endpoint")
public class ChatController {

    static final String SESSION_HEADER = "X-Session-Id";
    static final String DEFAULT_SESSION = "demo";
    static final String BLANK_MESSAGE_REPLY = "Please type a question about your appliance or a part number.";

    private final DialogueRouterService dialogueRouterService;
    private final SessionMemoryService sessionMemoryService;

    public ChatController(DialogueRouterService dialogueRouterService, SessionMemoryService sessionMemoryService) {
        this.dialogueRouterService = dialogueRouterService;
        this.sessionMemoryService = sessionMemoryService;
    }

    @Operation(
            summary = "Send one chat turn",
            description = "Runs the message through the appliance guard, catalog search, installation and " +
                    "compatibility handlers, falling back to retrieval plus the language model. " +
                    "Session memory is keyed by the X-Session-Id header."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reply produced",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ChatResponse.class))),
            @ApiResponse(responseCode = "400", description = "Bad request - message is null or empty",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ChatResponse.class)))
    })
    @PostMapping("/chat")
    public ResponseEntity<ChatResponse> chat(
            @RequestBody(required = false) ChatRequest request,
            @Parameter(description = "Opaque client session id")
            @RequestHeader(value = SESSION_HEADER, defaultValue = DEFAULT_SESSION) String sessionId) {
        if (request == null || !StringUtils.hasText(request.getMessage())) {
            return ResponseEntity.badRequest()
                    .body(new ChatResponse(BLANK_MESSAGE_REPLY, GlobalExceptionHandler.ERROR_INTENT,
                            sessionMemoryService.get(sessionId)));
        }
        return ResponseEntity.ok(dialogueRouterService.handleTurn(request, sessionId));
    }
}
