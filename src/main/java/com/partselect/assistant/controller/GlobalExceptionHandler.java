package com.partselect.assistant.controller;

import com.partselect.assistant.dto.ChatResponse;
import com.partselect.assistant.model.SessionSnapshot;
import com.partselect.assistant.service.SessionMemoryService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.util.StringUtils;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns anything that escapes a handler into a plain-language reply; users never see a stack trace.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_INTENT = "error";
    static final String UNREADABLE_REPLY = "Sorry, I couldn't read that request. Please send a JSON body with a message.";
    static final String FAILURE_REPLY = "Sorry, something went wrong on our side. Please try again, or search the "
            + "official catalog at https://www.partselect.com/";

    private final SessionMemoryService sessionMemoryService;

    public GlobalExceptionHandler(SessionMemoryService sessionMemoryService) {
        this.sessionMemoryService = sessionMemoryService;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ChatResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        logger.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ChatResponse(UNREADABLE_REPLY, ERROR_INTENT, memoryOf(request)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ChatResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse errorResponse) {
            // framework errors (unknown path, missing parameter) keep their own status
            logger.warn("Request rejected with {}: {}", errorResponse.getStatusCode(), ex.getMessage());
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(new ChatResponse(errorResponse.getBody().getDetail(), ERROR_INTENT, memoryOf(request)));
        }
        logger.error("Unhandled error while serving request: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ChatResponse(FAILURE_REPLY, ERROR_INTENT, memoryOf(request)));
    }

    private SessionSnapshot memoryOf(HttpServletRequest request) {
        String sessionId = request.getHeader(ChatController.SESSION_HEADER);
        return sessionMemoryService.get(StringUtils.hasText(sessionId) ? sessionId : ChatController.DEFAULT_SESSION);
    }
}
