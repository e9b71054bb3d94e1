package com.partselect.assistant.controller;

import com.partselect.assistant.dto.ChatRequest;
import com.partselect.assistant.dto.ChatResponse;
import com.partselect.assistant.model.IntentType;
import com.partselect.assistant.model.SessionSnapshot;
import com.partselect.assistant.service.DialogueRouterService;
import com.partselect.assistant.service.SessionMemoryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatController.class)
class ChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DialogueRouterService dialogueRouterService;

    @MockBean
    private SessionMemoryService sessionMemoryService;

    @Test
    void returnsRouterReplyWithSnakeCaseMemory() throws Exception {
        SessionSnapshot memory = new SessionSnapshot(IntentType.INSTALLATION, "PS11752778", null, null);
        when(dialogueRouterService.handleTurn(any(ChatRequest.class), eq("abc")))
                .thenReturn(new ChatResponse("General guide for PS11752778", "installation", memory));

        mockMvc.perform(post("/chat")
                        .header("X-Session-Id", "abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"How do I install PS11752778?\",\"appliance\":\"dishwasher\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("General guide for PS11752778"))
                .andExpect(jsonPath("$.intent").value("installation"))
                .andExpect(jsonPath("$.memory.last_intent").value("installation"))
                .andExpect(jsonPath("$.memory.last_part").value("PS11752778"));
    }

    @Test
    void missingHeaderUsesDemoSession() throws Exception {
        when(dialogueRouterService.handleTurn(any(ChatRequest.class), eq("demo")))
                .thenReturn(new ChatResponse("ok", "general_help", SessionSnapshot.empty()));

        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isOk());

        verify(dialogueRouterService).handleTurn(any(ChatRequest.class), eq("demo"));
    }

    @Test
    void blankMessageIsRejected() throws Exception {
        when(sessionMemoryService.get("demo")).thenReturn(SessionSnapshot.empty());

        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.intent").value("error"))
                .andExpect(jsonPath("$.response").value(ChatController.BLANK_MESSAGE_REPLY));

        verifyNoInteractions(dialogueRouterService);
    }

    @Test
    void malformedJsonGetsPlainLanguageReply() throws Exception {
        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.intent").value("error"))
                .andExpect(jsonPath("$.response").value(GlobalExceptionHandler.UNREADABLE_REPLY));
    }

    @Test
    void unexpectedFailureHidesStackTraceAndKeepsSessionMemory() throws Exception {
        when(dialogueRouterService.handleTurn(any(ChatRequest.class), eq("abc")))
                .thenThrow(new IllegalStateException("boom"));
        when(sessionMemoryService.get("abc"))
                .thenReturn(new SessionSnapshot(IntentType.COMPATIBILITY, "PS11752778", "WRS325SDHZ08", null));

        mockMvc.perform(post("/chat")
                        .header("X-Session-Id", "abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.intent").value("error"))
                .andExpect(jsonPath("$.response").value(GlobalExceptionHandler.FAILURE_REPLY))
                .andExpect(jsonPath("$.memory.last_part").value("PS11752778"))
                .andExpect(jsonPath("$.memory.last_model").value("WRS325SDHZ08"));
    }
}
