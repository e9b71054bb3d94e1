package com.partselect.assistant.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BedrockAnswerServiceTest {

    private static final String MODEL_ID = "anthropic.claude-3-haiku-20240307-v1:0";

    @Mock
    private BedrockRuntimeClient bedrockClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @SuppressWarnings("UnstableApiUsage")
    private BedrockAnswerService service(boolean enabled) {
        return new BedrockAnswerService(bedrockClient, objectMapper, RateLimiter.create(1000), MODEL_ID,
                256, 0.2, enabled, 100, 2, 0);
    }

    private static InvokeModelResponse reply(String json) {
        return InvokeModelResponse.builder().body(SdkBytes.fromUtf8String(json)).build();
    }

    private static BedrockRuntimeException apiError(int status) {
        return (BedrockRuntimeException) BedrockRuntimeException.builder()
                .statusCode(status)
                .message("status " + status)
                .build();
    }

    @Test
    void returnsTrimmedFirstTextBlock() throws Exception {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenReturn(reply("{\"content\":[{\"type\":\"text\",\"text\":\"  Unplug it first.  \"}]}"));

        assertThat(service(true).answer("prompt text")).isEqualTo("Unplug it first.");

        ArgumentCaptor<InvokeModelRequest> captor = ArgumentCaptor.forClass(InvokeModelRequest.class);
        verify(bedrockClient).invokeModel(captor.capture());
        JsonNode payload = objectMapper.readTree(captor.getValue().body().asUtf8String());
        assertThat(captor.getValue().modelId()).isEqualTo(MODEL_ID);
        assertThat(payload.path("anthropic_version").asText()).isEqualTo("bedrock-2023-05-31");
        assertThat(payload.path("max_tokens").asInt()).isEqualTo(256);
        assertThat(payload.path("messages").get(0).path("content").asText()).isEqualTo("prompt text");
    }

    @Test
    void disabledServiceNeverCallsBedrock() {
        BedrockAnswerService disabled = service(false);

        assertThat(disabled.isAvailable()).isFalse();
        assertThat(disabled.answer("anything")).isEqualTo(BedrockAnswerService.NOT_CONFIGURED);
        verifyNoInteractions(bedrockClient);
    }

    @Test
    void persistentThrottlingReportsOverload() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenThrow(apiError(429));

        assertThat(service(true).answer("prompt")).isEqualTo(BedrockAnswerService.OVERLOADED);
        verify(bedrockClient, times(2)).invokeModel(any(InvokeModelRequest.class));
    }

    @Test
    void throttlingThenSuccessRecovers() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenThrow(apiError(429))
                .thenReturn(reply("{\"content\":[{\"text\":\"ok\"}]}"));

        assertThat(service(true).answer("prompt")).isEqualTo("ok");
    }

    @Test
    void apiErrorsBecomeErrorStrings() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenThrow(apiError(404));

        assertThat(service(true).answer("prompt")).startsWith("Error: API call failed (404 Not Found)").contains(MODEL_ID);
        verify(bedrockClient, times(1)).invokeModel(any(InvokeModelRequest.class));
    }

    @Test
    void timeoutBecomesErrorString() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenThrow(ApiCallTimeoutException.create(30_000));

        assertThat(service(true).answer("prompt")).isEqualTo(BedrockAnswerService.TIMED_OUT);
    }

    @Test
    void missingContentBlockIsReported() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenReturn(reply("{\"stop_reason\":\"end_turn\"}"));

        assertThat(service(true).answer("prompt")).isEqualTo(BedrockAnswerService.UNEXPECTED_RESPONSE);
    }
}
