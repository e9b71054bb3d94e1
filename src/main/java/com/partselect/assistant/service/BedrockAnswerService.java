package com.partselect.assistant.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Sends assembled prompts to an Anthropic model on Amazon Bedrock and returns the text reply.
 * Failures never propagate: every error path yields a plain-language string starting with {@code "Error:"}.
 */
@Service
public class BedrockAnswerService {

    private static final Logger logger = LoggerFactory.getLogger(BedrockAnswerService.class);

    static final String NOT_CONFIGURED = "Error: The LLM service is not configured.";
    static final String OVERLOADED = "Error: The AI service is currently overloaded. Please try again in a moment.";
    static final String TIMED_OUT = "Error: The AI service did not respond in time. Please try again.";
    static final String UNEXPECTED_RESPONSE = "Error: Received an unexpected response from the LLM.";
    static final String UNEXPECTED_ERROR = "Error: An unexpected error occurred while contacting the AI.";

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter chatRateLimiter;
    private final String modelId;
    private final int maxTokens;
    private final double temperature;
    private final boolean enabled;
    private final long permitTimeoutMs;
    private final int maxAttempts;
    private final long baseBackoffMs;

    @SuppressWarnings("UnstableApiUsage")
    public BedrockAnswerService(BedrockRuntimeClient bedrockClient,
                                ObjectMapper objectMapper,
                                @Qualifier("chatRateLimiter") RateLimiter chatRateLimiter,
                                @Value("${aws.bedrock.modelId}") String modelId,
                                @Value("${app.bedrock.maxTokens:1024}") int maxTokens,
                                @Value("${app.llm.temperature:0.2}") double temperature,
                                @Value("${app.llm.enabled:true}") boolean enabled,
                                @Value("${app.llm.permit-timeout-ms:2000}") long permitTimeoutMs,
                                @Value("${app.llm.max-attempts:3}") int maxAttempts,
                                @Value("${app.llm.backoff-ms:800}") long baseBackoffMs) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.chatRateLimiter = chatRateLimiter;
        this.modelId = modelId;
        this.maxTokens = Math.max(64, maxTokens);
        this.temperature = temperature;
        this.enabled = enabled && StringUtils.hasText(modelId);
        this.permitTimeoutMs = Math.max(0, permitTimeoutMs);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(0, baseBackoffMs);
        if (this.enabled) {
            logger.info("BedrockAnswerService initialized for model: {}", modelId);
        } else {
            logger.warn("BedrockAnswerService disabled; fallback answers will report the LLM as unavailable.");
        }
    }

    public boolean isAvailable() {
        return enabled;
    }

    /**
     * @return the model's trimmed reply, or an {@code "Error: ..."} message
     */
    @SuppressWarnings("UnstableApiUsage")
    public String answer(String prompt) {
        if (!enabled) {
            logger.error("Cannot call Bedrock: no model configured or LLM disabled.");
            return NOT_CONFIGURED;
        }
        if (!chatRateLimiter.tryAcquire(permitTimeoutMs, TimeUnit.MILLISECONDS)) {
            logger.warn("Chat rate limit exhausted; no permit within {} ms.", permitTimeoutMs);
            return OVERLOADED;
        }
        try {
            return invokeChatForText(prompt);
        } catch (ThrottledException te) {
            return OVERLOADED;
        } catch (ApiCallTimeoutException e) {
            logger.error("Bedrock call timed out for model {}: {}", modelId, e.getMessage());
            return TIMED_OUT;
        } catch (BedrockRuntimeException e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Bedrock API error for model {}: {} {}", modelId, e.statusCode(), detail, e);
            if (e.statusCode() == 404) {
                return "Error: API call failed (404 Not Found). Is the model id '" + modelId + "' correct?";
            }
            if (e.statusCode() == 400) {
                return "Error: API call failed (400 Bad Request). " + detail;
            }
            return "Error: An API error occurred (" + e.statusCode() + ").";
        } catch (SdkClientException e) {
            logger.error("Bedrock client error for model {}: {}", modelId, e.getMessage(), e);
            return UNEXPECTED_ERROR;
        } catch (Exception e) {
            logger.error("An unexpected error occurred during the LLM call: {}", e.getMessage(), e);
            return UNEXPECTED_ERROR;
        }
    }

    private String invokeChatForText(String content) throws Exception {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("anthropic_version", "bedrock-2023-05-31");
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", temperature);
        ArrayNode messages = payload.putArray("messages");
        ObjectNode userMessage = messages.addObject();
        userMessage.put("role", "user");
        userMessage.put("content", content == null ? "" : content);

        InvokeModelRequest request = InvokeModelRequest.builder()
                .modelId(modelId)
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                .build();

        InvokeModelResponse response = invokeWithRetry(request);
        JsonNode responseJson = objectMapper.readTree(response.body().asUtf8String());
        JsonNode contentBlock = responseJson.path("content");
        if (contentBlock.isArray() && contentBlock.size() > 0) {
            return contentBlock.get(0).path("text").asText("").trim();
        }
        logger.warn("Bedrock returned an unexpected response: {}", responseJson);
        return UNEXPECTED_RESPONSE;
    }

    /**
     * Retries throttled calls with exponential backoff and jitter; other errors surface at once.
     */
    private InvokeModelResponse invokeWithRetry(InvokeModelRequest request) {
        for (int attempt = 1; ; attempt++) {
            try {
                return bedrockClient.invokeModel(request);
            } catch (BedrockRuntimeException e) {
                String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
                boolean throttled = e.statusCode() == 429
                        || "ThrottlingException".equalsIgnoreCase(code)
                        || "TooManyRequestsException".equalsIgnoreCase(code)
                        || "ServiceUnavailableException".equalsIgnoreCase(code);
                if (!throttled) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    logger.warn("Bedrock throttled after {} attempts; surfacing throttling.", maxAttempts);
                    throw new ThrottledException("Bedrock throttling after retries", e);
                }

                long jitter = baseBackoffMs == 0 ? 0 : ThreadLocalRandom.current().nextLong(50, 200);
                long sleepMs = (long) Math.min(10_000, baseBackoffMs * Math.pow(2, attempt - 1) + jitter);
                logger.warn("Bedrock throttled (attempt {}/{}). Backing off for {} ms.", attempt, maxAttempts, sleepMs);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ThrottledException("Interrupted during backoff", ie);
                }
            }
        }
    }
}
