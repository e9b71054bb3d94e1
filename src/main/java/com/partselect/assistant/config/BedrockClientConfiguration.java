package com.partselect.assistant.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;

import java.time.Duration;

@Configuration
public class BedrockClientConfiguration {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${app.llm.timeout-seconds:30}")
    private long timeoutSeconds;

    /**
     * Credentials are resolved on first call; a missing credential chain surfaces as a failed answer.
     */
    @Bean
    public BedrockRuntimeClient bedrockRuntimeClient() {
        return BedrockRuntimeClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(RetryPolicy.none()) // throttling retries live in BedrockAnswerService
                        .apiCallTimeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                        .build())
                .build();
    }
}
