package com.partselect.assistant.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${aws.bedrock.rateLimit:5.0}") // permits per second shared by all chat sessions
    private double rateLimit;

    @Bean("chatRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter chatRateLimiter() {
        return RateLimiter.create(Math.max(0.1, rateLimit));
    }
}
