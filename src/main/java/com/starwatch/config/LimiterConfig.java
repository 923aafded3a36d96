package com.starwatch.config;

import com.starwatch.infra.InMemoryDualRateLimiter;
import com.starwatch.infra.InMemoryRpmRateLimiter;
import com.starwatch.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("chatLimiter")
    public RateLimiter chatLimiter(@Value("${app.limits.chat-rpm:60}") int rpm) {
        return new InMemoryRpmRateLimiter(rpm);
    }

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(
        @Value("${app.limits.embedding-rpm:60}") int rpm,
        @Value("${app.limits.embedding-tpm:1000000}") int tpm
    ) {
        return new InMemoryDualRateLimiter(rpm, tpm);
    }
}
