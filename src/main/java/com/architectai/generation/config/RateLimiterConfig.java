package com.architectai.generation.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.ratelimit.generateQps:0}") // 0 disables the limit
    private double generateRateLimit;

    @Bean("generationRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter generationRateLimiter() {
        return createOptionalLimiter(generateRateLimit);
    }

    @SuppressWarnings("UnstableApiUsage")
    static RateLimiter createOptionalLimiter(double qps) {
        double effectiveQps = qps > 0 ? qps : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
