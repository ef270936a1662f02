package com.careerpath.orchestrator.config;

import com.careerpath.orchestrator.provider.ProviderException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Retry policy shared by the provider adapters: exponential backoff on
 * retryable {@link ProviderException}s, everything else fails fast.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public RetryRegistry retryRegistry(@Value("${careerpath.retry.max-retries:3}") int maxRetries,
                                       @Value("${careerpath.retry.initial-backoff:500ms}") Duration initialBackoff,
                                       @Value("${careerpath.retry.multiplier:2.0}") double multiplier) {
        return RetryRegistry.of(retryConfig(maxRetries, initialBackoff, multiplier));
    }

    public static RetryConfig retryConfig(int maxRetries, Duration initialBackoff, double multiplier) {
        return RetryConfig.custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryOnException(e -> e instanceof ProviderException p && p.isRetryable())
                .build();
    }
}
