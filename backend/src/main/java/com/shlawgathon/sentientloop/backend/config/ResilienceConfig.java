package com.shlawgathon.sentientloop.backend.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Retry policies for the fire-and-forget side effects: audit writes and
 * notification delivery.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public Retry auditRetry(
            @Value("${sentientloop.audit.max-attempts:3}") int maxAttempts,
            @Value("${sentientloop.audit.retry-backoff-ms:200}") long backoffMs) {
        return Retry.of("audit", backoff(maxAttempts, backoffMs));
    }

    @Bean
    public Retry notificationRetry(
            @Value("${sentientloop.notification.max-attempts:3}") int maxAttempts,
            @Value("${sentientloop.notification.retry-backoff-ms:500}") long backoffMs) {
        return Retry.of("notification", backoff(maxAttempts, backoffMs));
    }

    private static RetryConfig backoff(int maxAttempts, long backoffMs) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(Math.max(1, backoffMs)), 2.0))
                .build();
    }
}
