package com.shlawgathon.sentientloop.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans of the governance engine.
 */
@Configuration
public class GovernanceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for audit writes and notification delivery, kept off the
     * request threads.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService governanceExecutor(@Value("${sentientloop.executor.threads:4}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "governance-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
