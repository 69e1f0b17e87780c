package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.exception.OperationFailedException;
import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs an operation under a resilience4j {@link TimeLimiter} and {@link Retry},
 * reporting every failed attempt to the failure monitor as TIMEOUT or
 * OPERATION_ERROR.
 */
@Component
public class MonitoredOperationRunner {

    private static final Logger log = LoggerFactory.getLogger(MonitoredOperationRunner.class);

    private final FailureMonitorService failureMonitorService;
    private final ExecutorService workers;

    public MonitoredOperationRunner(FailureMonitorService failureMonitorService) {
        this.failureMonitorService = failureMonitorService;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "monitored-op-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    /**
     * @param maxRetries retries after the first attempt
     * @param timeout    limit of each attempt; a late attempt is cancelled
     * @param backoff    pause between attempts
     * @throws OperationFailedException when every attempt failed
     */
    public <T> T run(String operationName, String moduleId, Callable<T> operation, int maxRetries,
            Duration timeout, Duration backoff) {
        int attempts = Math.max(0, maxRetries) + 1;
        Retry retry = Retry.of(moduleId + "/" + operationName, RetryConfig.custom()
                .maxAttempts(attempts)
                .waitDuration(backoff)
                .ignoreExceptions(InterruptedException.class)
                .build());
        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());

        AtomicInteger attempt = new AtomicInteger();
        AtomicReference<FailureRecord> lastFailure = new AtomicReference<>();
        Callable<T> timed = TimeLimiter.decorateFutureSupplier(timeLimiter, () -> workers.submit(operation));
        Callable<T> reported = () -> {
            int current = attempt.incrementAndGet();
            try {
                return timed.call();
            } catch (TimeoutException e) {
                lastFailure.set(report(operationName, moduleId, FailureType.TIMEOUT, current, attempts,
                        "Timed out after " + timeout.toMillis() + " ms"));
                throw e;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                lastFailure.set(report(operationName, moduleId, FailureType.OPERATION_ERROR, current, attempts,
                        e.getMessage()));
                throw e;
            }
        };

        try {
            return Retry.decorateCallable(retry, reported).call();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationFailedException(operationName + " interrupted", failureId(lastFailure.get()), e);
        } catch (Exception e) {
            throw new OperationFailedException(operationName + " failed after " + attempt.get() + " attempts",
                    failureId(lastFailure.get()), e);
        }
    }

    private static String failureId(FailureRecord failure) {
        return failure != null ? failure.getId() : null;
    }

    private FailureRecord report(String operationName, String moduleId, FailureType type, int attempt,
            int attempts, String message) {
        log.warn("[FAILURE] {}/{} attempt {}/{} failed: {}", moduleId, operationName, attempt, attempts, message);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("attempt", attempt);
        metadata.put("maxAttempts", attempts);
        try {
            return failureMonitorService.report(operationName, moduleId, type, metadata, message);
        } catch (Exception e) {
            log.error("[FAILURE] Could not record failure of {}/{}", moduleId, operationName, e);
            return null;
        }
    }
}
