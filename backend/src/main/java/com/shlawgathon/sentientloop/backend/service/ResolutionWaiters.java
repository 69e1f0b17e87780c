package com.shlawgathon.sentientloop.backend.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local registry of callers waiting for a checkpoint to leave PENDING.
 * Signals only wake waiters; they re-read the checkpoint themselves.
 */
@Component
public class ResolutionWaiters {

    private final Map<String, Set<CompletableFuture<Void>>> waiters = new ConcurrentHashMap<>();

    public CompletableFuture<Void> register(String checkpointId) {
        CompletableFuture<Void> signal = new CompletableFuture<>();
        waiters.computeIfAbsent(checkpointId, k -> ConcurrentHashMap.newKeySet()).add(signal);
        signal.whenComplete((v, e) -> waiters.computeIfPresent(checkpointId, (id, set) -> {
            set.remove(signal);
            return set.isEmpty() ? null : set;
        }));
        return signal;
    }

    public void signal(String checkpointId) {
        Set<CompletableFuture<Void>> pending = waiters.remove(checkpointId);
        if (pending != null) {
            pending.forEach(f -> f.complete(null));
        }
    }

    public int waiting(String checkpointId) {
        Set<CompletableFuture<Void>> pending = waiters.get(checkpointId);
        return pending != null ? pending.size() : 0;
    }
}
