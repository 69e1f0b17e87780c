package com.shlawgathon.sentientloop.backend.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionWaitersTest {

    private final ResolutionWaiters waiters = new ResolutionWaiters();

    @Test
    void shouldWakeEveryWaiterOfCheckpoint() {
        CompletableFuture<Void> first = waiters.register("cp-1");
        CompletableFuture<Void> second = waiters.register("cp-1");
        CompletableFuture<Void> other = waiters.register("cp-2");

        waiters.signal("cp-1");

        assertTrue(first.isDone());
        assertTrue(second.isDone());
        assertFalse(other.isDone());
        assertEquals(0, waiters.waiting("cp-1"));
        assertEquals(1, waiters.waiting("cp-2"));
    }

    @Test
    void shouldForgetCancelledWaiter() {
        CompletableFuture<Void> abandoned = waiters.register("cp-1");

        abandoned.cancel(true);

        assertEquals(0, waiters.waiting("cp-1"));
    }

    @Test
    void shouldIgnoreSignalWithoutWaiters() {
        assertDoesNotThrow(() -> waiters.signal("nobody"));
    }
}
