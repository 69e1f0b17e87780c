package com.shlawgathon.sentientloop.backend.model;

import java.util.Map;

/**
 * Snapshot of the failure catalogue.
 */
public record FailureStats(long total, long active, long acknowledged, long recovered,
        Map<FailureType, Long> byType, Map<String, Long> openByModule) {
}
