package com.shlawgathon.sentientloop.backend.model;

/**
 * Optional filters for listing pending checkpoints. Null fields match anything.
 */
public record CheckpointFilter(String organizationId, String moduleId, String agentId, CheckpointType type) {

    public static CheckpointFilter all() {
        return new CheckpointFilter(null, null, null, null);
    }
}
