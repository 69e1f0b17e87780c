package com.shlawgathon.sentientloop.backend.pubsub;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Events fanned out over Redis and relayed to WebSocket subscribers.
 */
public enum GovernanceEventType {
    CHECKPOINT_CREATED("checkpoint.created"),
    CHECKPOINT_RESOLVED("checkpoint.resolved"),
    ESCALATION_CREATED("escalation.created"),
    ACTION_RELEASED("action.released"),
    ACTION_ABANDONED("action.abandoned"),
    FAILURE_REPORTED("failure.reported"),
    FAILURE_RECOVERED("failure.recovered"),
    POLICY_UPDATED("policy.updated");

    private final String wireName;

    GovernanceEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static GovernanceEventType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + value));
    }

    /**
     * Events after which a checkpoint waiter should re-read the checkpoint.
     */
    public boolean endsCheckpointWait() {
        return this == CHECKPOINT_RESOLVED || this == ACTION_RELEASED || this == ACTION_ABANDONED;
    }
}
