package com.shlawgathon.sentientloop.backend.model;

/**
 * Classes of operational failure reported to the monitor.
 */
public enum FailureType {
    TIMEOUT,
    OPERATION_ERROR,
    DECISION_ERROR,
    INTEGRATION_ERROR,
    MEMORY_ERROR,
    HITL_ERROR
}
