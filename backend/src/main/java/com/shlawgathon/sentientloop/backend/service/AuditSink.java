package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.model.AuditEvent;

/**
 * Destination of the immutable audit trail. Implementations may throw; the
 * caller retries and never lets a failure reach the state transition.
 */
public interface AuditSink {

    void record(AuditEvent event);
}
