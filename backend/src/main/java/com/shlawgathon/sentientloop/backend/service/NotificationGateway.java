package com.shlawgathon.sentientloop.backend.service;

import java.util.List;
import java.util.Map;

/**
 * Decides nothing about transport: delivers "notify these parties about this"
 * to whatever channel the deployment wires up.
 */
public interface NotificationGateway {

    /**
     * Notify {@code parties}. Calls sharing an {@code idempotencyKey} deliver at
     * most once.
     *
     * @return false when the key was already delivered
     */
    boolean notify(List<String> parties, String subject, Map<String, Object> context, String idempotencyKey);
}
