package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.model.PolicyConfig;

import java.util.Optional;

public interface PolicyConfigRepositoryCustom {

    /**
     * Replace the organization's policy document if its stored version still
     * equals {@code expectedVersion}. The replacement must already carry the
     * stored id and the next version.
     */
    Optional<PolicyConfig> replaceIfVersionMatches(PolicyConfig replacement, long expectedVersion);
}
