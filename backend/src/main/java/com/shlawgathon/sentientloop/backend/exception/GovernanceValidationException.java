package com.shlawgathon.sentientloop.backend.exception;

import lombok.Getter;

import java.util.List;

/**
 * Missing or malformed input (resolution reason, modified payload, policy
 * fields).
 */
@Getter
public class GovernanceValidationException extends GovernanceException {

    private final List<String> violations;

    public GovernanceValidationException(String message) {
        this(List.of(message));
    }

    public GovernanceValidationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
