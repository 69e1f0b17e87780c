package com.shlawgathon.sentientloop.backend.model;

import java.util.Optional;

/**
 * Impact of a proposed action. Also the scale of the escalation ladder.
 */
public enum ImpactLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(ImpactLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * The level one step above this one, empty at the top of the scale.
     */
    public Optional<ImpactLevel> next() {
        ImpactLevel[] levels = values();
        return ordinal() + 1 < levels.length ? Optional.of(levels[ordinal() + 1]) : Optional.empty();
    }

    public static ImpactLevel max(ImpactLevel a, ImpactLevel b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }
}
