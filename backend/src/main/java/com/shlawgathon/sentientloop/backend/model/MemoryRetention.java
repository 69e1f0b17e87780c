package com.shlawgathon.sentientloop.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Retention windows in days.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemoryRetention {

    @Builder.Default
    private int shortTermDays = 7;

    @Builder.Default
    private int longTermDays = 90;

    @Builder.Default
    private int criticalDecisionDays = 365;

    @Builder.Default
    private int auditTrailDays = 730;
}
