package com.example.acr.model;

import java.util.List;

/**
 * Credibility check of a whole ACR.
 *
 * @param credible false when any warning is blocking
 */
public record CredibilityReport(boolean credible, List<CredibilityWarning> warnings, Summary summary) {

    public CredibilityReport {
        warnings = List.copyOf(warnings);
    }

    public record Summary(
            int totalCriteria,
            int supportsCount,
            int partiallySupportsCount,
            int doesNotSupportCount,
            int notApplicableCount,
            double supportsPercentage
    ) {}
}
