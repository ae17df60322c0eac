package com.example.acr.model;

import java.util.List;

/**
 * Contribution of one batch document to an aggregate criterion.
 */
public record DocumentDetail(
        String fileName,
        String jobId,
        ConformanceLevel status,
        int issueCount,
        List<IssueSummary> issues
) {
    public DocumentDetail {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public boolean needsAttention() {
        return status == ConformanceLevel.DOES_NOT_SUPPORT || status == ConformanceLevel.PARTIALLY_SUPPORTS;
    }
}
