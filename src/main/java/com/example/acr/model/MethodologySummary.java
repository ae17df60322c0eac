package com.example.acr.model;

import java.util.List;

/**
 * Attribution statistics printed in the methodology section of a report.
 */
public record MethodologySummary(
        int totalFindings,
        int automatedFindings,
        int aiSuggestedFindings,
        int humanVerifiedFindings,
        List<Reviewer> humanReviewers,
        String disclaimer
) {
    public MethodologySummary {
        humanReviewers = List.copyOf(humanReviewers);
    }

    public record Reviewer(String id, int verificationCount) {}
}
