package com.example.acr.model;

import java.util.List;
import java.util.Optional;

/**
 * Complete conformance analysis of one document.
 *
 * @param documentId        job or document the findings belong to
 * @param editionCode       edition code the criteria were selected with, may be null
 * @param criteria          one entry per edition criterion, in catalog order
 * @param overallConfidence mean criterion confidence plus the remediation bonus, 0-100
 * @param summary           per-status counts
 * @param otherIssues       findings related to no evaluated criterion
 */
public record AcrAnalysis(
        String documentId,
        String editionCode,
        List<CriterionAnalysis> criteria,
        int overallConfidence,
        AnalysisSummary summary,
        List<OtherIssue> otherIssues
) {
    public AcrAnalysis {
        criteria = List.copyOf(criteria);
        otherIssues = otherIssues != null ? List.copyOf(otherIssues) : List.of();
    }

    public Optional<CriterionAnalysis> criterion(String criterionId) {
        return criteria.stream().filter(c -> c.criterionId().equals(criterionId)).findFirst();
    }

    public long pendingOtherIssues() {
        return otherIssues.stream().filter(i -> i.status() == OtherIssue.Status.PENDING).count();
    }

    public long fixedOtherIssues() {
        return otherIssues.stream().filter(i -> i.status() == OtherIssue.Status.FIXED).count();
    }
}
