package com.example.acr.model;

import java.util.List;

/**
 * Evaluation of one catalog criterion for one document.
 *
 * @param confidence      heuristic confidence in the status, 0-100
 * @param findings        at most five human-readable lines
 * @param fixedIssues     related issues covered by a remediation record
 * @param remainingIssues related issues still open
 */
public record CriterionAnalysis(
        String criterionId,
        String name,
        CriterionLevel level,
        String section,
        CriterionStatus status,
        int confidence,
        List<String> findings,
        String recommendation,
        List<IssueDetail> fixedIssues,
        List<IssueDetail> remainingIssues
) {
    public CriterionAnalysis {
        findings = findings != null ? List.copyOf(findings) : List.of();
        fixedIssues = fixedIssues != null ? List.copyOf(fixedIssues) : List.of();
        remainingIssues = remainingIssues != null ? List.copyOf(remainingIssues) : List.of();
    }

    public int fixedCount() {
        return fixedIssues.size();
    }

    public int remainingCount() {
        return remainingIssues.size();
    }

    public int totalIssues() {
        return fixedIssues.size() + remainingIssues.size();
    }
}
