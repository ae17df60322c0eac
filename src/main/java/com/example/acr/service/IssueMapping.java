package com.example.acr.service;

import com.example.acr.model.AuditIssue;

import java.util.List;
import java.util.Map;

/**
 * Findings grouped by criterion id, plus the findings no criterion claimed.
 *
 * @param byCriterion criterion id to its findings, in first-match order
 * @param unmapped    findings that matched no criterion
 */
public record IssueMapping(Map<String, List<AuditIssue>> byCriterion, List<AuditIssue> unmapped) {

    public List<AuditIssue> issuesFor(String criterionId) {
        return byCriterion.getOrDefault(criterionId, List.of());
    }

    public int totalMapped() {
        return byCriterion.values().stream().mapToInt(List::size).sum();
    }
}
