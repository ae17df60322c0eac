package com.example.acr.model;

import java.time.Instant;
import java.util.List;

/**
 * Marks previously detected issues as resolved. A record matches an issue by its
 * code, by the criterion it was filed against, or through the issue list of a
 * remediation task.
 */
public record RemediationRecord(
        String issueCode,
        String criterionId,
        List<String> issueCodes,
        String status,
        Instant fixedAt
) {
    public RemediationRecord {
        issueCodes = issueCodes != null ? List.copyOf(issueCodes) : List.of();
    }

    public static RemediationRecord forIssue(String issueCode, Instant fixedAt) {
        return new RemediationRecord(issueCode, null, List.of(), "fixed", fixedAt);
    }

    public static RemediationRecord forCriterion(String criterionId, Instant fixedAt) {
        return new RemediationRecord(null, criterionId, List.of(), "fixed", fixedAt);
    }

    public boolean covers(String code, String criterion) {
        return (issueCode != null && issueCode.equals(code))
                || (criterionId != null && criterionId.equals(criterion))
                || issueCodes.contains(code);
    }
}
