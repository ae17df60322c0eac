package com.example.acr.model;

import java.time.Instant;

/**
 * Issue as listed under a criterion analysis, either still open or already fixed.
 *
 * @param fixedAt remediation timestamp, null for remaining issues or when the record carries none
 */
public record IssueDetail(
        String issueId,
        String ruleId,
        Severity severity,
        String message,
        String filePath,
        String location,
        Instant fixedAt
) {
    public static IssueDetail remaining(AuditIssue issue) {
        return new IssueDetail(issue.id(), issue.effectiveCode(), issue.severity(), issue.message(),
                issue.filePath(), issue.location(), null);
    }

    public static IssueDetail fixed(AuditIssue issue, Instant fixedAt) {
        return new IssueDetail(issue.id(), issue.effectiveCode(), issue.severity(), issue.message(),
                issue.filePath(), issue.location(), fixedAt);
    }
}
