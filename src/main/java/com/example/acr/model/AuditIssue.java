package com.example.acr.model;

import java.util.List;

/**
 * A single accessibility finding as delivered by the upstream checker.
 *
 * @param id               Upstream identifier, may be null
 * @param code             Rule id (e.g. {@code img-alt}, {@code EPUB-STRUCT-002})
 * @param severity         Impact level
 * @param message          Human-readable description
 * @param filePath         File inside the document package, may be null
 * @param location         Free-form location (line, xpath, page), may be null
 * @param explicitCriteria Criterion ids the checker tagged the finding with
 */
public record AuditIssue(
        String id,
        String code,
        Severity severity,
        String message,
        String filePath,
        String location,
        List<String> explicitCriteria
) {
    public AuditIssue {
        if (severity == null) severity = Severity.UNKNOWN;
        if (message == null || message.isBlank()) message = "No description available";
        explicitCriteria = explicitCriteria != null ? List.copyOf(explicitCriteria) : List.of();
    }

    public static AuditIssue of(String code, Severity severity, String message) {
        return new AuditIssue(null, code, severity, message, null, null, List.of());
    }

    /** Code used for remediation lookups; absent codes compare as {@code "unknown"}. */
    public String effectiveCode() {
        return code != null ? code : "unknown";
    }
}
