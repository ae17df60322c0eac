package com.example.acr.adapter;

import com.example.acr.model.AuditIssue;
import com.example.acr.model.RemediationRecord;

import java.util.List;

/**
 * Canonical findings of one document.
 */
public record AdaptedFindings(List<AuditIssue> issues, List<RemediationRecord> remediations) {

    public AdaptedFindings {
        issues = List.copyOf(issues);
        remediations = List.copyOf(remediations);
    }
}
