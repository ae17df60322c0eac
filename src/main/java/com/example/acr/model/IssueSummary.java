package com.example.acr.model;

/** Issue reference kept in per-document batch details. */
public record IssueSummary(String code, String message, String location) {

    public static IssueSummary of(IssueDetail detail) {
        return new IssueSummary(detail.ruleId(), detail.message(), detail.location());
    }
}
