package com.example.acr.model;

/**
 * Finding that maps to none of the evaluated criteria. Kept so issue counts stay complete.
 */
public record OtherIssue(
        String code,
        String message,
        Severity severity,
        String location,
        Status status
) {
    public enum Status {
        PENDING, FIXED
    }
}
