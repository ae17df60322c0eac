package com.example.acr.model;

/**
 * Something a procurement reviewer would question in an ACR.
 */
public record CredibilityWarning(Type type, String message, String recommendation) {

    public enum Type {
        EMPTY_ACR,
        HIGH_COMPLIANCE_WARNING,
        PERFECT_COMPLIANCE_RED_FLAG,
        MISSING_REMARKS,
        HIGH_NOT_APPLICABLE;

        /** Warnings that make a report non-credible rather than merely worth a second look. */
        public boolean isBlocking() {
            return this == PERFECT_COMPLIANCE_RED_FLAG || this == MISSING_REMARKS;
        }
    }
}
