package com.example.acr.model;

/** State of the human review of a criterion. */
public enum VerificationStatus {
    PENDING,
    VERIFIED_PASS,
    VERIFIED_FAIL,
    VERIFIED_PARTIAL,
    DEFERRED;

    /** True for the terminal outcomes a human reviewer signs off on. */
    public boolean isHumanOutcome() {
        return this == VERIFIED_PASS || this == VERIFIED_FAIL || this == VERIFIED_PARTIAL;
    }
}
