package com.example.acr.model;

import java.util.Locale;

/**
 * Impact level reported by the upstream checker for a single finding.
 * Declaration order is the classification precedence: the first constant
 * present among the remaining issues of a criterion decides its status.
 */
public enum Severity {
    CRITICAL,
    SERIOUS,
    MODERATE,
    UNKNOWN,
    MINOR;

    /**
     * Parses an upstream impact string. Missing or unrecognised values become {@link #UNKNOWN}.
     */
    public static Severity fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "critical" -> CRITICAL;
            case "serious" -> SERIOUS;
            case "moderate" -> MODERATE;
            case "minor" -> MINOR;
            default -> UNKNOWN;
        };
    }

    /** Uppercase prefix used in criterion findings, e.g. {@code "CRITICAL: "}. */
    public String findingPrefix() {
        return name() + ": ";
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
