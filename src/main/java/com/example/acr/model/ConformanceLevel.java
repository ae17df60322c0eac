package com.example.acr.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four conformance levels printed in an ACR. Anything else, including absence, reads as Not Applicable.
 */
public enum ConformanceLevel {
    SUPPORTS("Supports"),
    PARTIALLY_SUPPORTS("Partially Supports"),
    DOES_NOT_SUPPORT("Does Not Support"),
    NOT_APPLICABLE("Not Applicable");

    private final String label;

    ConformanceLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ConformanceLevel fromLabel(String label) {
        if (label == null) return NOT_APPLICABLE;
        for (ConformanceLevel level : values()) {
            if (level.label.equalsIgnoreCase(label.trim()) || level.name().equalsIgnoreCase(label.trim())) {
                return level;
            }
        }
        return NOT_APPLICABLE;
    }
}
