package com.example.acr.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine status of a criterion within one document analysis.
 * {@link #rank()} orders the statuses from worst to best; not_applicable has no rank.
 */
public enum CriterionStatus {
    SUPPORTS("supports", 2),
    PARTIALLY_SUPPORTS("partially_supports", 1),
    DOES_NOT_SUPPORT("does_not_support", 0),
    NOT_APPLICABLE("not_applicable", -1);

    private final String value;
    private final int rank;

    CriterionStatus(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public ConformanceLevel toConformanceLevel() {
        return switch (this) {
            case SUPPORTS -> ConformanceLevel.SUPPORTS;
            case PARTIALLY_SUPPORTS -> ConformanceLevel.PARTIALLY_SUPPORTS;
            case DOES_NOT_SUPPORT -> ConformanceLevel.DOES_NOT_SUPPORT;
            case NOT_APPLICABLE -> ConformanceLevel.NOT_APPLICABLE;
        };
    }
}
