package com.example.acr.model;

/**
 * Provenance of a remark. The markers are consumed verbatim by renderers and the legal
 * disclaimer and must never be changed or localised.
 */
public enum AttributionTag {
    AUTOMATED("[AUTOMATED]"),
    AI_SUGGESTED("[AI-SUGGESTED]"),
    HUMAN_VERIFIED("[HUMAN-VERIFIED]");

    private final String marker;

    AttributionTag(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }
}
