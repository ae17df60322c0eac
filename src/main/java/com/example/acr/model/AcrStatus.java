package com.example.acr.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Lifecycle state of an ACR document. */
public enum AcrStatus {
    DRAFT, PENDING_REVIEW, FINAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
