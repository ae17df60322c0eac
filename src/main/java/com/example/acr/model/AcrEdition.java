package com.example.acr.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Optional;

/**
 * VPAT 2.5 editions an ACR can be produced in.
 */
public enum AcrEdition {
    SECTION_508("VPAT2.5-508", "Section 508 Edition", List.of("Section 508")),
    WCAG("VPAT2.5-WCAG", "WCAG Edition", List.of("WCAG 2.1")),
    EU("VPAT2.5-EU", "EU Edition", List.of("EN 301 549")),
    INTERNATIONAL("VPAT2.5-INT", "International Edition", List.of("Section 508", "EN 301 549", "WCAG 2.1"));

    /** Edition suggested to users when none is chosen. */
    public static final AcrEdition RECOMMENDED = INTERNATIONAL;

    private final String code;
    private final String displayName;
    private final List<String> standards;

    AcrEdition(String code, String displayName, List<String> standards) {
        this.code = code;
        this.displayName = displayName;
        this.standards = standards;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public List<String> standards() {
        return standards;
    }

    public static Optional<AcrEdition> fromCode(String code) {
        if (code == null) return Optional.empty();
        for (AcrEdition edition : values()) {
            if (edition.code.equalsIgnoreCase(code.trim())) return Optional.of(edition);
        }
        return Optional.empty();
    }

    @JsonCreator
    static AcrEdition fromJson(String code) {
        return fromCode(code).orElse(RECOMMENDED);
    }
}
