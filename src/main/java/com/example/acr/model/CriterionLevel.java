package com.example.acr.model;

/** Conformance level a success criterion belongs to. {@code EU} marks EN 301 549 specific clauses. */
public enum CriterionLevel {
    A, AA, AAA, EU;

    public boolean isBaseline() {
        return this == A || this == AA;
    }
}
