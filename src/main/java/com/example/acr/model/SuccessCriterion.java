package com.example.acr.model;

/**
 * Catalog entry for one success criterion.
 *
 * @param id      Dotted id, e.g. {@code 1.1.1}, or {@code EN-5.2} for EU clauses
 * @param name    Short title
 * @param level   Conformance level
 * @param section Principle or chapter the criterion is listed under
 */
public record SuccessCriterion(String id, String name, CriterionLevel level, String section) {}
