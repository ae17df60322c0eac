package com.example.acr.model;

import java.util.List;

/**
 * Batch-level verdict for one criterion, with the per-document detail it was derived from.
 */
public record AggregateCriterion(
        String criterionId,
        String criterionName,
        CriterionLevel level,
        List<DocumentDetail> perDocumentDetails,
        ConformanceLevel compositeConformanceLevel,
        String compositeRemarks
) {
    public AggregateCriterion {
        perDocumentDetails = List.copyOf(perDocumentDetails);
    }
}
