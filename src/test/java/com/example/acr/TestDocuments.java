package com.example.acr;

import com.example.acr.model.AcrCriterion;
import com.example.acr.model.AcrDocument;
import com.example.acr.model.AcrEdition;
import com.example.acr.model.AcrStatus;
import com.example.acr.model.ConformanceLevel;
import com.example.acr.model.CriterionLevel;
import com.example.acr.model.ProductInfo;

import java.time.Instant;
import java.util.List;

/**
 * Small ACR documents for versioning and review tests.
 */
public final class TestDocuments {

    public static final Instant EVALUATED = Instant.parse("2026-02-01T09:00:00Z");

    private TestDocuments() {
    }

    public static ProductInfo product() {
        return new ProductInfo("Reader", "2.1", "EPUB reader", "Acme Publishing", "a11y@acme.test", EVALUATED);
    }

    public static AcrCriterion criterion(String id, ConformanceLevel level, String remarks) {
        return new AcrCriterion(id, "Criterion " + id, CriterionLevel.A, level, remarks, null, null);
    }

    public static AcrDocument document(String acrId, AcrCriterion... criteria) {
        return new AcrDocument(acrId, AcrEdition.WCAG, product(), List.of(), List.of(criteria), EVALUATED, 0,
                AcrStatus.DRAFT);
    }

    public static AcrDocument sample(String acrId) {
        return document(acrId,
                criterion("1.1.1", ConformanceLevel.SUPPORTS, "All images have alt text"),
                criterion("1.4.3", ConformanceLevel.PARTIALLY_SUPPORTS, "Some low contrast text"));
    }
}
