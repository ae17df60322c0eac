package com.example.acr.model;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Accessibility Conformance Report. Immutable: every change produces a new instance,
 * and every stored version holds a complete copy.
 */
public record AcrDocument(
        String id,
        AcrEdition edition,
        ProductInfo productInfo,
        List<EvaluationMethod> evaluationMethods,
        List<AcrCriterion> criteria,
        Instant generatedAt,
        int version,
        AcrStatus status
) {
    public AcrDocument {
        evaluationMethods = evaluationMethods != null ? List.copyOf(evaluationMethods) : List.of();
        criteria = criteria != null ? List.copyOf(criteria) : List.of();
        if (status == null) status = AcrStatus.DRAFT;
        Set<String> seen = new HashSet<>();
        for (AcrCriterion criterion : criteria) {
            if (!seen.add(criterion.id())) {
                throw new IllegalArgumentException("Duplicate criterion id in ACR " + id + ": " + criterion.id());
            }
        }
    }

    public AcrDocument withVersion(int newVersion) {
        return new AcrDocument(id, edition, productInfo, evaluationMethods, criteria, generatedAt, newVersion, status);
    }

    public AcrDocument withStatus(AcrStatus newStatus) {
        return new AcrDocument(id, edition, productInfo, evaluationMethods, criteria, generatedAt, version, newStatus);
    }

    public AcrDocument withCriteria(List<AcrCriterion> newCriteria) {
        return new AcrDocument(id, edition, productInfo, evaluationMethods, newCriteria, generatedAt, version, status);
    }

    public Optional<AcrCriterion> criterion(String criterionId) {
        return criteria.stream().filter(c -> c.id().equals(criterionId)).findFirst();
    }
}
