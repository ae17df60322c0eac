package com.example.acr.service;

import com.example.acr.model.AcrAnalysis;
import com.example.acr.model.AcrCriterion;
import com.example.acr.model.AcrDocument;
import com.example.acr.model.AcrEdition;
import com.example.acr.model.AcrStatus;
import com.example.acr.model.AggregateCriterion;
import com.example.acr.model.AggregateReport;
import com.example.acr.model.AttributionTag;
import com.example.acr.model.CriterionAnalysis;
import com.example.acr.model.CriterionEdit;
import com.example.acr.model.CriterionVerification;
import com.example.acr.model.EvaluationMethod;
import com.example.acr.model.ProductInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns analyses into ACR documents and applies reviewer edits to them.
 * <p>
 * Every criterion leaving this class is attributed. A document only reaches
 * {@link AcrStatus#FINAL} through {@link #finalizeDocument(AcrDocument)}.
 */
@Service
public class AcrDocumentAssembler {

    private static final Logger log = LoggerFactory.getLogger(AcrDocumentAssembler.class);

    static final EvaluationMethod AUTOMATED_EVALUATION = new EvaluationMethod(
            EvaluationMethod.Type.AUTOMATED,
            List.of("Rule-based conformance evaluator"),
            List.of(),
            "Automated accessibility checks mapped to WCAG success criteria");

    static final EvaluationMethod BATCH_EVALUATION = new EvaluationMethod(
            EvaluationMethod.Type.AUTOMATED,
            List.of("Rule-based conformance evaluator", "Batch aggregation"),
            List.of(),
            "Per-document automated checks combined into a batch verdict");

    private final AttributionTagger tagger;
    private final Clock clock;

    public AcrDocumentAssembler(AttributionTagger tagger, Clock clock) {
        this.tagger = tagger;
        this.clock = clock;
    }

    /**
     * Builds a draft ACR from a single document analysis.
     * Unknown edition codes were evaluated against the A + AA baseline, which is the WCAG edition.
     */
    public AcrDocument assemble(String acrId, AcrAnalysis analysis, ProductInfo productInfo,
                                Map<String, CriterionVerification> verifications) {
        AcrEdition edition = AcrEdition.fromCode(analysis.editionCode()).orElse(AcrEdition.WCAG);
        List<AcrCriterion> criteria = new ArrayList<>(analysis.criteria().size());
        for (CriterionAnalysis c : analysis.criteria()) {
            AcrCriterion row = new AcrCriterion(c.criterionId(), c.name(), c.level(),
                    c.status().toConformanceLevel(), String.join(". ", c.findings()), null, null);
            criteria.add(tagger.attribute(row, verifications.get(c.criterionId())));
        }
        log.info("Assembled ACR {} ({}) with {} criteria", acrId, edition.code(), criteria.size());
        return new AcrDocument(acrId, edition, productInfo, List.of(AUTOMATED_EVALUATION), criteria,
                Instant.now(clock), 0, AcrStatus.DRAFT);
    }

    /**
     * Builds a draft ACR from a batch aggregate. Composite remarks become the criterion remarks.
     */
    public AcrDocument assembleAggregate(String acrId, AggregateReport report, AcrEdition edition,
                                         ProductInfo productInfo) {
        List<AcrCriterion> criteria = new ArrayList<>(report.criteria().size());
        for (AggregateCriterion c : report.criteria()) {
            AcrCriterion row = new AcrCriterion(c.criterionId(), c.criterionName(), c.level(),
                    c.compositeConformanceLevel(), c.compositeRemarks(), null, null);
            criteria.add(tagger.attribute(row, null));
        }
        log.info("Assembled aggregate ACR {} for batch {} ({} documents, {} criteria)",
                acrId, report.batchId(), report.totalDocuments(), criteria.size());
        return new AcrDocument(acrId, edition, productInfo, List.of(BATCH_EVALUATION), criteria,
                Instant.now(clock), 0, AcrStatus.DRAFT);
    }

    public AcrDocument applyHumanEdit(AcrDocument document, CriterionEdit edit) {
        return applyBulkEdit(document, List.of(edit));
    }

    /**
     * Applies reviewer edits. Edited criteria are re-attributed from the recorded review
     * outcome; a final document drops back to pending review. An AI-suggested row keeps its
     * tag until a reviewer supplies new remarks or records a review outcome.
     *
     * @throws IllegalArgumentException if an edit names a criterion the document does not contain
     */
    public AcrDocument applyBulkEdit(AcrDocument document, List<CriterionEdit> edits) {
        Map<String, AcrCriterion> rows = new LinkedHashMap<>();
        document.criteria().forEach(c -> rows.put(c.id(), c));

        for (CriterionEdit edit : edits) {
            AcrCriterion current = rows.get(edit.criterionId());
            if (current == null) {
                throw new IllegalArgumentException(
                        "ACR %s has no criterion %s".formatted(document.id(), edit.criterionId()));
            }
            AcrCriterion changed = current.withConformance(
                    edit.conformanceLevel() != null ? edit.conformanceLevel() : current.conformanceLevel(),
                    edit.remarks() != null ? edit.remarks() : current.remarks());
            // AI-written text stays disclosed until a reviewer replaces it
            boolean aiGenerated = edit.remarks() == null && current.attributionTag() == AttributionTag.AI_SUGGESTED;
            CriterionVerification verification = new CriterionVerification(
                    edit.criterionId(), edit.verificationStatus(), aiGenerated, edit.verifiedBy());
            rows.put(edit.criterionId(), tagger.attribute(changed, verification));
        }

        AcrStatus status = document.status() == AcrStatus.FINAL ? AcrStatus.PENDING_REVIEW : document.status();
        log.info("Applied {} edit(s) to ACR {}", edits.size(), document.id());
        return document.withCriteria(new ArrayList<>(rows.values())).withStatus(status);
    }

    public AcrDocument submitForReview(AcrDocument document) {
        return document.withStatus(AcrStatus.PENDING_REVIEW);
    }

    /**
     * Marks the document final.
     *
     * @throws AcrFinalizationException if any criterion has no attribution tag or blank attributed remarks
     */
    public AcrDocument finalizeDocument(AcrDocument document) {
        List<String> missing = document.criteria().stream()
                .filter(c -> !c.isAttributed())
                .map(AcrCriterion::id)
                .toList();
        if (!missing.isEmpty()) {
            throw new AcrFinalizationException(document.id(), missing);
        }
        return document.withStatus(AcrStatus.FINAL);
    }
}
