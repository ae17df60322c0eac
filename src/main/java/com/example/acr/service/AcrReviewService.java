package com.example.acr.service;

import com.example.acr.model.AcrDocument;
import com.example.acr.model.AcrCriterion;
import com.example.acr.model.AcrVersion;
import com.example.acr.model.CredibilityReport;
import com.example.acr.model.CriterionEdit;
import com.example.acr.model.CriterionVerification;
import com.example.acr.model.MethodologySummary;
import com.example.acr.model.RemarksValidation;
import com.example.acr.repository.VersionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Reviewer operations on the latest version of an ACR. Each one stores a new version.
 */
@Service
public class AcrReviewService {

    private static final Logger log = LoggerFactory.getLogger(AcrReviewService.class);

    private final AcrDocumentAssembler assembler;
    private final AcrVersioningService versioning;
    private final AttributionTagger tagger;
    private final AcrCredibilityValidator credibilityValidator;

    public AcrReviewService(AcrDocumentAssembler assembler, AcrVersioningService versioning,
                            AttributionTagger tagger, AcrCredibilityValidator credibilityValidator) {
        this.assembler = assembler;
        this.versioning = versioning;
        this.tagger = tagger;
        this.credibilityValidator = credibilityValidator;
    }

    public AcrVersion applyHumanEdit(String acrId, CriterionEdit edit, String reason) {
        return update(acrId, edit.verifiedBy(), reason,
                document -> assembler.applyHumanEdit(document, edit));
    }

    public AcrVersion applyBulkEdit(String acrId, List<CriterionEdit> edits, String author, String reason) {
        log.info("ACR {}: bulk edit of {} criteria by {}", acrId, edits.size(), author);
        return update(acrId, author, reason, document -> assembler.applyBulkEdit(document, edits));
    }

    public AcrVersion submitForReview(String acrId, String author) {
        return update(acrId, author, "Submitted for review", assembler::submitForReview);
    }

    /**
     * Finalizes the latest version. Credibility warnings are logged but do not block;
     * call {@link #credibility(String)} first to review them.
     *
     * @throws AcrFinalizationException if a criterion of the latest version is not attributed
     */
    public AcrVersion finalizeAcr(String acrId, String author) {
        return update(acrId, author, "Finalized", document -> {
            CredibilityReport report = credibilityValidator.validate(document);
            report.warnings().forEach(w -> log.warn("ACR {}: {} {}", acrId, w.type(), w.message()));
            return assembler.finalizeDocument(document);
        });
    }

    public CredibilityReport credibility(String acrId) {
        return credibilityValidator.validate(latest(acrId));
    }

    /**
     * Remark checks of the latest version, keyed by criterion id. Only failing criteria are listed.
     */
    public Map<String, RemarksValidation> remarksProblems(String acrId) {
        Map<String, RemarksValidation> problems = new LinkedHashMap<>();
        for (AcrCriterion criterion : latest(acrId).criteria()) {
            RemarksValidation validation = credibilityValidator.validateRemarks(
                    criterion.conformanceLevel(), criterion.remarks());
            if (!validation.valid()) {
                problems.put(criterion.id(), validation);
            }
        }
        return problems;
    }

    public MethodologySummary methodology(String acrId, Map<String, CriterionVerification> verifications) {
        AcrDocument latest = latest(acrId);
        return tagger.summarize(latest.criteria(), verifications);
    }

    private AcrVersion update(String acrId, String author, String reason, UnaryOperator<AcrDocument> change) {
        AcrDocument changed = change.apply(latest(acrId));
        return versioning.createVersion(acrId, author, changed, reason);
    }

    private AcrDocument latest(String acrId) {
        return versioning.getLatestVersion(acrId)
                .map(AcrVersion::snapshot)
                .orElseThrow(() -> new VersionNotFoundException(acrId));
    }
}
