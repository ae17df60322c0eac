package com.example.acr.service;

import com.example.acr.model.AcrCriterion;
import com.example.acr.model.AttributionTag;
import com.example.acr.model.CriterionVerification;
import com.example.acr.model.MethodologySummary;
import com.example.acr.model.VerificationStatus;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns provenance tags to ACR remarks and formats the marker-prefixed text renderers print.
 * <p>
 * Precedence is fixed: a terminal human review outcome wins over AI generation, which wins
 * over plain automated detection. Every criterion of a final report must go through here.
 */
@Service
public class AttributionTagger {

    /** Criterion whose AI-suggested remarks carry an explicit review notice. */
    public static final String ALT_TEXT_CRITERION = "1.1.1";

    static final String ALT_TEXT_REVIEW_NOTICE = "AI-Suggested - Requires Review";

    public static final String LEGAL_DISCLAIMER = """
            This Accessibility Conformance Report was generated using automated testing tools \
            supplemented by AI-assisted analysis. Automated tools can detect approximately \
            30-57% of accessibility barriers. Items marked [AI-SUGGESTED] require human \
            verification for accuracy. This report should be reviewed by qualified \
            accessibility professionals before use in procurement decisions.""";

    public AttributionTag determineAttributionTag(VerificationStatus verificationStatus, Boolean isAiGenerated) {
        if (verificationStatus != null && verificationStatus.isHumanOutcome()) {
            return AttributionTag.HUMAN_VERIFIED;
        }
        if (Boolean.TRUE.equals(isAiGenerated)) {
            return AttributionTag.AI_SUGGESTED;
        }
        return AttributionTag.AUTOMATED;
    }

    public String formatAttributedRemark(String remark, AttributionTag tag, boolean isAltTextCriterion) {
        String text = remark != null ? remark : "";
        if (isAltTextCriterion && tag == AttributionTag.AI_SUGGESTED) {
            return "%s %s: %s".formatted(tag.marker(), ALT_TEXT_REVIEW_NOTICE, text);
        }
        return "%s %s".formatted(tag.marker(), text);
    }

    /**
     * Returns the criterion with tag and attributed remarks set from its review state.
     * A null verification means the remark came from automated detection only.
     */
    public AcrCriterion attribute(AcrCriterion criterion, CriterionVerification verification) {
        VerificationStatus status = verification != null ? verification.verificationStatus() : null;
        boolean aiGenerated = verification != null && verification.aiGenerated();
        AttributionTag tag = determineAttributionTag(status, aiGenerated);
        String attributed = formatAttributedRemark(criterion.remarks(), tag,
                ALT_TEXT_CRITERION.equals(criterion.id()));
        return criterion.withAttribution(tag, attributed);
    }

    public List<AcrCriterion> attributeAll(List<AcrCriterion> criteria, Map<String, CriterionVerification> verifications) {
        Map<String, CriterionVerification> byId = verifications != null ? verifications : Map.of();
        return criteria.stream()
                .map(c -> attribute(c, byId.get(c.id())))
                .toList();
    }

    /**
     * Counts criteria per attribution tag and lists the reviewers behind human-verified ones.
     */
    public MethodologySummary summarize(List<AcrCriterion> criteria, Map<String, CriterionVerification> verifications) {
        int automated = 0;
        int aiSuggested = 0;
        int humanVerified = 0;
        Map<String, Integer> reviewers = new LinkedHashMap<>();
        Map<String, CriterionVerification> byId = verifications != null ? verifications : Map.of();

        for (AcrCriterion criterion : criteria) {
            CriterionVerification verification = byId.get(criterion.id());
            AttributionTag tag = criterion.attributionTag() != null
                    ? criterion.attributionTag()
                    : determineAttributionTag(
                            verification != null ? verification.verificationStatus() : null,
                            verification != null && verification.aiGenerated());
            switch (tag) {
                case AUTOMATED -> automated++;
                case AI_SUGGESTED -> aiSuggested++;
                case HUMAN_VERIFIED -> {
                    humanVerified++;
                    if (verification != null && verification.verifiedBy() != null) {
                        reviewers.merge(verification.verifiedBy(), 1, Integer::sum);
                    }
                }
            }
        }

        List<MethodologySummary.Reviewer> reviewerList = reviewers.entrySet().stream()
                .map(e -> new MethodologySummary.Reviewer(e.getKey(), e.getValue()))
                .toList();
        return new MethodologySummary(criteria.size(), automated, aiSuggested, humanVerified,
                reviewerList, LEGAL_DISCLAIMER);
    }
}
