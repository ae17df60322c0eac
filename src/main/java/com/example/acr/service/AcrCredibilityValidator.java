package com.example.acr.service;

import com.example.acr.model.AcrCriterion;
import com.example.acr.model.AcrDocument;
import com.example.acr.model.ConformanceLevel;
import com.example.acr.model.CredibilityReport;
import com.example.acr.model.CredibilityWarning;
import com.example.acr.model.RemarksValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Review-time checks that an ACR will hold up in procurement: remark quality per
 * conformance level and the distribution of levels across the report.
 * <p>
 * Warnings never change the document; callers decide whether to block on them.
 */
@Service
public class AcrCredibilityValidator {

    private static final Logger log = LoggerFactory.getLogger(AcrCredibilityValidator.class);

    static final double HIGH_COMPLIANCE_PERCENT = 95.0;
    static final double HIGH_NOT_APPLICABLE_PERCENT = 30.0;
    static final int PERFECT_COMPLIANCE_MIN_CRITERIA = 6;
    static final int ADEQUATE_REMARKS_LENGTH = 20;

    /** What remarks must contain for one conformance level. */
    public record RemarksRequirement(boolean required, int minimumLength, List<String> mustInclude) {}

    private static final Map<ConformanceLevel, RemarksRequirement> REQUIREMENTS = new EnumMap<>(Map.of(
            ConformanceLevel.SUPPORTS, new RemarksRequirement(false, 0, List.of()),
            ConformanceLevel.PARTIALLY_SUPPORTS, new RemarksRequirement(true, 50, List.of("what works", "limitations")),
            ConformanceLevel.DOES_NOT_SUPPORT, new RemarksRequirement(true, 30, List.of("reason")),
            ConformanceLevel.NOT_APPLICABLE, new RemarksRequirement(true, 20, List.of("justification"))));

    // phrases accepted as addressing each required topic
    private static final Map<String, List<String>> KEYWORD_VARIANTS = Map.of(
            "what works", List.of("what works", "working", "compliant", "passed", "supports", "meets"),
            "limitations", List.of("limitations", "limitation", "issues", "problems", "fails", "does not", "doesn't"),
            "reason", List.of("reason", "because", "due to", "caused by", "issue", "problem"),
            "justification", List.of("justification", "because", "since", "as", "not applicable",
                    "does not apply", "n/a"));

    public RemarksRequirement requirementFor(ConformanceLevel level) {
        return REQUIREMENTS.get(level != null ? level : ConformanceLevel.NOT_APPLICABLE);
    }

    public RemarksValidation validateRemarks(ConformanceLevel level, String remarks) {
        ConformanceLevel effective = level != null ? level : ConformanceLevel.NOT_APPLICABLE;
        RemarksRequirement requirement = requirementFor(effective);
        String text = remarks != null ? remarks : "";
        List<String> errors = new ArrayList<>();

        if (requirement.required() && text.isBlank()) {
            errors.add("Remarks required for \"%s\" status".formatted(effective.label()));
            return new RemarksValidation(false, errors);
        }
        if (text.length() < requirement.minimumLength()) {
            errors.add("Remarks must be at least %d characters for \"%s\" status (current: %d)"
                    .formatted(requirement.minimumLength(), effective.label(), text.length()));
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : requirement.mustInclude()) {
            boolean addressed = KEYWORD_VARIANTS.getOrDefault(keyword, List.of(keyword)).stream()
                    .anyMatch(lower::contains);
            if (!addressed) {
                errors.add("Remarks for \"%s\" should address: %s".formatted(effective.label(), keyword));
            }
        }
        return new RemarksValidation(errors.isEmpty(), errors);
    }

    public List<CredibilityWarning> warnings(AcrDocument document) {
        List<AcrCriterion> criteria = document.criteria();
        List<CredibilityWarning> warnings = new ArrayList<>();
        if (criteria.isEmpty()) {
            warnings.add(new CredibilityWarning(CredibilityWarning.Type.EMPTY_ACR,
                    "ACR contains no criteria evaluations.",
                    "Ensure all relevant criteria are evaluated before finalizing."));
            return warnings;
        }

        int total = criteria.size();
        long supports = count(criteria, ConformanceLevel.SUPPORTS);
        double supportsPercent = percent(supports, total);

        if (supportsPercent > HIGH_COMPLIANCE_PERCENT) {
            warnings.add(new CredibilityWarning(CredibilityWarning.Type.HIGH_COMPLIANCE_WARNING,
                    "ACR shows %s%% \"Supports\" ratings (%d of %d criteria). Sophisticated procurement teams may view this skeptically."
                            .formatted(oneDecimal(supportsPercent), supports, total),
                    "Review each criterion carefully. Consider adding detailed remarks even for \"Supports\" items to demonstrate thorough evaluation."));
        }
        if (supports == total && total >= PERFECT_COMPLIANCE_MIN_CRITERIA) {
            warnings.add(new CredibilityWarning(CredibilityWarning.Type.PERFECT_COMPLIANCE_RED_FLAG,
                    "100% \"Supports\" rating across all criteria is extremely rare and may appear fraudulent.",
                    "Verify all automated and manual testing was thorough. Add comprehensive remarks explaining how each criterion was validated."));
        }

        long thinRemarks = criteria.stream()
                .filter(c -> c.conformanceLevel() != ConformanceLevel.SUPPORTS)
                .filter(c -> c.remarks().trim().length() < ADEQUATE_REMARKS_LENGTH)
                .count();
        if (thinRemarks > 0) {
            warnings.add(new CredibilityWarning(CredibilityWarning.Type.MISSING_REMARKS,
                    "%d non-\"Supports\" criteria lack adequate remarks.".formatted(thinRemarks),
                    "Add detailed remarks explaining the compliance status for each criterion."));
        }

        long notApplicable = count(criteria, ConformanceLevel.NOT_APPLICABLE);
        double notApplicablePercent = percent(notApplicable, total);
        if (notApplicablePercent > HIGH_NOT_APPLICABLE_PERCENT) {
            warnings.add(new CredibilityWarning(CredibilityWarning.Type.HIGH_NOT_APPLICABLE,
                    "%s%% of criteria marked \"Not Applicable\" (%d of %d)."
                            .formatted(oneDecimal(notApplicablePercent), notApplicable, total),
                    "Verify that \"Not Applicable\" designations are justified. Procurement teams may question high N/A rates."));
        }
        return warnings;
    }

    public CredibilityReport validate(AcrDocument document) {
        List<CredibilityWarning> warnings = warnings(document);
        List<AcrCriterion> criteria = document.criteria();
        int total = criteria.size();
        int supports = (int) count(criteria, ConformanceLevel.SUPPORTS);

        CredibilityReport.Summary summary = new CredibilityReport.Summary(
                total,
                supports,
                (int) count(criteria, ConformanceLevel.PARTIALLY_SUPPORTS),
                (int) count(criteria, ConformanceLevel.DOES_NOT_SUPPORT),
                (int) count(criteria, ConformanceLevel.NOT_APPLICABLE),
                total > 0 ? percent(supports, total) : 0.0);
        boolean credible = warnings.stream().noneMatch(w -> w.type().isBlocking());

        log.debug("ACR {}: credibility {} with {} warning(s)", document.id(), credible ? "ok" : "blocked", warnings.size());
        return new CredibilityReport(credible, warnings, summary);
    }

    private static long count(List<AcrCriterion> criteria, ConformanceLevel level) {
        return criteria.stream().filter(c -> c.conformanceLevel() == level).count();
    }

    private static double percent(long part, int total) {
        return part * 100.0 / total;
    }

    private static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
