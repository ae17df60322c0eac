package com.example.acr.service;

import com.example.acr.catalog.CriterionCatalog;
import com.example.acr.model.AcrAnalysis;
import com.example.acr.model.AnalysisSummary;
import com.example.acr.model.AuditIssue;
import com.example.acr.model.CriterionAnalysis;
import com.example.acr.model.IssueDetail;
import com.example.acr.model.OtherIssue;
import com.example.acr.model.RemediationRecord;
import com.example.acr.model.Severity;
import com.example.acr.model.SuccessCriterion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies every criterion of an edition from the findings of one document.
 * <p>
 * Pipeline per criterion:
 * <ol>
 *   <li>Collect related issues: mapper groups (explicit tags, rule table) and rule ids
 *       that embed the criterion id, e.g. {@code WCAG-111} or {@code epub_111_check}</li>
 *   <li>Split them into fixed and remaining using the remediation records</li>
 *   <li>Classify with {@link SeverityRules}, looking at remaining issues only</li>
 * </ol>
 * Pure and deterministic: the same issues and remediation records always give equal results.
 */
@Service
public class ConformanceEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConformanceEvaluator.class);

    /** Maximum number of finding lines per criterion. */
    static final int MAX_FINDINGS = 5;

    static final String NO_ISSUES_FINDING = "No accessibility issues detected for this criterion";

    private static final Comparator<AuditIssue> BY_SEVERITY = Comparator.comparingInt(i -> i.severity().ordinal());

    private final CriterionCatalog catalog;
    private final IssueCriterionMapper mapper;
    private final SeverityRules rules;

    public ConformanceEvaluator(CriterionCatalog catalog, IssueCriterionMapper mapper, SeverityRules rules) {
        this.catalog = catalog;
        this.mapper = mapper;
        this.rules = rules;
    }

    /**
     * Evaluates all criteria of the edition for one document.
     *
     * @param documentId   id of the audited document or job
     * @param editionCode  edition code; unknown or null codes select the A + AA baseline
     * @param issues       findings of the document
     * @param remediations completed remediation records of the document
     * @return the analysis, with one entry per edition criterion in catalog order
     */
    public AcrAnalysis evaluate(String documentId, String editionCode,
                                List<AuditIssue> issues, List<RemediationRecord> remediations) {
        List<AuditIssue> safeIssues = issues != null ? issues : List.of();
        List<RemediationRecord> safeRemediations = remediations != null ? remediations : List.of();
        List<SuccessCriterion> criteria = catalog.criteriaForEdition(editionCode);

        log.info("ConformanceEvaluator: document {}: {} criteria (edition {}), {} issues, {} remediation records",
                documentId, criteria.size(), editionCode != null ? editionCode : "default A+AA",
                safeIssues.size(), safeRemediations.size());

        IssueMapping mapping = mapper.mapIssuesToCriteria(safeIssues);
        Set<AuditIssue> claimed = Collections.newSetFromMap(new IdentityHashMap<>());
        List<CriterionAnalysis> analyses = new ArrayList<>(criteria.size());

        for (SuccessCriterion criterion : criteria) {
            List<AuditIssue> related = relatedIssues(criterion, safeIssues, mapping);
            claimed.addAll(related);
            analyses.add(evaluateCriterion(criterion, related, safeRemediations));
        }

        List<OtherIssue> otherIssues = safeIssues.stream()
                .filter(issue -> !claimed.contains(issue))
                .map(issue -> toOtherIssue(issue, safeRemediations))
                .toList();

        int overall = overallConfidence(analyses);
        AnalysisSummary summary = AnalysisSummary.of(analyses);

        log.info("ConformanceEvaluator: document {}: supports={}, partial={}, doesNotSupport={}, n/a={}, "
                        + "other issues={}, overall confidence={}%",
                documentId, summary.supports(), summary.partiallySupports(), summary.doesNotSupport(),
                summary.notApplicable(), otherIssues.size(), overall);

        return new AcrAnalysis(documentId, editionCode, analyses, overall, summary, otherIssues);
    }

    /**
     * Classifies a single criterion from its related issues.
     */
    public CriterionAnalysis evaluateCriterion(SuccessCriterion criterion, List<AuditIssue> related,
                                               List<RemediationRecord> remediations) {
        List<IssueDetail> fixed = new ArrayList<>();
        List<AuditIssue> remaining = new ArrayList<>();

        for (AuditIssue issue : related) {
            Optional<RemediationRecord> fix = findRemediation(issue, criterion.id(), remediations);
            if (fix.isPresent()) {
                fixed.add(IssueDetail.fixed(issue, fix.get().fixedAt()));
            } else {
                remaining.add(issue);
            }
        }

        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (AuditIssue issue : remaining) {
            counts.merge(issue.severity(), 1, Integer::sum);
        }
        SeverityRules.Profile profile = new SeverityRules.Profile(related.size(), fixed.size(), counts);
        SeverityRules.Verdict verdict = rules.classify(profile);

        log.debug("Criterion {}: {}/{} fixed → {} ({}%)", criterion.id(), fixed.size(), related.size(),
                verdict.status().value(), verdict.confidence());

        return new CriterionAnalysis(
                criterion.id(),
                criterion.name(),
                criterion.level(),
                criterion.section(),
                verdict.status(),
                verdict.confidence(),
                findings(verdict, related.size(), fixed.size(), remaining),
                verdict.recommendation(),
                fixed,
                remaining.stream().map(IssueDetail::remaining).toList()
        );
    }

    /**
     * Issues related to the criterion, in input order and without duplicates.
     */
    List<AuditIssue> relatedIssues(SuccessCriterion criterion, List<AuditIssue> issues, IssueMapping mapping) {
        Set<AuditIssue> mapped = Collections.newSetFromMap(new IdentityHashMap<>());
        mapped.addAll(mapping.issuesFor(criterion.id()));

        String pattern = criterion.id().replace(".", "").toUpperCase(Locale.ROOT);
        Pattern embedded = Pattern.compile("(?:^|[-_])" + Pattern.quote(pattern) + "(?:[-_]|$)");

        List<AuditIssue> related = new ArrayList<>();
        for (AuditIssue issue : issues) {
            if (mapped.contains(issue) || codeMatches(issue.code(), pattern, embedded)) {
                related.add(issue);
            }
        }
        return related;
    }

    static boolean codeMatches(String code, String pattern, Pattern embedded) {
        if (code == null || code.isBlank()) return false;
        String upper = code.toUpperCase(Locale.ROOT);
        return upper.equals(pattern)
                || upper.equals("WCAG-" + pattern)
                || embedded.matcher(upper).find();
    }

    /**
     * Mean criterion confidence plus a bonus of up to {@code remediationBonusMax} points
     * proportional to the share of fixed issues, capped at 100. Zero for an empty edition.
     */
    int overallConfidence(List<CriterionAnalysis> analyses) {
        if (analyses.isEmpty()) return 0;

        int mean = (int) Math.round(analyses.stream().mapToInt(CriterionAnalysis::confidence).average().orElse(0));
        int fixed = analyses.stream().mapToInt(CriterionAnalysis::fixedCount).sum();
        int total = analyses.stream().mapToInt(CriterionAnalysis::totalIssues).sum();

        if (total == 0 || fixed == 0) return Math.min(100, mean);

        int maxBonus = rules.confidence().remediationBonusMax();
        int bonus = (int) Math.min(Math.round((double) fixed / total * maxBonus), maxBonus);
        log.debug("Remediation bonus: +{} ({}/{} issues fixed)", bonus, fixed, total);
        return Math.min(100, mean + bonus);
    }

    private List<String> findings(SeverityRules.Verdict verdict, int total, int fixedCount,
                                  List<AuditIssue> remaining) {
        switch (verdict.outcome()) {
            case NO_ISSUES:
                return List.of(NO_ISSUES_FINDING);
            case ALL_REMEDIATED:
                return List.of("All %d issue(s) have been remediated".formatted(total));
            default:
                break;
        }

        List<String> findings = new ArrayList<>();
        if (fixedCount > 0) {
            findings.add("✓ %d issue(s) fixed".formatted(fixedCount));
        }
        remaining.stream()
                .sorted(BY_SEVERITY)
                .map(issue -> issue.severity().findingPrefix() + issue.message())
                .limit(MAX_FINDINGS - findings.size())
                .forEach(findings::add);
        return findings;
    }

    private static Optional<RemediationRecord> findRemediation(AuditIssue issue, String criterionId,
                                                               List<RemediationRecord> remediations) {
        String code = issue.effectiveCode();
        return remediations.stream().filter(r -> r.covers(code, criterionId)).findFirst();
    }

    private static OtherIssue toOtherIssue(AuditIssue issue, List<RemediationRecord> remediations) {
        String code = issue.code() != null ? issue.code() : "UNKNOWN";
        boolean fixed = remediations.stream()
                .anyMatch(r -> code.equals(r.issueCode()) || r.issueCodes().contains(code));
        return new OtherIssue(code, issue.message(), issue.severity(), issue.location(),
                fixed ? OtherIssue.Status.FIXED : OtherIssue.Status.PENDING);
    }
}
