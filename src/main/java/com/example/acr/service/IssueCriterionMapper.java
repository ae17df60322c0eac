package com.example.acr.service;

import com.example.acr.model.AuditIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps checker rule ids (ACE, axe and EPUB platform rules) to WCAG success criteria.
 * <p>
 * The table is many-to-many: a rule may cover several criteria and a criterion is
 * covered by many rules. Rules listed with no criteria are known but deliberately
 * unmapped (packaging errors with no WCAG counterpart). Criteria tagged on the issue
 * itself are honoured in addition to the table.
 */
@Service
public class IssueCriterionMapper {

    private static final Logger log = LoggerFactory.getLogger(IssueCriterionMapper.class);

    static final Map<String, List<String>> RULE_TO_CRITERIA = buildRuleTable();

    private static Map<String, List<String>> buildRuleTable() {
        Map<String, List<String>> t = new LinkedHashMap<>();

        // ── Platform rules: EPUBCheck resource errors ──
        for (String rsc : List.of("RSC-001", "RSC-002", "RSC-003", "RSC-005", "RSC-006", "RSC-007",
                "RSC-008", "RSC-010", "RSC-011", "RSC-012", "RSC-015", "RSC-016", "RSC-017")) {
            t.put(rsc, List.of());
        }

        // ── Platform rules: structure, metadata, semantics ──
        t.put("EPUB-STRUCT-001", List.of("1.3.1"));
        t.put("EPUB-STRUCT-002", List.of("1.3.1"));
        t.put("EPUB-STRUCT-003", List.of("1.3.1"));
        t.put("EPUB-STRUCT-004", List.of("1.3.1"));
        t.put("EPUB-IMG-001", List.of("1.1.1"));
        t.put("EPUB-FIG-001", List.of("1.1.1"));
        t.put("EPUB-PAGE-001", List.of("2.4.5"));
        t.put("EPUB-LANG-001", List.of("3.1.1"));
        t.put("EPUB-TITLE-001", List.of("2.4.2"));
        t.put("EPUB-META-001", List.of("3.1.1"));
        t.put("EPUB-META-002", List.of());
        t.put("EPUB-META-003", List.of());
        t.put("EPUB-META-004", List.of());
        t.put("EPUB-SEM-001", List.of("3.1.1", "3.1.2"));
        t.put("EPUB-SEM-002", List.of("2.4.4"));
        t.put("EPUB-NAV-001", List.of("2.4.1"));

        // ── Images and non-text content ──
        t.put("img-alt", List.of("1.1.1"));
        t.put("area-alt", List.of("1.1.1"));
        t.put("input-image-alt", List.of("1.1.1"));
        t.put("object-alt", List.of("1.1.1"));
        t.put("svg-img-alt", List.of("1.1.1"));

        // ── Language ──
        t.put("html-has-lang", List.of("3.1.1"));
        t.put("html-lang-valid", List.of("3.1.1"));
        t.put("valid-lang", List.of("3.1.2"));

        // ── Headings ──
        t.put("heading-order", List.of("1.3.1", "2.4.6"));
        t.put("empty-heading", List.of("1.3.1", "2.4.6"));
        t.put("p-as-heading", List.of("1.3.1"));

        // ── Lists and tables ──
        t.put("list", List.of("1.3.1"));
        t.put("listitem", List.of("1.3.1"));
        t.put("definition-list", List.of("1.3.1"));
        t.put("table-duplicate-name", List.of("1.3.1"));
        t.put("td-headers-attr", List.of("1.3.1", "4.1.1"));
        t.put("th-has-data-cells", List.of("1.3.1"));
        t.put("layout-table", List.of("1.3.1"));
        t.put("scope-attr-valid", List.of("1.3.1"));
        t.put("td-has-header", List.of("1.3.1"));

        // ── Links, color, contrast ──
        t.put("link-name", List.of("2.4.4", "4.1.2"));
        t.put("link-in-text-block", List.of("1.4.1"));
        t.put("identical-links-same-purpose", List.of("2.4.4"));
        t.put("color-contrast", List.of("1.4.3"));
        t.put("color-contrast-enhanced", List.of("1.4.6"));
        t.put("use-of-color", List.of("1.4.1"));

        // ── Forms ──
        t.put("label", List.of("1.3.1", "3.3.2", "4.1.2"));
        t.put("label-title-only", List.of("3.3.2"));
        t.put("button-name", List.of("4.1.2"));
        t.put("input-button-name", List.of("4.1.2"));
        t.put("select-name", List.of("4.1.2"));
        t.put("textarea-label", List.of("4.1.2"));

        // ── ARIA ──
        t.put("aria-allowed-attr", List.of("4.1.2"));
        t.put("aria-required-attr", List.of("4.1.2"));
        t.put("aria-required-children", List.of("1.3.1", "4.1.2"));
        t.put("aria-required-parent", List.of("1.3.1", "4.1.2"));
        t.put("aria-roles", List.of("4.1.2"));
        t.put("aria-valid-attr-value", List.of("4.1.2"));
        t.put("aria-valid-attr", List.of("4.1.2"));
        t.put("aria-hidden-focus", List.of("4.1.2"));

        // ── Page structure, navigation, keyboard ──
        t.put("document-title", List.of("2.4.2"));
        t.put("landmark-one-main", List.of("1.3.1"));
        t.put("landmark-no-duplicate-banner", List.of("1.3.1"));
        t.put("landmark-no-duplicate-contentinfo", List.of("1.3.1"));
        t.put("region", List.of("1.3.1"));
        t.put("accesskeys", List.of("2.4.1"));
        t.put("bypass", List.of("2.4.1"));
        t.put("skip-link", List.of("2.4.1"));
        t.put("tabindex", List.of("2.4.3"));
        t.put("focus-order-semantics", List.of("2.4.3"));

        // ── Parsing ──
        t.put("duplicate-id", List.of("4.1.1"));
        t.put("duplicate-id-active", List.of("4.1.1"));
        t.put("duplicate-id-aria", List.of("4.1.1"));

        // ── Timing, viewport, media ──
        t.put("meta-refresh", List.of("2.2.1", "2.2.4", "3.2.5"));
        t.put("meta-viewport", List.of("1.4.4"));
        t.put("audio-caption", List.of("1.2.2"));
        t.put("video-caption", List.of("1.2.2"));
        t.put("video-description", List.of("1.2.3", "1.2.5"));

        return Collections.unmodifiableMap(t);
    }

    /**
     * Groups issues under every criterion they match. An issue matching several
     * criteria appears once under each of them; an issue matching none is kept in
     * {@link IssueMapping#unmapped()}.
     */
    public IssueMapping mapIssuesToCriteria(List<AuditIssue> issues) {
        Map<String, List<AuditIssue>> byCriterion = new LinkedHashMap<>();
        List<AuditIssue> unmapped = new ArrayList<>();

        for (AuditIssue issue : issues) {
            Set<String> criteria = criteriaFor(issue);
            if (criteria.isEmpty()) {
                unmapped.add(issue);
                continue;
            }
            for (String criterionId : criteria) {
                byCriterion.computeIfAbsent(criterionId, k -> new ArrayList<>()).add(issue);
            }
        }

        Map<String, List<AuditIssue>> frozen = new LinkedHashMap<>();
        byCriterion.forEach((k, v) -> frozen.put(k, List.copyOf(v)));

        log.debug("IssueCriterionMapper: {} issues → {} criteria, {} unmapped",
                issues.size(), frozen.size(), unmapped.size());
        return new IssueMapping(Collections.unmodifiableMap(frozen), List.copyOf(unmapped));
    }

    /** Criteria an issue belongs to: explicit tags first, then the rule table. */
    public Set<String> criteriaFor(AuditIssue issue) {
        Set<String> criteria = new LinkedHashSet<>();
        for (String tagged : issue.explicitCriteria()) {
            if (tagged != null && !tagged.isBlank()) criteria.add(tagged.trim());
        }
        criteria.addAll(criteriaForRule(issue.code()));
        return criteria;
    }

    public List<String> criteriaForRule(String ruleId) {
        if (ruleId == null) return List.of();
        return RULE_TO_CRITERIA.getOrDefault(ruleId, List.of());
    }

    /** True if the rule table maps the rule to at least one criterion. */
    public boolean isMapped(String ruleId) {
        return !criteriaForRule(ruleId).isEmpty();
    }

    /**
     * Criteria with at least one issue, most affected first.
     */
    public List<CriterionIssueCount> criteriaSummary(List<AuditIssue> issues) {
        return mapIssuesToCriteria(issues).byCriterion().entrySet().stream()
                .map(e -> new CriterionIssueCount(e.getKey(), e.getValue().size()))
                .sorted(Comparator.comparingInt(CriterionIssueCount::issueCount).reversed())
                .toList();
    }

    public record CriterionIssueCount(String criterionId, int issueCount) {}
}
