package com.example.acr.service;

import com.example.acr.model.AuditIssue;
import com.example.acr.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IssueCriterionMapperTest {

    private final IssueCriterionMapper mapper = new IssueCriterionMapper();

    @Test
    @DisplayName("maps rule ids through the rule table")
    void ruleTable() {
        assertThat(mapper.criteriaForRule("img-alt")).containsExactly("1.1.1");
        assertThat(mapper.criteriaForRule("label")).containsExactly("1.3.1", "3.3.2", "4.1.2");
        assertThat(mapper.isMapped("color-contrast")).isTrue();
        assertThat(mapper.isMapped("RSC-005")).isFalse();
        assertThat(mapper.criteriaForRule(null)).isEmpty();
    }

    @Test
    @DisplayName("an issue matching several criteria appears once under each")
    void manyToMany() {
        AuditIssue label = AuditIssue.of("label", Severity.SERIOUS, "Form field without label");

        IssueMapping mapping = mapper.mapIssuesToCriteria(List.of(label));

        assertThat(mapping.byCriterion()).containsOnlyKeys("1.3.1", "3.3.2", "4.1.2");
        assertThat(mapping.issuesFor("4.1.2")).containsExactly(label);
        assertThat(mapping.totalMapped()).isEqualTo(3);
        assertThat(mapping.unmapped()).isEmpty();
    }

    @Test
    @DisplayName("explicit criterion tags are honoured and not duplicated")
    void explicitTags() {
        AuditIssue tagged = new AuditIssue(null, "img-alt", Severity.CRITICAL, "Missing alt",
                null, null, List.of("1.1.1", "1.4.5"));

        assertThat(mapper.criteriaFor(tagged)).containsExactly("1.1.1", "1.4.5");
        assertThat(mapper.mapIssuesToCriteria(List.of(tagged)).issuesFor("1.1.1")).hasSize(1);
    }

    @Test
    @DisplayName("issues matching nothing are kept in the unmapped bucket")
    void unmapped() {
        AuditIssue resource = AuditIssue.of("RSC-005", Severity.SERIOUS, "Invalid package document");
        AuditIssue custom = AuditIssue.of("vendor-check", Severity.MINOR, "Vendor specific");

        IssueMapping mapping = mapper.mapIssuesToCriteria(List.of(resource, custom));

        assertThat(mapping.byCriterion()).isEmpty();
        assertThat(mapping.unmapped()).containsExactly(resource, custom);
    }

    @Test
    @DisplayName("summary orders criteria by issue count")
    void summary() {
        List<AuditIssue> issues = List.of(
                AuditIssue.of("color-contrast", Severity.SERIOUS, "Low contrast"),
                AuditIssue.of("heading-order", Severity.MODERATE, "Skipped level"),
                AuditIssue.of("list", Severity.MINOR, "Broken list"),
                AuditIssue.of("p-as-heading", Severity.MINOR, "Bold paragraph"));

        List<IssueCriterionMapper.CriterionIssueCount> summary = mapper.criteriaSummary(issues);

        assertThat(summary.get(0)).isEqualTo(new IssueCriterionMapper.CriterionIssueCount("1.3.1", 3));
        assertThat(summary).extracting(IssueCriterionMapper.CriterionIssueCount::criterionId)
                .containsExactlyInAnyOrder("1.3.1", "1.4.3", "2.4.6");
    }
}
