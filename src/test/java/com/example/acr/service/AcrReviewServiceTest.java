package com.example.acr.service;

import com.example.acr.TestDocuments;
import com.example.acr.TestProperties;
import com.example.acr.model.AcrStatus;
import com.example.acr.model.AcrVersion;
import com.example.acr.model.AttributionTag;
import com.example.acr.model.ConformanceLevel;
import com.example.acr.model.CredibilityReport;
import com.example.acr.model.CriterionEdit;
import com.example.acr.model.CriterionVerification;
import com.example.acr.model.MethodologySummary;
import com.example.acr.model.VerificationStatus;
import com.example.acr.repository.InMemoryAcrVersionStore;
import com.example.acr.repository.VersionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AcrReviewServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-04-01T12:00:00Z"), ZoneOffset.UTC);
    private final AttributionTagger tagger = new AttributionTagger();

    private AcrVersioningService versioning;
    private AcrReviewService review;

    @BeforeEach
    void setUp() {
        versioning = new AcrVersioningService(new InMemoryAcrVersionStore(), new ChangeLogGenerator(), clock,
                TestProperties.defaults());
        review = new AcrReviewService(new AcrDocumentAssembler(tagger, clock), versioning, tagger,
                new AcrCredibilityValidator());
        versioning.createVersion("acr-1", "system",
                TestDocuments.sample("acr-1").withCriteria(tagger.attributeAll(
                        TestDocuments.sample("acr-1").criteria(), Map.of())), null);
    }

    @Test
    @DisplayName("a human edit is stored as the next version")
    void humanEdit() {
        AcrVersion version = review.applyHumanEdit("acr-1", new CriterionEdit("1.4.3",
                ConformanceLevel.DOES_NOT_SUPPORT, "Body text fails", VerificationStatus.VERIFIED_FAIL, "alice"),
                "Manual contrast check");

        assertThat(version.version()).isEqualTo(2);
        assertThat(version.createdBy()).isEqualTo("alice");
        assertThat(version.changeLog()).extracting(c -> c.field())
                .containsExactly("criteria.1.4.3.conformanceLevel", "criteria.1.4.3.remarks");
        assertThat(version.snapshot().criterion("1.4.3").orElseThrow().attributionTag())
                .isEqualTo(AttributionTag.HUMAN_VERIFIED);
    }

    @Test
    @DisplayName("bulk edit, review and finalization each add a version")
    void lifecycle() {
        review.applyBulkEdit("acr-1", List.of(
                new CriterionEdit("1.1.1", null, null, VerificationStatus.VERIFIED_PASS, "bob"),
                new CriterionEdit("1.4.3", ConformanceLevel.SUPPORTS, "Fixed", VerificationStatus.VERIFIED_PASS, "bob")),
                "bob", "Bulk review");
        review.submitForReview("acr-1", "bob");
        AcrVersion finalVersion = review.finalizeAcr("acr-1", "carol");

        assertThat(finalVersion.version()).isEqualTo(4);
        assertThat(finalVersion.snapshot().status()).isEqualTo(AcrStatus.FINAL);
        assertThat(versioning.compareVersions("acr-1", 1, 4).orElseThrow().summary().statusChanged()).isTrue();
    }

    @Test
    @DisplayName("methodology summary reflects the latest version")
    void methodology() {
        review.applyHumanEdit("acr-1", new CriterionEdit("1.1.1", null, null,
                VerificationStatus.VERIFIED_PASS, "alice"), null);

        MethodologySummary summary = review.methodology("acr-1", Map.of("1.1.1",
                new CriterionVerification("1.1.1", VerificationStatus.VERIFIED_PASS, false, "alice")));

        assertThat(summary.humanVerifiedFindings()).isEqualTo(1);
        assertThat(summary.automatedFindings()).isEqualTo(1);
    }

    @Test
    @DisplayName("credibility and remark checks read the latest version")
    void credibility() {
        review.applyHumanEdit("acr-1", new CriterionEdit("1.4.3", ConformanceLevel.DOES_NOT_SUPPORT,
                "Fails", VerificationStatus.VERIFIED_FAIL, "alice"), null);

        CredibilityReport report = review.credibility("acr-1");

        assertThat(report.credible()).isFalse();
        assertThat(report.summary().doesNotSupportCount()).isEqualTo(1);
        assertThat(review.remarksProblems("acr-1")).containsOnlyKeys("1.4.3");
    }

    @Test
    @DisplayName("credibility warnings do not block finalization")
    void finalizeWithWarnings() {
        review.applyHumanEdit("acr-1", new CriterionEdit("1.4.3", ConformanceLevel.DOES_NOT_SUPPORT,
                "Fails", VerificationStatus.VERIFIED_FAIL, "alice"), null);

        assertThat(review.finalizeAcr("acr-1", "carol").snapshot().status()).isEqualTo(AcrStatus.FINAL);
    }

    @Test
    @DisplayName("unknown ACRs are reported")
    void unknownAcr() {
        assertThatThrownBy(() -> review.finalizeAcr("acr-404", "carol"))
                .isInstanceOf(VersionNotFoundException.class);
    }
}
