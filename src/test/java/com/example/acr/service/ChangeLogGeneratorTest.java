package com.example.acr.service;

import com.example.acr.TestDocuments;
import com.example.acr.model.AcrDocument;
import com.example.acr.model.AcrEdition;
import com.example.acr.model.AcrStatus;
import com.example.acr.model.ChangeLogEntry;
import com.example.acr.model.ConformanceLevel;
import com.example.acr.model.ProductInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.example.acr.TestDocuments.criterion;
import static com.example.acr.TestDocuments.document;
import static org.assertj.core.api.Assertions.assertThat;

class ChangeLogGeneratorTest {

    private final ChangeLogGenerator generator = new ChangeLogGenerator();

    @Test
    @DisplayName("first version yields a single created entry")
    void created() {
        assertThat(generator.generate(null, TestDocuments.sample("acr-1"), null))
                .containsExactly(new ChangeLogEntry("document", null, "created", "Initial version created"));
        assertThat(generator.generate(null, TestDocuments.sample("acr-1"), "Imported"))
                .containsExactly(new ChangeLogEntry("document", null, "created", "Imported"));
    }

    @Test
    @DisplayName("identical snapshots yield no changes")
    void identical() {
        AcrDocument document = TestDocuments.sample("acr-1");

        assertThat(generator.generate(document, document.withVersion(3), null)).isEmpty();
    }

    @Test
    @DisplayName("status and edition are recorded by code")
    void statusAndEdition() {
        AcrDocument before = TestDocuments.sample("acr-1");
        AcrDocument after = new AcrDocument("acr-1", AcrEdition.INTERNATIONAL, before.productInfo(), List.of(),
                before.criteria(), before.generatedAt(), 0, AcrStatus.FINAL);

        assertThat(generator.generate(before, after, "Release")).containsExactly(
                new ChangeLogEntry("status", "draft", "final", "Release"),
                new ChangeLogEntry("edition", "VPAT2.5-WCAG", "VPAT2.5-INT", "Release"));
    }

    @Test
    @DisplayName("product info changes are reported per field")
    void productInfo() {
        AcrDocument before = TestDocuments.sample("acr-1");
        ProductInfo info = before.productInfo();
        Instant later = Instant.parse("2026-05-01T00:00:00Z");
        AcrDocument after = new AcrDocument("acr-1", before.edition(),
                new ProductInfo(info.name(), "3.0", info.description(), info.vendor(), "help@acme.test", later),
                List.of(), before.criteria(), before.generatedAt(), 0, before.status());

        assertThat(generator.generate(before, after, null)).extracting(ChangeLogEntry::field)
                .containsExactly("productInfo.version", "productInfo.contactEmail", "productInfo.evaluationDate");
        assertThat(generator.generate(before, after, null).get(2).newValue()).isEqualTo("2026-05-01T00:00:00Z");
    }

    @Test
    @DisplayName("missing product info compares as null")
    void missingProductInfo() {
        AcrDocument before = TestDocuments.sample("acr-1");
        AcrDocument after = new AcrDocument("acr-1", before.edition(), null, List.of(), before.criteria(),
                before.generatedAt(), 0, before.status());

        List<ChangeLogEntry> changes = generator.generate(before, after, null);

        assertThat(changes).hasSize(6);
        assertThat(changes).allMatch(c -> c.newValue() == null);
    }

    @Test
    @DisplayName("criteria added, removed and changed")
    void criteria() {
        AcrDocument before = document("acr-1",
                criterion("1.1.1", ConformanceLevel.SUPPORTS, "ok"),
                criterion("1.4.3", ConformanceLevel.SUPPORTS, "ok"));
        AcrDocument after = document("acr-1",
                criterion("1.1.1", ConformanceLevel.DOES_NOT_SUPPORT, "Missing alt text"),
                criterion("2.4.10", ConformanceLevel.SUPPORTS, "ok"));

        assertThat(generator.generate(before, after, null)).containsExactly(
                new ChangeLogEntry("criteria.1.1.1.conformanceLevel", "Supports", "Does Not Support", null),
                new ChangeLogEntry("criteria.1.1.1.remarks", "ok", "Missing alt text", null),
                new ChangeLogEntry("criteria.2.4.10", null, "added", null),
                new ChangeLogEntry("criteria.1.4.3", "existed", null, "Criterion removed"));
    }

    @Test
    @DisplayName("long remarks are truncated to 100 characters")
    void truncation() {
        String longRemark = "x".repeat(150);
        AcrDocument before = document("acr-1", criterion("1.1.1", ConformanceLevel.SUPPORTS, "short"));
        AcrDocument after = document("acr-1", criterion("1.1.1", ConformanceLevel.SUPPORTS, longRemark));

        ChangeLogEntry entry = generator.generate(before, after, null).get(0);

        assertThat(entry.previousValue()).isEqualTo("short");
        assertThat((String) entry.newValue()).hasSize(103).endsWith("...");
    }

    @Test
    @DisplayName("criterion ids are extracted with their dots")
    void criterionIdOf() {
        assertThat(ChangeLogGenerator.criterionIdOf("criteria.1.4.10.remarks")).isEqualTo("1.4.10");
        assertThat(ChangeLogGenerator.criterionIdOf("criteria.1.1.1.conformanceLevel")).isEqualTo("1.1.1");
        assertThat(ChangeLogGenerator.criterionIdOf("criteria.EN-5.2")).isEqualTo("EN-5.2");
        assertThat(ChangeLogGenerator.criterionIdOf("status")).isNull();
    }
}
