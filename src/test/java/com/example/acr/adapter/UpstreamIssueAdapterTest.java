package com.example.acr.adapter;

import com.example.acr.model.AuditIssue;
import com.example.acr.model.RemediationRecord;
import com.example.acr.model.Severity;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamIssueAdapterTest {

    private final UpstreamIssueAdapter adapter = new UpstreamIssueAdapter();
    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Nested
    @DisplayName("JSON shapes")
    class Json {

        @Test
        @DisplayName("the kind property selects the record type")
        void polymorphic() throws Exception {
            String json = """
                    [
                      {"kind": "remediation-task", "issueCode": "img-alt", "issueMessage": "Missing alt",
                       "severity": "critical", "wcagCriteria": "1.1.1, 1.4.5", "status": "completed",
                       "completedAt": "2026-03-01T10:00:00Z", "taskId": "t-1"},
                      {"kind": "raw-issue", "id": "i-1", "code": "color-contrast", "severity": "serious",
                       "description": "Low contrast", "filePath": "OEBPS/ch1.xhtml", "location": "line 12"},
                      {"kind": "criterion-record", "code": "EPUB-NAV-001", "description": "No nav",
                       "severity": "moderate", "wcagCriteria": ["2.4.1"]}
                    ]
                    """;

            List<UpstreamRecord> records = objectMapper.readValue(json, new TypeReference<>() {});

            assertThat(records).hasExactlyElementsOfTypes(UpstreamRecord.RemediationTask.class,
                    UpstreamRecord.RawIssue.class, UpstreamRecord.CriterionRecord.class);
            UpstreamRecord.RemediationTask task = (UpstreamRecord.RemediationTask) records.get(0);
            assertThat(task.wcagCriteria()).containsExactly("1.1.1", "1.4.5");
            assertThat(task.completedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
        }
    }

    @Nested
    @DisplayName("adapt")
    class Adapt {

        @Test
        @DisplayName("completed tasks yield an issue and a remediation record")
        void completedTask() {
            Instant done = Instant.parse("2026-03-01T10:00:00Z");
            AdaptedFindings findings = adapter.adapt(List.of(new UpstreamRecord.RemediationTask(
                    "img-alt", "Missing alt", "critical", "p. 3", List.of("1.1.1"), "auto-fixed", done)));

            assertThat(findings.issues()).singleElement().satisfies(issue -> {
                assertThat(issue.code()).isEqualTo("img-alt");
                assertThat(issue.severity()).isEqualTo(Severity.CRITICAL);
                assertThat(issue.explicitCriteria()).containsExactly("1.1.1");
            });
            assertThat(findings.remediations()).singleElement().satisfies(record -> {
                assertThat(record.covers("img-alt", "9.9.9")).isTrue();
                assertThat(record.fixedAt()).isEqualTo(done);
            });
        }

        @Test
        @DisplayName("pending tasks only yield the issue")
        void pendingTask() {
            AdaptedFindings findings = adapter.adapt(List.of(new UpstreamRecord.RemediationTask(
                    "label", "No label", "serious", null, null, "pending", null)));

            assertThat(findings.issues()).hasSize(1);
            assertThat(findings.remediations()).isEmpty();
        }

        @Test
        @DisplayName("raw issues fall back to the description and unknown severity")
        void rawIssue() {
            AdaptedFindings findings = adapter.adapt(List.of(new UpstreamRecord.RawIssue(
                    "i-1", "RSC-005", "fatal", null, "Package invalid", "package.opf", null)));

            AuditIssue issue = findings.issues().get(0);
            assertThat(issue.message()).isEqualTo("Package invalid");
            assertThat(issue.severity()).isEqualTo(Severity.UNKNOWN);
            assertThat(issue.filePath()).isEqualTo("package.opf");
        }

        @Test
        @DisplayName("criterion records keep their criterion tags")
        void criterionRecord() {
            AdaptedFindings findings = adapter.adapt(List.of(new UpstreamRecord.CriterionRecord(
                    "EPUB-NAV-001", "No nav", "moderate", null, List.of("2.4.1, 2.4.5"))));

            assertThat(findings.issues().get(0).explicitCriteria()).containsExactly("2.4.1", "2.4.5");
        }

        @Test
        @DisplayName("null input yields no findings")
        void nullInput() {
            AdaptedFindings findings = adapter.adapt(null);

            assertThat(findings.issues()).isEmpty();
            assertThat(findings.remediations()).isEmpty();
        }

        @Test
        @DisplayName("completion statuses are matched case-insensitively")
        void statuses() {
            assertThat(UpstreamIssueAdapter.isCompleted("Completed")).isTrue();
            assertThat(UpstreamIssueAdapter.isCompleted("FIXED")).isTrue();
            assertThat(UpstreamIssueAdapter.isCompleted("in-progress")).isFalse();
            assertThat(UpstreamIssueAdapter.isCompleted(null)).isFalse();
        }
    }

    @Test
    @DisplayName("remediation records match the task issue list")
    void remediationRecordShape() {
        RemediationRecord record = adapter.adapt(List.of(new UpstreamRecord.RemediationTask(
                null, "Unknown", "minor", null, List.of(), "fixed", null))).remediations().get(0);

        assertThat(record.issueCode()).isEqualTo("unknown");
        assertThat(record.issueCodes()).containsExactly("unknown");
    }
}
