package com.example.acr.adapter;

import com.example.acr.model.AuditIssue;
import com.example.acr.model.RemediationRecord;
import com.example.acr.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Converts upstream records into {@link AuditIssue}s and {@link RemediationRecord}s.
 * Completed remediation tasks contribute both the issue and the record that marks it fixed.
 */
@Component
public class UpstreamIssueAdapter {

    private static final Logger log = LoggerFactory.getLogger(UpstreamIssueAdapter.class);

    static final Set<String> COMPLETED_STATUSES = Set.of("completed", "auto-fixed", "fixed");

    public AdaptedFindings adapt(List<? extends UpstreamRecord> records) {
        List<AuditIssue> issues = new ArrayList<>();
        List<RemediationRecord> remediations = new ArrayList<>();
        if (records == null) {
            return new AdaptedFindings(issues, remediations);
        }

        for (UpstreamRecord record : records) {
            if (record instanceof UpstreamRecord.RemediationTask task) {
                issues.add(new AuditIssue(null, task.issueCode(), Severity.fromValue(task.severity()),
                        task.issueMessage(), null, task.location(), criteria(task.wcagCriteria())));
                if (isCompleted(task.status())) {
                    String code = task.issueCode() != null ? task.issueCode() : "unknown";
                    remediations.add(new RemediationRecord(code, null, List.of(code),
                            task.status(), task.completedAt()));
                }
            } else if (record instanceof UpstreamRecord.RawIssue raw) {
                String message = raw.message() != null ? raw.message() : raw.description();
                issues.add(new AuditIssue(raw.id(), raw.code(), Severity.fromValue(raw.severity()),
                        message, raw.filePath(), raw.location(), List.of()));
            } else if (record instanceof UpstreamRecord.CriterionRecord tagged) {
                issues.add(new AuditIssue(null, tagged.code(), Severity.fromValue(tagged.severity()),
                        tagged.description(), null, tagged.location(), criteria(tagged.wcagCriteria())));
            } else if (record != null) {
                throw new IllegalArgumentException("Unsupported upstream record: " + record.getClass().getName());
            }
        }

        log.debug("Adapted {} upstream records: {} issues, {} remediation records",
                records.size(), issues.size(), remediations.size());
        return new AdaptedFindings(issues, remediations);
    }

    static boolean isCompleted(String status) {
        return status != null && COMPLETED_STATUSES.contains(status.trim().toLowerCase(Locale.ROOT));
    }

    private static List<String> criteria(List<String> ids) {
        if (ids == null) return List.of();
        List<String> flat = new ArrayList<>();
        ids.forEach(id -> flat.addAll(CriteriaListDeserializer.split(id)));
        return flat;
    }
}
