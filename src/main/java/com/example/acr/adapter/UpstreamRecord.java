package com.example.acr.adapter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Instant;
import java.util.List;

/**
 * Finding as delivered by one of the upstream producers. The {@code kind} property selects the shape.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = UpstreamRecord.RemediationTask.class, name = "remediation-task"),
        @JsonSubTypes.Type(value = UpstreamRecord.RawIssue.class, name = "raw-issue"),
        @JsonSubTypes.Type(value = UpstreamRecord.CriterionRecord.class, name = "criterion-record")
})
public interface UpstreamRecord {

    /** Remediation plan entry; carries its own completion state. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record RemediationTask(
            String issueCode,
            String issueMessage,
            String severity,
            String location,
            @JsonDeserialize(using = CriteriaListDeserializer.class) List<String> wcagCriteria,
            String status,
            Instant completedAt
    ) implements UpstreamRecord {}

    /** Checker output straight from the audit run. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record RawIssue(
            String id,
            String code,
            String severity,
            String message,
            String description,
            String filePath,
            String location
    ) implements UpstreamRecord {}

    /** Issue already tagged with criterion ids by the producer. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record CriterionRecord(
            String code,
            String description,
            String severity,
            String location,
            @JsonDeserialize(using = CriteriaListDeserializer.class) List<String> wcagCriteria
    ) implements UpstreamRecord {}
}
