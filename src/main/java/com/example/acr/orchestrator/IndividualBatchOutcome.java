package com.example.acr.orchestrator;

import com.example.acr.model.AcrVersion;

import java.util.List;

/**
 * Result of an individual-mode batch run: one stored ACR per document that made it through,
 * plus the documents that did not.
 */
public record IndividualBatchOutcome(String batchId, List<AcrVersion> versions, List<FailedDocument> failures) {

    public IndividualBatchOutcome {
        versions = List.copyOf(versions);
        failures = List.copyOf(failures);
    }

    public String message() {
        return failures.isEmpty()
                ? "Created %d ACRs".formatted(versions.size())
                : "Created %d ACRs (%d failed)".formatted(versions.size(), failures.size());
    }

    public record FailedDocument(String jobId, String fileName, String error) {}
}
