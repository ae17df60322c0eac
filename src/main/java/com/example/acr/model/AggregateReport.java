package com.example.acr.model;

import java.util.List;

/**
 * Composite conformance of a batch.
 *
 * @param documents documents the aggregate was computed from, in input order
 */
public record AggregateReport(
        String batchId,
        AggregationStrategy strategy,
        int totalDocuments,
        List<DocumentRef> documents,
        List<AggregateCriterion> criteria
) {
    public AggregateReport {
        documents = List.copyOf(documents);
        criteria = List.copyOf(criteria);
    }

    public record DocumentRef(String jobId, String fileName) {}
}
