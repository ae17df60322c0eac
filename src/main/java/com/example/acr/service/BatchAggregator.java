package com.example.acr.service;

import com.example.acr.model.AggregateCriterion;
import com.example.acr.model.AggregateReport;
import com.example.acr.model.AggregationStrategy;
import com.example.acr.model.BatchDocument;
import com.example.acr.model.ConformanceLevel;
import com.example.acr.model.CriterionAnalysis;
import com.example.acr.model.DocumentDetail;
import com.example.acr.model.IssueSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rolls the analyses of all documents in a batch into one verdict per criterion.
 * <p>
 * A document without an entry for a criterion counts as {@code Supports} with no issues.
 */
@Service
public class BatchAggregator {

    private static final Logger log = LoggerFactory.getLogger(BatchAggregator.class);

    /** Issue messages listed per document in composite remarks. */
    static final int ISSUES_PER_DOCUMENT = 3;

    /**
     * Aggregates a complete batch.
     *
     * @param expectedDocuments number of documents the batch was submitted with
     * @throws IncompleteBatchException if fewer documents than expected are supplied
     * @throws IllegalArgumentException if the batch is empty
     */
    public AggregateReport aggregate(String batchId, int expectedDocuments, List<BatchDocument> documents,
                                     AggregationStrategy strategy) {
        if (documents.size() < expectedDocuments) {
            throw new IncompleteBatchException(batchId, documents.size(), expectedDocuments);
        }
        if (documents.isEmpty()) {
            throw new IllegalArgumentException("Batch " + batchId + " has no documents to aggregate");
        }

        log.info("Aggregating batch {}: {} documents, strategy {}", batchId, documents.size(), strategy);

        // first-seen order across documents
        Map<String, CriterionAnalysis> firstSeen = new LinkedHashMap<>();
        List<Map<String, CriterionAnalysis>> byDocument = new ArrayList<>(documents.size());
        for (BatchDocument document : documents) {
            Map<String, CriterionAnalysis> index = new LinkedHashMap<>();
            for (CriterionAnalysis criterion : document.analysis().criteria()) {
                index.put(criterion.criterionId(), criterion);
                firstSeen.putIfAbsent(criterion.criterionId(), criterion);
            }
            byDocument.add(index);
        }

        List<AggregateCriterion> criteria = new ArrayList<>(firstSeen.size());
        for (CriterionAnalysis reference : firstSeen.values()) {
            String criterionId = reference.criterionId();
            List<DocumentDetail> details = new ArrayList<>(documents.size());
            for (int i = 0; i < documents.size(); i++) {
                details.add(detail(documents.get(i), byDocument.get(i).get(criterionId)));
            }
            ConformanceLevel composite = aggregateConformance(details, strategy);
            criteria.add(new AggregateCriterion(criterionId, reference.name(), reference.level(),
                    details, composite, compositeRemarks(criterionId, details)));
        }

        List<AggregateReport.DocumentRef> refs = documents.stream()
                .map(d -> new AggregateReport.DocumentRef(d.jobId(), d.fileName()))
                .toList();

        log.info("Batch {}: {} aggregate criteria", batchId, criteria.size());
        return new AggregateReport(batchId, strategy, documents.size(), refs, criteria);
    }

    public ConformanceLevel aggregateConformance(List<DocumentDetail> details, AggregationStrategy strategy) {
        return switch (strategy) {
            case CONSERVATIVE -> conservative(details);
            case OPTIMISTIC -> optimistic(details);
        };
    }

    static ConformanceLevel conservative(List<DocumentDetail> details) {
        if (allNotApplicable(details)) return ConformanceLevel.NOT_APPLICABLE;
        if (anyWithStatus(details, ConformanceLevel.DOES_NOT_SUPPORT)) return ConformanceLevel.DOES_NOT_SUPPORT;
        if (anyWithStatus(details, ConformanceLevel.PARTIALLY_SUPPORTS)) return ConformanceLevel.PARTIALLY_SUPPORTS;
        return ConformanceLevel.SUPPORTS;
    }

    static ConformanceLevel optimistic(List<DocumentDetail> details) {
        if (allNotApplicable(details)) return ConformanceLevel.NOT_APPLICABLE;
        long supports = supportsCount(details);
        if (supports == details.size()) return ConformanceLevel.SUPPORTS;
        if (supports * 2 >= details.size()) return ConformanceLevel.PARTIALLY_SUPPORTS;
        return ConformanceLevel.DOES_NOT_SUPPORT;
    }

    /**
     * Remarks such as {@code 2 of 3 documents (67%) fully support criterion 1.1.1.} followed by
     * the documents that need attention and up to three of their issues.
     */
    String compositeRemarks(String criterionId, List<DocumentDetail> details) {
        long supports = supportsCount(details);
        int total = details.size();
        long percentage = total == 0 ? 0 : Math.round(supports * 100.0 / total);

        StringBuilder remarks = new StringBuilder("%d of %d documents (%d%%) fully support criterion %s."
                .formatted(supports, total, percentage, criterionId));

        List<DocumentDetail> attention = details.stream().filter(DocumentDetail::needsAttention).toList();
        if (!attention.isEmpty()) {
            remarks.append("\n\nDocuments requiring attention:\n");
            for (DocumentDetail detail : attention) {
                remarks.append("\n- \"%s\" (%d issue%s)\n".formatted(
                        detail.fileName(), detail.issueCount(), detail.issueCount() == 1 ? "" : "s"));
                detail.issues().stream()
                        .limit(ISSUES_PER_DOCUMENT)
                        .forEach(issue -> remarks.append("  • ").append(issue.message()).append('\n'));
                if (detail.issues().size() > ISSUES_PER_DOCUMENT) {
                    remarks.append("  • ... and %d more\n".formatted(detail.issues().size() - ISSUES_PER_DOCUMENT));
                }
            }
        }
        return remarks.toString().strip();
    }

    private static DocumentDetail detail(BatchDocument document, CriterionAnalysis analysis) {
        if (analysis == null) {
            return new DocumentDetail(document.fileName(), document.jobId(), ConformanceLevel.SUPPORTS, 0, List.of());
        }
        List<IssueSummary> issues = analysis.remainingIssues().stream().map(IssueSummary::of).toList();
        return new DocumentDetail(document.fileName(), document.jobId(),
                analysis.status().toConformanceLevel(), analysis.remainingCount(), issues);
    }

    private static boolean allNotApplicable(List<DocumentDetail> details) {
        return details.stream().allMatch(d -> d.status() == ConformanceLevel.NOT_APPLICABLE);
    }

    private static boolean anyWithStatus(List<DocumentDetail> details, ConformanceLevel level) {
        return details.stream().anyMatch(d -> d.status() == level);
    }

    private static long supportsCount(List<DocumentDetail> details) {
        return details.stream().filter(d -> d.status() == ConformanceLevel.SUPPORTS).count();
    }
}
