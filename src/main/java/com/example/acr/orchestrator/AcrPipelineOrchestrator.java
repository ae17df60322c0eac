package com.example.acr.orchestrator;

import com.example.acr.adapter.AdaptedFindings;
import com.example.acr.adapter.UpstreamIssueAdapter;
import com.example.acr.config.AcrProperties;
import com.example.acr.model.AcrAnalysis;
import com.example.acr.model.AcrDocument;
import com.example.acr.model.AcrVersion;
import com.example.acr.model.AggregateReport;
import com.example.acr.model.AggregationStrategy;
import com.example.acr.model.BatchDocument;
import com.example.acr.service.AcrDocumentAssembler;
import com.example.acr.service.AcrVersioningService;
import com.example.acr.service.BatchAggregator;
import com.example.acr.service.BatchProcessingException;
import com.example.acr.service.ConformanceEvaluator;
import com.example.acr.service.IncompleteBatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * ACR pipelines.
 * <p>
 * Single document:
 * 1. Adapt upstream records
 * 2. Evaluate the edition criteria
 * 3. Assemble and attribute the ACR
 * 4. Store a new version
 * <p>
 * Batch:
 * 1. Check every member finished
 * 2. Fetch and evaluate all members in parallel, waiting for all of them
 * 3. Aggregate with the chosen strategy
 * 4. Assemble and store a new version
 * <p>
 * Batch, individual mode: every finished member runs the single document pipeline on its own
 * ACR. Failures are collected; the run only fails when no ACR could be created.
 */
@Service
public class AcrPipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AcrPipelineOrchestrator.class);

    private final UpstreamIssueAdapter adapter;
    private final ConformanceEvaluator evaluator;
    private final BatchAggregator aggregator;
    private final AcrDocumentAssembler assembler;
    private final AcrVersioningService versioning;
    private final ExecutorService batchExecutor;
    private final AggregationStrategy defaultStrategy;

    public AcrPipelineOrchestrator(UpstreamIssueAdapter adapter,
                                   ConformanceEvaluator evaluator,
                                   BatchAggregator aggregator,
                                   AcrDocumentAssembler assembler,
                                   AcrVersioningService versioning,
                                   @Qualifier("batchExecutor") ExecutorService batchExecutor,
                                   AcrProperties properties) {
        this.adapter = adapter;
        this.evaluator = evaluator;
        this.aggregator = aggregator;
        this.assembler = assembler;
        this.versioning = versioning;
        this.batchExecutor = batchExecutor;
        this.defaultStrategy = properties.batch().defaultStrategy();
    }

    public AcrVersion analyzeDocument(DocumentSubmission submission, String author) {
        log.info("Starting ACR pipeline for document {} (ACR {})", submission.jobId(), submission.acrId());

        // ── Step 1: Adapt upstream records ──
        log.info("[1/4] Adapting {} upstream records...", submission.records().size());
        AdaptedFindings findings = adapter.adapt(submission.records());
        log.info("[1/4] {} issues, {} remediation records",
                findings.issues().size(), findings.remediations().size());

        // ── Step 2: Evaluation ──
        log.info("[2/4] Evaluating criteria...");
        AcrAnalysis analysis = evaluator.evaluate(submission.jobId(), submission.editionCode(),
                findings.issues(), findings.remediations());
        log.info("[2/4] {} criteria evaluated, overall confidence {}%",
                analysis.criteria().size(), analysis.overallConfidence());

        // ── Step 3: Assembly and attribution ──
        log.info("[3/4] Assembling ACR...");
        AcrDocument document = assembler.assemble(submission.acrId(), analysis,
                submission.productInfo(), submission.verifications());

        // ── Step 4: Versioning ──
        log.info("[4/4] Storing version...");
        AcrVersion version = versioning.createVersion(submission.acrId(), author, document,
                "Generated from document " + submission.jobId());
        log.info("[4/4] ACR {} is at version {}", submission.acrId(), version.version());
        return version;
    }

    /**
     * Builds and stores the aggregate ACR of a batch.
     *
     * @throws IncompleteBatchException if any member has not finished
     * @throws BatchProcessingException if fetching or evaluating any member fails
     */
    public BatchOutcome aggregateBatch(BatchRequest request, DocumentFindingsSource source, String author) {
        AggregationStrategy strategy = request.strategy() != null ? request.strategy() : defaultStrategy;
        int total = request.members().size();
        log.info("Starting batch ACR pipeline for batch {} ({} documents, {})", request.batchId(), total, strategy);

        // ── Step 1: Completion check ──
        int completed = (int) request.completedCount();
        if (completed < total) {
            throw new IncompleteBatchException(request.batchId(), completed, total);
        }
        log.info("[1/4] All {} documents finished", total);

        // ── Step 2: Parallel fetch and evaluation ──
        log.info("[2/4] Evaluating {} documents in parallel...", total);
        List<CompletableFuture<BatchDocument>> futures = new ArrayList<>(total);
        for (BatchRequest.Member member : request.members()) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> evaluateMember(request, member, source), batchExecutor));
        }

        List<BatchDocument> documents = new ArrayList<>(total);
        for (int i = 0; i < futures.size(); i++) {
            try {
                documents.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof BatchProcessingException bpe) {
                    throw bpe;
                }
                throw new BatchProcessingException(request.batchId(), request.members().get(i).jobId(), cause);
            }
        }
        log.info("[2/4] {} documents evaluated", documents.size());

        // ── Step 3: Aggregation ──
        log.info("[3/4] Aggregating...");
        AggregateReport report = aggregator.aggregate(request.batchId(), total, documents, strategy);

        // ── Step 4: Assembly and versioning ──
        log.info("[4/4] Storing aggregate ACR {}...", request.acrId());
        AcrDocument document = assembler.assembleAggregate(request.acrId(), report, request.edition(),
                request.productInfo());
        AcrVersion version = versioning.createVersion(request.acrId(), author, document,
                "Aggregated from batch " + request.batchId());
        log.info("[4/4] ACR {} is at version {}", request.acrId(), version.version());
        return new BatchOutcome(report, version);
    }

    /**
     * Stores one ACR per finished member of the batch, each under {@link BatchRequest#acrIdFor}.
     * Unfinished members are skipped.
     *
     * @throws IncompleteBatchException if no member has finished
     * @throws BatchProcessingException if every finished member failed; further failures are suppressed on it
     */
    public IndividualBatchOutcome generateIndividualAcrs(BatchRequest request, DocumentFindingsSource source,
                                                         String author) {
        List<BatchRequest.Member> finished = request.members().stream()
                .filter(BatchRequest.Member::completed)
                .toList();
        log.info("Generating individual ACRs for batch {} ({} of {} documents finished)",
                request.batchId(), finished.size(), request.members().size());
        if (finished.isEmpty()) {
            throw new IncompleteBatchException(request.batchId(), 0, request.members().size());
        }

        List<CompletableFuture<AcrVersion>> futures = new ArrayList<>(finished.size());
        for (BatchRequest.Member member : finished) {
            futures.add(CompletableFuture.supplyAsync(() -> analyzeDocument(new DocumentSubmission(
                    request.acrIdFor(member), member.jobId(), request.edition().code(), request.productInfo(),
                    source.fetch(member.jobId()), Map.of()), author), batchExecutor));
        }

        List<AcrVersion> versions = new ArrayList<>();
        List<IndividualBatchOutcome.FailedDocument> failures = new ArrayList<>();
        List<Throwable> causes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            BatchRequest.Member member = finished.get(i);
            try {
                versions.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Batch {}: failed to create ACR for {}: {}", request.batchId(), member.fileName(),
                        cause.getMessage());
                failures.add(new IndividualBatchOutcome.FailedDocument(member.jobId(), member.fileName(),
                        String.valueOf(cause.getMessage())));
                causes.add(cause);
            }
        }

        if (versions.isEmpty()) {
            BatchProcessingException failure = new BatchProcessingException(request.batchId(),
                    failures.get(0).jobId(), causes.get(0));
            causes.subList(1, causes.size()).forEach(failure::addSuppressed);
            throw failure;
        }

        IndividualBatchOutcome outcome = new IndividualBatchOutcome(request.batchId(), versions, failures);
        log.info("Batch {}: {}", request.batchId(), outcome.message());
        return outcome;
    }

    private BatchDocument evaluateMember(BatchRequest request, BatchRequest.Member member,
                                         DocumentFindingsSource source) {
        try {
            AdaptedFindings findings = adapter.adapt(source.fetch(member.jobId()));
            AcrAnalysis analysis = evaluator.evaluate(member.jobId(), request.edition().code(),
                    findings.issues(), findings.remediations());
            return new BatchDocument(member.jobId(), member.fileName(), analysis);
        } catch (RuntimeException e) {
            log.error("Batch {}: document {} failed: {}", request.batchId(), member.jobId(), e.getMessage());
            throw new BatchProcessingException(request.batchId(), member.jobId(), e);
        }
    }
}
