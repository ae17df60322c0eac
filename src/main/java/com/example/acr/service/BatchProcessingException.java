package com.example.acr.service;

/**
 * A batch run failed because one of its documents could not be fetched or evaluated.
 * The whole run is aborted; no partial aggregate is produced.
 */
public class BatchProcessingException extends RuntimeException {

    private final String batchId;
    private final String jobId;

    public BatchProcessingException(String batchId, String jobId, Throwable cause) {
        super("Batch %s failed on document %s: %s".formatted(batchId, jobId, cause.getMessage()), cause);
        this.batchId = batchId;
        this.jobId = jobId;
    }

    public String getBatchId() {
        return batchId;
    }

    public String getJobId() {
        return jobId;
    }
}
