package com.example.acr.service;

/**
 * Aggregation was requested before every document of the batch finished.
 */
public class IncompleteBatchException extends RuntimeException {

    private final String batchId;
    private final int completed;
    private final int total;

    public IncompleteBatchException(String batchId, int completed, int total) {
        super("Batch %s is incomplete: %d of %d documents finished".formatted(batchId, completed, total));
        this.batchId = batchId;
        this.completed = completed;
        this.total = total;
    }

    public String getBatchId() {
        return batchId;
    }

    public int getCompleted() {
        return completed;
    }

    public int getTotal() {
        return total;
    }
}
