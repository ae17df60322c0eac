package com.example.acr.orchestrator;

import com.example.acr.adapter.UpstreamRecord;

import java.util.List;

/**
 * Supplies the upstream findings of a finished document. Implementations may block on I/O;
 * timeouts and retries are theirs to handle. A thrown exception fails an aggregate batch;
 * in individual mode it only fails that document.
 */
@FunctionalInterface
public interface DocumentFindingsSource {

    List<UpstreamRecord> fetch(String jobId);
}
