package com.example.acr.orchestrator;

import com.example.acr.adapter.UpstreamRecord;
import com.example.acr.model.CriterionVerification;
import com.example.acr.model.ProductInfo;

import java.util.List;
import java.util.Map;

/**
 * Input of a single-document ACR run.
 *
 * @param editionCode   requested edition, unknown codes fall back to the A + AA baseline
 * @param verifications review state per criterion id, may be empty
 */
public record DocumentSubmission(
        String acrId,
        String jobId,
        String editionCode,
        ProductInfo productInfo,
        List<UpstreamRecord> records,
        Map<String, CriterionVerification> verifications
) {
    public DocumentSubmission {
        records = records != null ? List.copyOf(records) : List.of();
        verifications = verifications != null ? Map.copyOf(verifications) : Map.of();
    }
}
