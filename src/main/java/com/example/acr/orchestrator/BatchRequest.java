package com.example.acr.orchestrator;

import com.example.acr.model.AcrEdition;
import com.example.acr.model.AggregationStrategy;
import com.example.acr.model.ProductInfo;

import java.util.List;

/**
 * Input of a batch ACR run, either one aggregate report or one report per document.
 *
 * @param acrId    id of the aggregate report, and the prefix of per-document ids in individual mode
 * @param strategy null selects {@code acr.batch.default-strategy}
 */
public record BatchRequest(
        String batchId,
        String acrId,
        AcrEdition edition,
        ProductInfo productInfo,
        List<Member> members,
        AggregationStrategy strategy
) {
    public BatchRequest {
        members = List.copyOf(members);
        if (edition == null) edition = AcrEdition.RECOMMENDED;
    }

    public long completedCount() {
        return members.stream().filter(Member::completed).count();
    }

    /** ACR id of a member's own report in individual mode. */
    public String acrIdFor(Member member) {
        return acrId + "-" + member.jobId();
    }

    /** One document of the batch and whether its processing has finished. */
    public record Member(String jobId, String fileName, boolean completed) {}
}
