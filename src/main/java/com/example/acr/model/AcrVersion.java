package com.example.acr.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Immutable version of an ACR, stored in the {@code acr_versions} collection.
 * {@code (acrId, version)} is unique; version numbers of one ACR run 1..N without gaps.
 */
@Document(collection = "acr_versions")
@CompoundIndex(name = AcrVersion.UNIQUE_INDEX, def = "{'acrId': 1, 'version': 1}", unique = true)
public record AcrVersion(
        @Id String id,
        String acrId,
        int version,
        Instant createdAt,
        String createdBy,
        List<ChangeLogEntry> changeLog,
        AcrDocument snapshot
) {
    public static final String UNIQUE_INDEX = "acr_version_unique";

    public AcrVersion {
        changeLog = changeLog != null ? List.copyOf(changeLog) : List.of();
    }
}
