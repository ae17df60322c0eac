package com.example.acr.repository;

import com.example.acr.model.AcrVersion;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage of ACR versions keyed by {@code (acrId, version)}.
 * Stored rows are never updated.
 */
public interface AcrVersionStore {

    /**
     * Inserts the version if its {@code (acrId, version)} key is free.
     *
     * @throws VersionConflictException if the key is already taken
     */
    AcrVersion insert(AcrVersion version);

    /** All versions of the ACR ordered by version number. */
    List<AcrVersion> findAll(String acrId);

    Optional<AcrVersion> find(String acrId, int version);

    Optional<AcrVersion> findLatest(String acrId);

    /** Removes every version of the ACR and returns how many were removed. */
    long deleteAll(String acrId);

    long count(String acrId);
}
