package com.example.acr.service;

import com.example.acr.config.AcrProperties;
import com.example.acr.model.AcrDocument;
import com.example.acr.model.AcrVersion;
import com.example.acr.model.ChangeLogEntry;
import com.example.acr.model.VersionComparison;
import com.example.acr.repository.AcrVersionStore;
import com.example.acr.repository.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only version history of ACR documents.
 * <p>
 * The next number is read from the store and claimed through its unique
 * {@code (acrId, version)} key. A writer that loses the race re-reads and tries again,
 * up to {@code acr.versioning.max-attempts} times.
 */
@Service
public class AcrVersioningService {

    private static final Logger log = LoggerFactory.getLogger(AcrVersioningService.class);

    private final AcrVersionStore store;
    private final ChangeLogGenerator changeLogGenerator;
    private final Clock clock;
    private final int maxAttempts;

    public AcrVersioningService(AcrVersionStore store, ChangeLogGenerator changeLogGenerator,
                                Clock clock, AcrProperties properties) {
        this.store = store;
        this.changeLogGenerator = changeLogGenerator;
        this.clock = clock;
        this.maxAttempts = Math.max(1, properties.versioning().maxAttempts());
    }

    /**
     * Stores the snapshot as the next version of the ACR.
     *
     * @param reason optional reason recorded on every change entry
     * @throws VersionConflictException if every attempt lost the race for a version number
     */
    public AcrVersion createVersion(String acrId, String author, AcrDocument snapshot, String reason) {
        Objects.requireNonNull(acrId, "acrId");
        Objects.requireNonNull(snapshot, "snapshot");

        VersionConflictException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<AcrVersion> previous = store.findLatest(acrId);
            int next = previous.map(v -> v.version() + 1).orElse(1);
            List<ChangeLogEntry> changeLog = changeLogGenerator.generate(
                    previous.map(AcrVersion::snapshot).orElse(null), snapshot, reason);

            AcrVersion version = new AcrVersion(UUID.randomUUID().toString(), acrId, next,
                    Instant.now(clock), author, changeLog, snapshot.withVersion(next));
            try {
                AcrVersion stored = store.insert(version);
                log.info("ACR {}: stored version {} by {} ({} change(s))", acrId, next, author, changeLog.size());
                return stored;
            } catch (VersionConflictException e) {
                lastConflict = e;
                log.warn("ACR {}: version {} taken by a concurrent writer, attempt {}/{}",
                        acrId, next, attempt, maxAttempts);
            }
        }
        throw lastConflict;
    }

    public List<AcrVersion> getVersions(String acrId) {
        return store.findAll(acrId);
    }

    public Optional<AcrVersion> getVersion(String acrId, int version) {
        return store.find(acrId, version);
    }

    public Optional<AcrVersion> getLatestVersion(String acrId) {
        return store.findLatest(acrId);
    }

    public long getVersionCount(String acrId) {
        return store.count(acrId);
    }

    /**
     * Diffs two stored versions, in either order. Empty if either version does not exist.
     */
    public Optional<VersionComparison> compareVersions(String acrId, int versionA, int versionB) {
        Optional<AcrVersion> a = store.find(acrId, versionA);
        Optional<AcrVersion> b = store.find(acrId, versionB);
        if (a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }

        List<ChangeLogEntry> changes = changeLogGenerator.generate(a.get().snapshot(), b.get().snapshot(), null);
        int criteriaChanged = (int) changes.stream()
                .map(c -> ChangeLogGenerator.criterionIdOf(c.field()))
                .filter(Objects::nonNull)
                .distinct()
                .count();
        boolean statusChanged = changes.stream().anyMatch(c -> "status".equals(c.field()));

        return Optional.of(new VersionComparison(acrId, versionA, versionB, changes,
                new VersionComparison.Summary(changes.size(), criteriaChanged, statusChanged)));
    }

    /**
     * Administrative purge of the whole history of an ACR.
     *
     * @return true if any version was removed
     */
    public boolean deleteVersions(String acrId) {
        long removed = store.deleteAll(acrId);
        log.warn("ACR {}: version history purged ({} version(s))", acrId, removed);
        return removed > 0;
    }
}
