package com.example.acr.repository;

import com.example.acr.model.AcrVersion;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * {@link AcrVersionStore} on the {@code acr_versions} collection. The unique
 * {@code (acrId, version)} index turns concurrent allocations of the same number
 * into a {@link VersionConflictException}.
 */
@Component
public class MongoAcrVersionStore implements AcrVersionStore {

    private static final Logger log = LoggerFactory.getLogger(MongoAcrVersionStore.class);

    private final AcrVersionRepository repository;
    private final MongoOperations mongoOperations;

    public MongoAcrVersionStore(AcrVersionRepository repository, MongoOperations mongoOperations) {
        this.repository = repository;
        this.mongoOperations = mongoOperations;
    }

    @PostConstruct
    void ensureIndexes() {
        mongoOperations.indexOps(AcrVersion.class).ensureIndex(new Index()
                .on("acrId", Sort.Direction.ASC)
                .on("version", Sort.Direction.ASC)
                .unique()
                .named(AcrVersion.UNIQUE_INDEX));
        log.info("Ensured unique index {} on acr_versions", AcrVersion.UNIQUE_INDEX);
    }

    @Override
    public AcrVersion insert(AcrVersion version) {
        try {
            return repository.insert(version);
        } catch (DuplicateKeyException e) {
            throw new VersionConflictException(version.acrId(), version.version(), e);
        }
    }

    @Override
    public List<AcrVersion> findAll(String acrId) {
        return repository.findByAcrIdOrderByVersionAsc(acrId);
    }

    @Override
    public Optional<AcrVersion> find(String acrId, int version) {
        return repository.findByAcrIdAndVersion(acrId, version);
    }

    @Override
    public Optional<AcrVersion> findLatest(String acrId) {
        return repository.findFirstByAcrIdOrderByVersionDesc(acrId);
    }

    @Override
    public long deleteAll(String acrId) {
        long removed = repository.deleteByAcrId(acrId);
        log.info("Purged {} version(s) of ACR {}", removed, acrId);
        return removed;
    }

    @Override
    public long count(String acrId) {
        return repository.countByAcrId(acrId);
    }
}
