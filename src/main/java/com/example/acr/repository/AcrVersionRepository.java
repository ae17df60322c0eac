package com.example.acr.repository;

import com.example.acr.model.AcrVersion;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AcrVersionRepository extends MongoRepository<AcrVersion, String> {

    List<AcrVersion> findByAcrIdOrderByVersionAsc(String acrId);

    Optional<AcrVersion> findByAcrIdAndVersion(String acrId, int version);

    Optional<AcrVersion> findFirstByAcrIdOrderByVersionDesc(String acrId);

    long deleteByAcrId(String acrId);

    long countByAcrId(String acrId);
}
