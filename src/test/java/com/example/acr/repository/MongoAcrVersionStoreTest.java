package com.example.acr.repository;

import com.example.acr.TestDocuments;
import com.example.acr.model.AcrVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoAcrVersionStoreTest {

    @Mock private AcrVersionRepository repository;
    @Mock private MongoOperations mongoOperations;
    @Mock private IndexOperations indexOperations;

    private MongoAcrVersionStore store;

    private final AcrVersion version = new AcrVersion("id-1", "acr-1", 1, Instant.parse("2026-01-01T00:00:00Z"),
            "alice", List.of(), TestDocuments.sample("acr-1").withVersion(1));

    @BeforeEach
    void setUp() {
        store = new MongoAcrVersionStore(repository, mongoOperations);
    }

    @Test
    @DisplayName("ensures the unique (acrId, version) index")
    void ensuresIndex() {
        when(mongoOperations.indexOps(AcrVersion.class)).thenReturn(indexOperations);

        store.ensureIndexes();

        ArgumentCaptor<Index> index = ArgumentCaptor.forClass(Index.class);
        verify(indexOperations).ensureIndex(index.capture());
        assertThat(index.getValue().getIndexKeys().keySet()).containsExactly("acrId", "version");
        assertThat(index.getValue().getIndexOptions().getBoolean("unique")).isTrue();
        assertThat(index.getValue().getIndexOptions().getString("name")).isEqualTo(AcrVersion.UNIQUE_INDEX);
    }

    @Test
    @DisplayName("inserts new versions")
    void insert() {
        when(repository.insert(version)).thenReturn(version);

        assertThat(store.insert(version)).isSameAs(version);
    }

    @Test
    @DisplayName("duplicate keys become version conflicts")
    void duplicateKey() {
        DuplicateKeyException duplicate = new DuplicateKeyException("E11000 duplicate key");
        when(repository.insert(version)).thenThrow(duplicate);

        assertThatThrownBy(() -> store.insert(version))
                .isInstanceOfSatisfying(VersionConflictException.class, e -> {
                    assertThat(e.getAcrId()).isEqualTo("acr-1");
                    assertThat(e.getVersion()).isEqualTo(1);
                    assertThat(e.getCause()).isSameAs(duplicate);
                });
    }

    @Test
    @DisplayName("reads delegate to the derived queries")
    void reads() {
        when(repository.findByAcrIdOrderByVersionAsc("acr-1")).thenReturn(List.of(version));
        when(repository.findByAcrIdAndVersion("acr-1", 1)).thenReturn(Optional.of(version));
        when(repository.findFirstByAcrIdOrderByVersionDesc("acr-1")).thenReturn(Optional.of(version));
        when(repository.countByAcrId("acr-1")).thenReturn(1L);
        when(repository.deleteByAcrId("acr-1")).thenReturn(1L);

        assertThat(store.findAll("acr-1")).containsExactly(version);
        assertThat(store.find("acr-1", 1)).contains(version);
        assertThat(store.findLatest("acr-1")).contains(version);
        assertThat(store.count("acr-1")).isEqualTo(1);
        assertThat(store.deleteAll("acr-1")).isEqualTo(1);
    }
}
