package com.example.acr.catalog;

import com.example.acr.model.SuccessCriterion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only catalog of success criteria, keyed by edition.
 * <p>
 * An edition code the catalog does not know selects the A + AA baseline instead of failing.
 * A known edition with no criteria yields an empty list.
 */
public final class CriterionCatalog {

    private final Map<String, SuccessCriterion> criteriaById;
    private final Map<String, List<SuccessCriterion>> criteriaByEdition;
    private final List<SuccessCriterion> baseline;

    private CriterionCatalog(Map<String, SuccessCriterion> criteriaById,
                             Map<String, List<SuccessCriterion>> criteriaByEdition) {
        this.criteriaById = Collections.unmodifiableMap(criteriaById);
        this.criteriaByEdition = Collections.unmodifiableMap(criteriaByEdition);
        this.baseline = criteriaById.values().stream()
                .filter(c -> c.level() != null && c.level().isBaseline())
                .toList();
    }

    /**
     * Builds the catalog, checking that criterion ids are unique and that every
     * edition only references known criteria.
     */
    public static CriterionCatalog of(CatalogDocument document) {
        if (document == null || document.criteria() == null) {
            throw new CatalogLoadException("Catalog has no criteria section");
        }
        Map<String, SuccessCriterion> byId = new LinkedHashMap<>();
        for (SuccessCriterion criterion : document.criteria()) {
            if (criterion.id() == null || criterion.id().isBlank()) {
                throw new CatalogLoadException("Catalog criterion without id: " + criterion);
            }
            if (byId.putIfAbsent(criterion.id(), criterion) != null) {
                throw new CatalogLoadException("Duplicate criterion id in catalog: " + criterion.id());
            }
        }

        Map<String, List<SuccessCriterion>> byEdition = new LinkedHashMap<>();
        List<CatalogDocument.Edition> editions = document.editions() != null ? document.editions() : List.of();
        for (CatalogDocument.Edition edition : editions) {
            List<String> ids = edition.criteriaIds() != null ? edition.criteriaIds() : List.of();
            List<SuccessCriterion> resolved = ids.stream()
                    .distinct()
                    .map(id -> {
                        SuccessCriterion c = byId.get(id);
                        if (c == null) {
                            throw new CatalogLoadException(
                                    "Edition %s references unknown criterion %s".formatted(edition.code(), id));
                        }
                        return c;
                    })
                    .toList();
            byEdition.put(edition.code(), resolved);
        }
        return new CriterionCatalog(byId, byEdition);
    }

    public List<SuccessCriterion> criteriaForEdition(String editionCode) {
        if (editionCode == null) return baseline;
        return criteriaByEdition.getOrDefault(editionCode, baseline);
    }

    public boolean isKnownEdition(String editionCode) {
        return editionCode != null && criteriaByEdition.containsKey(editionCode);
    }

    public Optional<SuccessCriterion> find(String criterionId) {
        return Optional.ofNullable(criteriaById.get(criterionId));
    }

    public List<SuccessCriterion> all() {
        return List.copyOf(criteriaById.values());
    }

    public Set<String> editionCodes() {
        return criteriaByEdition.keySet();
    }
}
