package com.example.acr.catalog;

import com.example.acr.model.SuccessCriterion;

import java.util.List;

/**
 * JSON shape of the criterion catalog resource.
 */
public record CatalogDocument(List<Edition> editions, List<SuccessCriterion> criteria) {

    public record Edition(String code, List<String> criteriaIds) {}
}
