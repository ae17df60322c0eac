package com.example.acr;

import com.example.acr.catalog.CatalogLoader;
import com.example.acr.catalog.CriterionCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;

/**
 * Catalog shipped with the application, loaded once for all tests.
 */
public final class TestCatalogs {

    private static final CriterionCatalog STANDARD =
            CatalogLoader.load(new ClassPathResource("catalog/acr-editions.json"), new ObjectMapper());

    private TestCatalogs() {
    }

    public static CriterionCatalog standard() {
        return STANDARD;
    }
}
