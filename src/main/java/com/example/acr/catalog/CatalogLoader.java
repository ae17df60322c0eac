package com.example.acr.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the criterion catalog JSON once at startup.
 */
public final class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private CatalogLoader() {
        // utility class
    }

    public static CriterionCatalog load(Resource resource, ObjectMapper objectMapper) {
        if (resource == null || !resource.exists()) {
            throw new CatalogLoadException("Criterion catalog not found: " + resource);
        }
        try (InputStream in = resource.getInputStream()) {
            CriterionCatalog catalog = load(in, objectMapper);
            log.info("Loaded criterion catalog from {}: {} criteria, editions {}",
                    resource.getDescription(), catalog.all().size(), catalog.editionCodes());
            return catalog;
        } catch (IOException e) {
            throw new CatalogLoadException("Unable to read criterion catalog " + resource.getDescription(), e);
        }
    }

    public static CriterionCatalog load(InputStream in, ObjectMapper objectMapper) throws IOException {
        CatalogDocument document = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .readValue(in, CatalogDocument.class);
        return CriterionCatalog.of(document);
    }
}
