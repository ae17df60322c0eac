package com.example.acr;

import com.example.acr.config.AcrProperties;
import com.example.acr.model.AggregationStrategy;

/**
 * {@link AcrProperties} with the shipped defaults, built without a Spring context.
 */
public final class TestProperties {

    private TestProperties() {
    }

    public static AcrProperties defaults() {
        return withMaxAttempts(5);
    }

    public static AcrProperties withMaxAttempts(int maxAttempts) {
        return new AcrProperties(
                new AcrProperties.Catalog("classpath:catalog/acr-editions.json"),
                AcrProperties.Confidence.defaults(),
                new AcrProperties.Versioning(maxAttempts),
                new AcrProperties.Batch(AggregationStrategy.CONSERVATIVE, 2),
                new AcrProperties.Mongo("mongodb://localhost:27017/acr-test"));
    }
}
