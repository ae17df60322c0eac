package com.example.acr.config;

import com.example.acr.model.AggregationStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the conformance core.
 */
@ConfigurationProperties(prefix = "acr")
public record AcrProperties(
        @DefaultValue Catalog catalog,
        @DefaultValue Confidence confidence,
        @DefaultValue Versioning versioning,
        @DefaultValue Batch batch,
        @DefaultValue Mongo mongo
) {

    /**
     * @param location Spring resource location of the criterion catalog JSON
     */
    public record Catalog(@DefaultValue("classpath:catalog/acr-editions.json") String location) {}

    /**
     * Heuristic confidence constants (0-100) attached to each classification outcome.
     * They are placeholders without measured accuracy behind them.
     *
     * @param noIssues            no related issue detected
     * @param allRemediated       every related issue fixed
     * @param critical            a critical issue remains
     * @param serious             a serious issue remains
     * @param moderate            a moderate issue remains
     * @param unknown             an issue of unknown severity remains
     * @param minor               only minor issues remain
     * @param remediationBonusMax upper bound of the document-level remediation bonus
     */
    public record Confidence(
            @DefaultValue("75") int noIssues,
            @DefaultValue("95") int allRemediated,
            @DefaultValue("90") int critical,
            @DefaultValue("80") int serious,
            @DefaultValue("70") int moderate,
            @DefaultValue("60") int unknown,
            @DefaultValue("85") int minor,
            @DefaultValue("15") int remediationBonusMax
    ) {
        public static Confidence defaults() {
            return new Confidence(75, 95, 90, 80, 70, 60, 85, 15);
        }
    }

    /**
     * @param maxAttempts version allocation attempts before a conflict is reported to the caller
     */
    public record Versioning(@DefaultValue("5") int maxAttempts) {}

    /**
     * @param defaultStrategy strategy used when a batch request names none
     * @param parallelism     threads used to fetch and evaluate batch documents
     */
    public record Batch(
            @DefaultValue("CONSERVATIVE") AggregationStrategy defaultStrategy,
            @DefaultValue("4") int parallelism
    ) {}

    /**
     * @param uri MongoDB connection string, including the database name
     */
    public record Mongo(@DefaultValue("mongodb://localhost:27017/acr") String uri) {}
}
