package com.example.acr.config;

import com.example.acr.catalog.CatalogLoader;
import com.example.acr.catalog.CriterionCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans of the conformance core.
 */
@Configuration
public class AcrConfig {

    /**
     * Fixed pool for the per-document fan-out of batch runs.
     */
    @Bean(name = "batchExecutor", destroyMethod = "shutdown")
    public ExecutorService batchExecutor(AcrProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "acr-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.batch().parallelism()), threads);
    }

    /**
     * ObjectMapper shared for catalog and upstream JSON.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Criterion catalog, loaded once. A missing or malformed catalog fails startup.
     */
    @Bean
    public CriterionCatalog criterionCatalog(AcrProperties properties, ResourceLoader resourceLoader,
                                             ObjectMapper objectMapper) {
        return CatalogLoader.load(resourceLoader.getResource(properties.catalog().location()), objectMapper);
    }
}
