package com.example.acr.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;

/**
 * Database factory built from {@code acr.mongo.uri}; the database name comes from the URI path.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoDatabaseFactory mongoDatabaseFactory(AcrProperties properties) {
        return new SimpleMongoClientDatabaseFactory(properties.mongo().uri());
    }
}
