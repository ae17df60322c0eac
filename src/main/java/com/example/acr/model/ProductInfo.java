package com.example.acr.model;

import java.time.Instant;

/**
 * Product section of an ACR.
 */
public record ProductInfo(
        String name,
        String version,
        String description,
        String vendor,
        String contactEmail,
        Instant evaluationDate
) {}
