package com.example.acr.model;

import java.util.List;

/**
 * How the conformance claims were established.
 */
public record EvaluationMethod(
        Type type,
        List<String> tools,
        List<String> aiModels,
        String description
) {
    public enum Type {
        AUTOMATED, MANUAL, HYBRID
    }

    public EvaluationMethod {
        tools = tools != null ? List.copyOf(tools) : List.of();
        aiModels = aiModels != null ? List.copyOf(aiModels) : List.of();
    }
}
