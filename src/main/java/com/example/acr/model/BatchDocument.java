package com.example.acr.model;

/**
 * One finished document of a batch together with its analysis.
 */
public record BatchDocument(String jobId, String fileName, AcrAnalysis analysis) {}
