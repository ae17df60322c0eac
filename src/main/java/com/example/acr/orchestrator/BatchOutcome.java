package com.example.acr.orchestrator;

import com.example.acr.model.AcrVersion;
import com.example.acr.model.AggregateReport;

/** Aggregate with per-document detail, and the ACR version stored from it. */
public record BatchOutcome(AggregateReport report, AcrVersion version) {}
