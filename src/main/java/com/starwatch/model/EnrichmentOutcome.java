package com.starwatch.model;

public record EnrichmentOutcome(
    int attempted,
    int enriched,
    int failed
) {}
