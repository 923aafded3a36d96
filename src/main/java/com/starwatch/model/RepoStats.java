package com.starwatch.model;

public record RepoStats(
    long total,
    long enriched,
    long embedded
) {}
