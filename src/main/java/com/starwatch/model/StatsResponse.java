package com.starwatch.model;

import java.util.List;

public record StatsResponse(
    long total,
    long enriched,
    long embedded,
    List<CategoryCount> categories
) {}
