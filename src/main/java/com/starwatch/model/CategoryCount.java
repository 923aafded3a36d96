package com.starwatch.model;

public record CategoryCount(
    String category,
    long count
) {}
