package com.starwatch.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
