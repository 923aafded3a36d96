package com.starwatch.model;

/**
 * A vector tagged with the position of its input text inside the request that produced it.
 */
public record IndexedEmbedding(
    int index,
    float[] vector
) {}
