package com.starwatch.service;

import com.starwatch.model.IndexedEmbedding;

import java.util.List;

public interface EmbeddingService {

    /**
     * Embeds a batch of texts in one model call. Every returned index points into {@code texts}.
     *
     * @throws com.starwatch.exception.EmbeddingException when the call fails after retries
     */
    List<IndexedEmbedding> embed(List<String> texts);

    float[] embedQuery(String query);
}
