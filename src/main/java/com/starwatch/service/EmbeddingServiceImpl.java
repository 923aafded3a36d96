package com.starwatch.service;

import com.starwatch.exception.EmbeddingException;
import com.starwatch.exception.SyncCancelledException;
import com.starwatch.infra.RateLimiter;
import com.starwatch.model.IndexedEmbedding;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.IntStream;

@Service
@Slf4j
public class EmbeddingServiceImpl implements EmbeddingService {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    static final int MAX_QUERY_LENGTH = 1000;

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;

    public EmbeddingServiceImpl(
        EmbeddingModel embeddingModel,
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter
    ) {
        this.embeddingModel = embeddingModel;
        this.embeddingLimiter = embeddingLimiter;
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttemptsExpression = "${app.embedding.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.embedding.retry-delay-ms:1000}", multiplier = 2)
    )
    public List<IndexedEmbedding> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        int estimatedTokens = texts.stream().mapToInt(String::length).sum() / 4;
        Response<List<Embedding>> response = embeddingLimiter.execute(EMBEDDING_LIMIT, estimatedTokens,
            () -> embeddingModel.embedAll(texts.stream().map(TextSegment::from).toList()));

        List<Embedding> embeddings = response == null ? null : response.content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new EmbeddingException(String.format("Embedding model returned %d vectors for %d texts",
                embeddings == null ? 0 : embeddings.size(), texts.size()));
        }

        return IntStream.range(0, embeddings.size())
            .mapToObj(i -> new IndexedEmbedding(i, embeddings.get(i).vector()))
            .toList();
    }

    @Recover
    public List<IndexedEmbedding> recover(RuntimeException e, List<String> texts) {
        if (e instanceof EmbeddingException || e instanceof SyncCancelledException) {
            throw e;
        }
        log.error("Embedding of {} texts failed: {}", texts.size(), e.getMessage());
        throw new EmbeddingException("Error during batch vectorization", e);
    }

    @Override
    public float[] embedQuery(String inputQuery) {
        if (inputQuery == null || inputQuery.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }

        String query = inputQuery.trim();
        if (query.length() > MAX_QUERY_LENGTH) {
            query = query.substring(0, MAX_QUERY_LENGTH);
            log.warn("Query was truncated for embedding: {}", query);
        }

        log.debug("Generating embedding for query: '{}'", query);

        String text = query;
        try {
            float[] vector = embeddingLimiter.execute(EMBEDDING_LIMIT, Math.max(1, text.length() / 4),
                () -> embeddingModel.embed(text).content().vector());
            if (vector == null || vector.length == 0) {
                throw new IllegalStateException("Embedding model returned an empty vector for query: " + text);
            }
            return vector;
        } catch (SyncCancelledException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate embedding for query: {}", text, e);
            throw new EmbeddingException("Error during query vectorization", e);
        }
    }
}
