package com.starwatch.service;

import com.starwatch.exception.EmbeddingException;
import com.starwatch.exception.SyncCancelledException;
import com.starwatch.infra.Cancellation;
import com.starwatch.model.IndexedEmbedding;
import com.starwatch.model.StarredRepo;
import com.starwatch.repository.StarredRepoRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
public class EmbeddingBatcher {

    private final EmbeddingService embeddingService;
    private final StarredRepoRepository repository;
    private final int batchSize;

    public EmbeddingBatcher(
        EmbeddingService embeddingService,
        StarredRepoRepository repository,
        @Value("${app.embedding.batch-size:256}") int batchSize
    ) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Embedding batch size must be positive, got " + batchSize);
        }
        this.embeddingService = embeddingService;
        this.repository = repository;
        this.batchSize = batchSize;
    }

    /**
     * Embeds every target and stores the vectors.
     *
     * @return number of vectors stored
     * @throws EmbeddingException when any batch fails, before anything is written
     */
    public int embed(List<StarredRepo> targets) {
        if (targets.isEmpty()) {
            return 0;
        }

        List<String> texts = targets.stream().map(EmbeddingBatcher::embeddingText).toList();
        float[][] vectors = embedAll(texts);

        int stored = 0;
        for (int i = 0; i < targets.size(); i++) {
            String fullName = targets.get(i).fullName();
            try {
                repository.updateEmbedding(fullName, vectors[i]);
                stored++;
            } catch (RuntimeException e) {
                log.warn("Failed to store embedding for {}: {}", fullName, e.getMessage());
            }
        }

        log.info("Stored {}/{} embeddings", stored, targets.size());
        return stored;
    }

    private float[][] embedAll(List<String> texts) {
        float[][] vectors = new float[texts.size()][];

        for (int start = 0; start < texts.size(); start += batchSize) {
            Cancellation.throwIfCancelled("embedding");
            int end = Math.min(start + batchSize, texts.size());

            List<IndexedEmbedding> batch;
            try {
                batch = embeddingService.embed(texts.subList(start, end));
            } catch (EmbeddingException | SyncCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new EmbeddingException("Embedding batch " + start + "-" + end + " failed: " + e.getMessage(), e);
            }

            // Indices are relative to the batch.
            for (IndexedEmbedding embedding : batch) {
                int position = start + embedding.index();
                if (embedding.index() < 0 || position >= end) {
                    throw new EmbeddingException(
                        "Embedding index " + embedding.index() + " out of range for batch " + start + "-" + end);
                }
                vectors[position] = embedding.vector();
            }
            log.info("Embedded {}/{}", end, texts.size());
        }

        for (int i = 0; i < vectors.length; i++) {
            if (vectors[i] == null || vectors[i].length == 0) {
                throw new EmbeddingException("No embedding returned for input " + i);
            }
        }
        return vectors;
    }

    static String embeddingText(StarredRepo repo) {
        return repo.fullName() + ": " + (repo.aiSummary() == null ? "" : repo.aiSummary());
    }
}
