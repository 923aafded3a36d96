package com.starwatch.repository;

import com.starwatch.model.RepoStats;
import com.starwatch.model.SearchOptions;
import com.starwatch.model.SearchResultRow;
import com.starwatch.model.StarredRepo;

import java.util.List;
import java.util.Map;

/**
 * Durable store of starred repositories. Every write is keyed by {@code full_name} and idempotent.
 */
public interface StarredRepoRepository {
    void initSchema();
    void upsert(StarredRepo repo);
    List<StarredRepo> findAll();
    List<StarredRepo> findUnenriched();
    List<StarredRepo> findNeedingEmbedding();
    void updateEnrichment(String fullName, String summary, List<String> categories);
    void updateEmbedding(String fullName, float[] vector);
    List<SearchResultRow> search(float[] queryVector, SearchOptions options);
    RepoStats stats();
    Map<String, Long> categoryBreakdown();
}
