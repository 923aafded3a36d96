package com.starwatch.service;

import com.starwatch.cache.StarCache;
import com.starwatch.exception.StarCacheException;
import com.starwatch.exception.SyncCancelledException;
import com.starwatch.exception.SyncInProgressException;
import com.starwatch.infra.Cancellation;
import com.starwatch.model.EnrichmentOutcome;
import com.starwatch.model.FetchSource;
import com.starwatch.model.StarredRepo;
import com.starwatch.model.SyncOptions;
import com.starwatch.model.SyncReport;
import com.starwatch.repository.StarredRepoRepository;
import com.starwatch.source.FullFetchStrategy;
import com.starwatch.source.IncrementalFetchStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Runs one sync: resolve the star list, upsert it, enrich what lacks a summary, embed what lacks a vector.
 * Stages run strictly in that order. Every stage only touches missing data, so a failed run can simply be
 * repeated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncPipeline {

    static final int UPSERT_REPORT_EVERY = 50;

    private final StarredRepoRepository repository;
    private final StarCache starCache;
    private final FullFetchStrategy fullFetchStrategy;
    private final IncrementalFetchStrategy incrementalFetchStrategy;
    private final EnrichmentScheduler enrichmentScheduler;
    private final EmbeddingBatcher embeddingBatcher;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @throws SyncInProgressException when another run is executing in this process
     * @throws SyncCancelledException  when the calling thread is interrupted
     */
    public SyncReport run(SyncOptions options) {
        if (!running.compareAndSet(false, true)) {
            throw new SyncInProgressException();
        }
        try {
            return execute(options);
        } finally {
            running.set(false);
        }
    }

    /**
     * Applies the store schema without syncing. Safe to repeat.
     */
    public void initSchema() {
        log.info("Initializing store schema");
        repository.initSchema();
    }

    public boolean isRunning() {
        return running.get();
    }

    private SyncReport execute(SyncOptions options) {
        log.info("Starting sync (skipEnrichment={}, forceReEnrich={}, forceRefetch={})",
            options.skipEnrichment(), options.forceReEnrich(), options.forceRefetch());

        repository.initSchema();

        Resolved resolved = resolve(options.forceRefetch());
        int upserted = upsertAll(resolved.repos());

        int enrichmentTargets = 0;
        int enriched = 0;
        if (options.skipEnrichment()) {
            log.info("Skipping enrichment");
        } else {
            List<StarredRepo> toEnrich = options.forceReEnrich() ? repository.findAll() : repository.findUnenriched();
            enrichmentTargets = toEnrich.size();
            if (toEnrich.isEmpty()) {
                log.info("All repos already enriched");
            } else {
                log.info("Enriching {} repos with AI summaries", toEnrich.size());
                EnrichmentOutcome outcome = enrichmentScheduler.enrich(toEnrich);
                enriched = outcome.enriched();
                log.info("Enrichment finished: {} enriched, {} failed", outcome.enriched(), outcome.failed());
            }
        }

        List<StarredRepo> toEmbed = embeddingTargets(options.forceReEnrich());
        int embedded = 0;
        if (toEmbed.isEmpty()) {
            log.info("No repos need embeddings");
        } else {
            log.info("Generating embeddings for {} repos", toEmbed.size());
            embedded = embeddingBatcher.embed(toEmbed);
        }

        SyncReport report = new SyncReport(
            resolved.source(),
            resolved.repos().size(),
            resolved.newRepos(),
            upserted,
            enrichmentTargets,
            enriched,
            toEmbed.size(),
            embedded
        );
        log.info("Sync complete: {}", report);
        return report;
    }

    private Resolved resolve(boolean forceRefetch) {
        List<StarredRepo> cached = starCache.read().orElse(List.of());

        if (forceRefetch) {
            log.info("Fetching full star list (forced refresh)");
            return fetchFull(cached);
        }

        if (cached.isEmpty()) {
            log.info("No cache found, fetching full star list");
            return fetchFull(cached);
        }

        log.info("Cache has {} repos, checking for new stars", cached.size());
        List<StarredRepo> repos;
        try {
            repos = incrementalFetchStrategy.fetch(cached);
        } catch (SyncCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Incremental fetch failed, using cache as-is: {}", e.getMessage());
            return new Resolved(cached, FetchSource.CACHE, 0);
        }

        int newRepos = repos.size() - cached.size();
        if (newRepos > 0) {
            writeCache(repos);
        } else {
            log.info("Cache is up to date ({} repos)", cached.size());
        }
        return new Resolved(repos, FetchSource.REMOTE_INCREMENTAL, Math.max(newRepos, 0));
    }

    private Resolved fetchFull(List<StarredRepo> previous) {
        List<StarredRepo> repos = fullFetchStrategy.fetch(previous);
        writeCache(repos);

        Set<String> previousNames = previous.stream().map(StarredRepo::fullName).collect(Collectors.toSet());
        int newRepos = (int) repos.stream().filter(repo -> !previousNames.contains(repo.fullName())).count();
        return new Resolved(repos, FetchSource.REMOTE_FULL, newRepos);
    }

    private void writeCache(List<StarredRepo> repos) {
        try {
            starCache.write(repos);
        } catch (StarCacheException e) {
            log.warn("Failed to write cache: {}", e.getMessage());
        }
    }

    private int upsertAll(List<StarredRepo> repos) {
        int count = 0;
        for (StarredRepo repo : repos) {
            Cancellation.throwIfCancelled("upsert");
            repository.upsert(repo);
            count++;
            if (count % UPSERT_REPORT_EVERY == 0 || count == repos.size()) {
                log.info("Upserted {}/{}", count, repos.size());
            }
        }
        return count;
    }

    private List<StarredRepo> embeddingTargets(boolean forceReEnrich) {
        if (!forceReEnrich) {
            return repository.findNeedingEmbedding();
        }

        List<StarredRepo> all = repository.findAll();
        List<StarredRepo> enriched = all.stream().filter(StarredRepo::isEnriched).toList();
        if (enriched.size() < all.size()) {
            log.info("Skipping embeddings for {} repos without a summary", all.size() - enriched.size());
        }
        return enriched;
    }

    private record Resolved(List<StarredRepo> repos, FetchSource source, int newRepos) {
    }
}
