package com.starwatch.service;

import com.starwatch.exception.SyncCancelledException;
import com.starwatch.model.EnrichmentOutcome;
import com.starwatch.model.StarredRepo;
import com.starwatch.model.SummaryResult;
import com.starwatch.repository.StarredRepoRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Summarizes repositories concurrently with at most {@code app.enrichment.concurrency} model calls in flight.
 * A failed repository is logged and left unenriched for the next run.
 */
@Component
@Slf4j
public class EnrichmentScheduler {

    static final int REPORT_EVERY = 10;

    private final SummaryGeneratorService summaryGeneratorService;
    private final StarredRepoRepository repository;
    private final AsyncTaskExecutor taskExecutor;
    private final int concurrency;

    public EnrichmentScheduler(
        SummaryGeneratorService summaryGeneratorService,
        StarredRepoRepository repository,
        @Qualifier("enrichmentTaskExecutor") AsyncTaskExecutor taskExecutor,
        @Value("${app.enrichment.concurrency:5}") int concurrency
    ) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Enrichment concurrency must be positive, got " + concurrency);
        }
        this.summaryGeneratorService = summaryGeneratorService;
        this.repository = repository;
        this.taskExecutor = taskExecutor;
        this.concurrency = concurrency;
    }

    public EnrichmentOutcome enrich(List<StarredRepo> targets) {
        return enrich(targets, new ProgressCounter(targets.size()));
    }

    public EnrichmentOutcome enrich(List<StarredRepo> targets, ProgressCounter progress) {
        if (targets.isEmpty()) {
            return new EnrichmentOutcome(0, 0, 0);
        }

        Semaphore permits = new Semaphore(concurrency);
        AtomicInteger failed = new AtomicInteger();
        List<Future<?>> tasks = new ArrayList<>(targets.size());

        try {
            for (StarredRepo repo : targets) {
                permits.acquire();
                try {
                    tasks.add(taskExecutor.submit(() -> {
                        try {
                            enrichOne(repo, progress, failed);
                        } finally {
                            permits.release();
                        }
                    }));
                } catch (RuntimeException e) {
                    permits.release();
                    throw e;
                }
            }
            for (Future<?> task : tasks) {
                task.get();
            }
        } catch (InterruptedException e) {
            tasks.forEach(task -> task.cancel(true));
            Thread.currentThread().interrupt();
            log.warn("Enrichment cancelled after {}/{} repos", progress.get(), targets.size());
            throw new SyncCancelledException("Enrichment cancelled", e);
        } catch (ExecutionException e) {
            tasks.forEach(task -> task.cancel(true));
            throw new IllegalStateException("Enrichment task failed unexpectedly", e.getCause());
        }

        return new EnrichmentOutcome(targets.size(), progress.get(), failed.get());
    }

    private void enrichOne(StarredRepo repo, ProgressCounter progress, AtomicInteger failed) {
        SummaryResult result;
        try {
            result = summaryGeneratorService.summarize(repo);
        } catch (RuntimeException e) {
            log.warn("Failed to enrich {}: {}", repo.fullName(), e.getMessage());
            failed.incrementAndGet();
            return;
        }

        try {
            repository.updateEnrichment(repo.fullName(), result.summary(), result.categories());
        } catch (RuntimeException e) {
            log.warn("Failed to store enrichment for {}: {}", repo.fullName(), e.getMessage());
            failed.incrementAndGet();
            return;
        }

        int done = progress.increment();
        if (progress.isReportPoint(done, REPORT_EVERY)) {
            log.info("Enriched {}/{}", done, progress.total());
        }
    }
}
