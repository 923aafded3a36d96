package com.starwatch.service;

import com.starwatch.exception.SummaryGenerationException;
import com.starwatch.exception.SyncCancelledException;
import com.starwatch.model.EnrichmentOutcome;
import com.starwatch.model.StarredRepo;
import com.starwatch.model.SummaryResult;
import com.starwatch.repository.StarredRepoRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EnrichmentSchedulerTest {

    @Mock
    private SummaryGeneratorService summaryGeneratorService;

    @Mock
    private StarredRepoRepository repository;

    private ExecutorService pool;
    private TaskExecutorAdapter taskExecutor;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        taskExecutor = new TaskExecutorAdapter(pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("Should store a summary for every repo")
    void shouldEnrichAll() {
        List<StarredRepo> targets = repos(12);
        when(summaryGeneratorService.summarize(any()))
            .thenAnswer(invocation -> new SummaryResult("Summary of " + ((StarredRepo) invocation.getArgument(0)).fullName(),
                List.of("Other")));

        EnrichmentOutcome outcome = new EnrichmentScheduler(summaryGeneratorService, repository, taskExecutor, 5)
            .enrich(targets);

        assertThat(outcome).isEqualTo(new EnrichmentOutcome(12, 12, 0));
        verify(repository).updateEnrichment("owner/repo-7", "Summary of owner/repo-7", List.of("Other"));
        verify(repository, times(12)).updateEnrichment(anyString(), anyString(), anyList());
    }

    @Test
    @DisplayName("Should isolate a failing repo from the others")
    void shouldIsolateFailures() {
        List<StarredRepo> targets = repos(3);
        when(summaryGeneratorService.summarize(any())).thenAnswer(invocation -> {
            StarredRepo repo = invocation.getArgument(0);
            if (repo.name().equals("repo-1")) {
                throw new SummaryGenerationException(repo.fullName(), "bad answer", null);
            }
            return new SummaryResult("ok", List.of());
        });

        EnrichmentOutcome outcome = new EnrichmentScheduler(summaryGeneratorService, repository, taskExecutor, 2)
            .enrich(targets);

        assertThat(outcome).isEqualTo(new EnrichmentOutcome(3, 2, 1));
        verify(repository).updateEnrichment(eq("owner/repo-0"), eq("ok"), anyList());
        verify(repository).updateEnrichment(eq("owner/repo-2"), eq("ok"), anyList());
        verify(repository, never()).updateEnrichment(eq("owner/repo-1"), any(), any());
    }

    @Test
    @DisplayName("Should count a failed store write as a failure and carry on")
    void shouldIsolateWriteFailures() {
        when(summaryGeneratorService.summarize(any())).thenReturn(new SummaryResult("ok", List.of()));
        lenient().doThrow(new RuntimeException("connection reset"))
            .when(repository).updateEnrichment(eq("owner/repo-0"), any(), any());

        EnrichmentOutcome outcome = new EnrichmentScheduler(summaryGeneratorService, repository, taskExecutor, 1)
            .enrich(repos(2));

        assertThat(outcome).isEqualTo(new EnrichmentOutcome(2, 1, 1));
    }

    @Test
    @DisplayName("Should never run more summaries at once than the concurrency limit")
    void shouldBoundConcurrency() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(summaryGeneratorService.summarize(any())).thenAnswer(invocation -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            return new SummaryResult("ok", List.of());
        });

        EnrichmentOutcome outcome = new EnrichmentScheduler(summaryGeneratorService, repository, taskExecutor, 3)
            .enrich(repos(15));

        assertThat(outcome.enriched()).isEqualTo(15);
        assertThat(maxInFlight.get()).isBetween(1, 3);
    }

    @Test
    @DisplayName("Should stop dispatching and raise SyncCancelledException when interrupted")
    void shouldCancelOnInterrupt() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        when(summaryGeneratorService.summarize(any())).thenAnswer(invocation -> {
            started.countDown();
            never.await();
            return new SummaryResult("ok", List.of());
        });

        EnrichmentScheduler scheduler = new EnrichmentScheduler(summaryGeneratorService, repository, taskExecutor, 1);
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<EnrichmentOutcome> run = caller.submit(() -> scheduler.enrich(repos(5)));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            run.cancel(true);
            caller.shutdown();
            assertThat(caller.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            caller.shutdownNow();
        }

        verify(summaryGeneratorService, times(1)).summarize(any());
        verify(repository, never()).updateEnrichment(any(), any(), any());
    }

    @Test
    @DisplayName("Should surface cancellation to the caller as SyncCancelledException")
    void shouldThrowSyncCancelled() {
        EnrichmentScheduler scheduler = new EnrichmentScheduler(summaryGeneratorService, repository, taskExecutor, 1);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> scheduler.enrich(repos(3)))
                .isInstanceOf(SyncCancelledException.class);
        } finally {
            Thread.interrupted();
        }
        verifyNoInteractions(summaryGeneratorService);
    }

    @Test
    @DisplayName("Should cancel the remaining tasks when one dies with an error")
    void shouldCancelRemainingTasksOnError() throws Exception {
        CountDownLatch secondStarted = new CountDownLatch(1);
        CountDownLatch secondInterrupted = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        when(summaryGeneratorService.summarize(any())).thenAnswer(invocation -> {
            StarredRepo repo = invocation.getArgument(0);
            if (repo.name().equals("repo-0")) {
                secondStarted.await(5, TimeUnit.SECONDS);
                throw new LinkageError("broken classpath");
            }
            secondStarted.countDown();
            try {
                never.await();
            } catch (InterruptedException e) {
                secondInterrupted.countDown();
            }
            return new SummaryResult("late", List.of());
        });

        EnrichmentScheduler scheduler = new EnrichmentScheduler(summaryGeneratorService, repository, taskExecutor, 2);

        assertThatThrownBy(() -> scheduler.enrich(repos(2)))
            .isInstanceOf(IllegalStateException.class)
            .hasCauseInstanceOf(LinkageError.class);
        assertThat(secondInterrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Should reject a non-positive concurrency limit")
    void shouldRejectInvalidConcurrency() {
        assertThatThrownBy(() -> new EnrichmentScheduler(summaryGeneratorService, repository, taskExecutor, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<StarredRepo> repos(int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> StarredRepo.fetched("owner", "repo-" + i, null, "https://github.com/owner/repo-" + i,
                null, i, null, List.of(), null))
            .toList();
    }
}
