package com.starwatch.infra;

import com.starwatch.exception.SyncCancelledException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute plus tokens-per-minute limiter, one pair of buckets per key.
 */
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> requestBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tokenBuckets = new ConcurrentHashMap<>();

    private final long requestsPerMinute;
    private final long tokensPerMinute;

    public InMemoryDualRateLimiter(long requestsPerMinute, long tokensPerMinute) {
        if (requestsPerMinute < 1 || tokensPerMinute < 1) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.tokensPerMinute = tokensPerMinute;
    }

    private static Bucket perMinute(long capacity) {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(capacity)
                .refillGreedy(capacity, Duration.ofMinutes(1))
                .build())
            .build();
    }

    @Override
    public void acquire(String key, long tokens) {
        Bucket requests = requestBuckets.computeIfAbsent(key, k -> perMinute(requestsPerMinute));
        Bucket tokenBucket = tokenBuckets.computeIfAbsent(key, k -> perMinute(tokensPerMinute));

        // A single call larger than the whole budget still has to pass eventually.
        long cost = Math.max(1, Math.min(tokens, tokensPerMinute));
        try {
            requests.asBlocking().consume(1);
            tokenBucket.asBlocking().consume(cost);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncCancelledException("Interrupted while waiting for rate limit '" + key + "'", e);
        }
    }

    long availableRequests(String key) {
        Bucket bucket = requestBuckets.get(key);
        return bucket == null ? requestsPerMinute : bucket.getAvailableTokens();
    }

    long availableTokens(String key) {
        Bucket bucket = tokenBuckets.get(key);
        return bucket == null ? tokensPerMinute : bucket.getAvailableTokens();
    }
}
