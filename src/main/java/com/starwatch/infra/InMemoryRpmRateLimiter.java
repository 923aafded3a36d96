package com.starwatch.infra;

public class InMemoryRpmRateLimiter implements RateLimiter {

    private final InMemoryDualRateLimiter dualLimiter;

    public InMemoryRpmRateLimiter(long requestsPerMinute) {
        this.dualLimiter = new InMemoryDualRateLimiter(requestsPerMinute, Integer.MAX_VALUE);
    }

    @Override
    public void acquire(String key, long tokens) {
        dualLimiter.acquire(key, 1);
    }
}
