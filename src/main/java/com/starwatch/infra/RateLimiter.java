package com.starwatch.infra;

import java.util.function.Supplier;

public interface RateLimiter {

    /**
     * Blocks until {@code tokens} may be spent under {@code key}.
     */
    void acquire(String key, long tokens);

    default <T> T execute(String key, long tokens, Supplier<T> task) {
        acquire(key, tokens);
        return task.get();
    }
}
