package com.starwatch.service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Completion counter shared by concurrent enrichment tasks.
 */
public final class ProgressCounter {

    private final AtomicInteger completed = new AtomicInteger();
    private final int total;

    public ProgressCounter(int total) {
        this.total = total;
    }

    public int increment() {
        return completed.incrementAndGet();
    }

    public int get() {
        return completed.get();
    }

    public int total() {
        return total;
    }

    public boolean isReportPoint(int value, int every) {
        return value % every == 0 || value == total;
    }
}
