package com.starwatch.model;

public record SyncOptions(
    boolean skipEnrichment,
    boolean forceReEnrich,
    boolean forceRefetch
) {

    public static SyncOptions defaults() {
        return new SyncOptions(false, false, false);
    }
}
