package com.starwatch.model;

/**
 * Where the repository list of a sync run came from.
 */
public enum FetchSource {
    REMOTE_FULL,
    REMOTE_INCREMENTAL,
    CACHE
}
