package com.starwatch.cache;

import com.starwatch.model.StarredRepo;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of the last complete repository list fetched from the source.
 */
public interface StarCache {

    /**
     * @return the snapshot, or empty when there is none or it cannot be parsed
     */
    Optional<List<StarredRepo>> read();

    /**
     * Replaces the whole snapshot.
     *
     * @throws com.starwatch.exception.StarCacheException when the file cannot be written
     */
    void write(List<StarredRepo> repos);
}
