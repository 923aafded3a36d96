package com.starwatch.source;

import com.starwatch.model.StarredRepo;

import java.util.List;

/**
 * A way of turning the remote star list into the complete list of repositories to sync.
 */
public interface StarFetchStrategy {

    /**
     * @param known repositories from the previous snapshot, oldest first, may be empty
     * @return the complete repository list, oldest first
     */
    List<StarredRepo> fetch(List<StarredRepo> known);
}
