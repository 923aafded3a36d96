package com.starwatch.source;

import com.starwatch.model.PageDirection;
import com.starwatch.model.RepoPage;

import java.util.Optional;

/**
 * Cursor-paginated read access to the remote star list.
 */
public interface StarSource {

    /**
     * @param direction {@code FORWARD} reads the page after {@code cursor}, {@code BACKWARD} the page before it
     * @param cursor    opaque cursor from a previous page, empty to start at the first (forward) or last (backward) page
     */
    RepoPage fetchPage(PageDirection direction, Optional<String> cursor);
}
