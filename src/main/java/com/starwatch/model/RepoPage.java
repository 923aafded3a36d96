package com.starwatch.model;

import java.util.List;

public record RepoPage(
    List<StarredRepo> repos,
    int totalCount,
    PageInfo pageInfo
) {

    public RepoPage {
        repos = repos == null ? List.of() : List.copyOf(repos);
    }

    public record PageInfo(
        boolean hasNextPage,
        String endCursor,
        boolean hasPreviousPage,
        String startCursor
    ) {}
}
