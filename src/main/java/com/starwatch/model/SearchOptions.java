package com.starwatch.model;

import java.util.List;

/**
 * Raw search request: field names are not trusted until resolved against {@link SearchField}.
 * An empty sort list means {@code score DESC}.
 */
public record SearchOptions(
    int limit,
    List<String> fields,
    List<SortClause> sort
) {

    public SearchOptions {
        fields = fields == null ? List.of() : List.copyOf(fields);
        sort = sort == null ? List.of() : List.copyOf(sort);
    }
}
