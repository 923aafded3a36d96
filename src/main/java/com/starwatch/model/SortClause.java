package com.starwatch.model;

public record SortClause(
    String field,
    SortDirection direction
) {

    public static SortClause asc(String field) {
        return new SortClause(field, SortDirection.ASC);
    }

    public static SortClause desc(String field) {
        return new SortClause(field, SortDirection.DESC);
    }
}
