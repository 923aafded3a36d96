package com.starwatch.repository;

import com.starwatch.model.SearchField;
import com.starwatch.model.SortDirection;

import java.util.List;

/**
 * A search whose field names have all been resolved against the allow-list.
 * {@code fields} always contains {@link SearchField#SCORE}.
 */
public record SearchPlan(
    int limit,
    List<SearchField> fields,
    List<Order> orders
) {

    public record Order(SearchField field, SortDirection direction) {}
}
