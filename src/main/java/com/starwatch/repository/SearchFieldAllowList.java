package com.starwatch.repository;

import com.starwatch.exception.InvalidSearchFieldException;
import com.starwatch.exception.WrongQueryException;
import com.starwatch.model.SearchField;
import com.starwatch.model.SearchOptions;
import com.starwatch.model.SortClause;
import com.starwatch.model.SortDirection;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves the field names of a {@link SearchOptions} against {@link SearchField}.
 * Pure: nothing here touches the database.
 */
public final class SearchFieldAllowList {

    private SearchFieldAllowList() {
    }

    public static boolean isAllowed(String field) {
        return SearchField.fromName(field).isPresent();
    }

    /**
     * @throws InvalidSearchFieldException for the first field or sort field not on the allow-list
     * @throws WrongQueryException         for a non-positive limit
     */
    public static SearchPlan resolve(SearchOptions options) {
        if (options.limit() < 1) {
            throw new WrongQueryException("Result limit must be positive");
        }

        Set<SearchField> fields = new LinkedHashSet<>();
        fields.add(SearchField.SCORE);
        for (String name : options.fields()) {
            fields.add(resolve("result", name));
        }

        List<SearchPlan.Order> orders = new ArrayList<>();
        for (SortClause clause : options.sort()) {
            SortDirection direction = clause.direction() == null ? SortDirection.ASC : clause.direction();
            orders.add(new SearchPlan.Order(resolve("sort", clause.field()), direction));
        }
        if (orders.isEmpty()) {
            orders.add(new SearchPlan.Order(SearchField.SCORE, SortDirection.DESC));
        }

        return new SearchPlan(options.limit(), List.copyOf(fields), List.copyOf(orders));
    }

    private static SearchField resolve(String usage, String name) {
        return SearchField.fromName(name)
            .orElseThrow(() -> new InvalidSearchFieldException(usage, name));
    }
}
