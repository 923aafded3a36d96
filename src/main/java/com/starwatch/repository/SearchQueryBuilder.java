package com.starwatch.repository;

import com.starwatch.model.SearchField;

import java.util.stream.Collectors;

/**
 * Builds the similarity query for a resolved {@link SearchPlan}.
 *
 * <p>Only allow-listed column names are written into the SQL text; the query vector and the
 * limit stay bound parameters ({@code :vector}, {@code :limit}).
 */
final class SearchQueryBuilder {

    static final String SCORE_EXPRESSION = "1 - (embedding <=> :vector)";

    private SearchQueryBuilder() {
    }

    static String build(SearchPlan plan) {
        String columns = plan.fields().stream()
            .map(field -> field == SearchField.SCORE
                ? SCORE_EXPRESSION + " AS score"
                : field.fieldName())
            .collect(Collectors.joining(", "));

        String orderBy = plan.orders().stream()
            .map(order -> order.field().fieldName() + " " + order.direction().name())
            .collect(Collectors.joining(", "));

        // Brute-force scan: arbitrary ORDER BY clauses cannot use the HNSW index anyway.
        return "SELECT " + columns
            + " FROM starred_repos"
            + " WHERE embedding IS NOT NULL"
            + " ORDER BY " + orderBy
            + " LIMIT :limit";
    }
}
