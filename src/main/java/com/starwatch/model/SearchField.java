package com.starwatch.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Allow-list of the field names a search may select or sort by.
 *
 * <p>Field names end up inside the SQL text, so anything not listed here is rejected.
 */
public enum SearchField {
    OWNER("owner", SearchValue.Kind.TEXT),
    NAME("name", SearchValue.Kind.TEXT),
    FULL_NAME("full_name", SearchValue.Kind.TEXT),
    DESCRIPTION("description", SearchValue.Kind.TEXT),
    URL("url", SearchValue.Kind.TEXT),
    HOMEPAGE_URL("homepage_url", SearchValue.Kind.TEXT),
    STARS("stars", SearchValue.Kind.INTEGER),
    LANGUAGE("language", SearchValue.Kind.TEXT),
    TOPICS("topics", SearchValue.Kind.LIST),
    README_EXCERPT("readme_excerpt", SearchValue.Kind.TEXT),
    AI_SUMMARY("ai_summary", SearchValue.Kind.TEXT),
    AI_CATEGORIES("ai_categories", SearchValue.Kind.LIST),
    FETCHED_AT("fetched_at", SearchValue.Kind.TIMESTAMP),
    ENRICHED_AT("enriched_at", SearchValue.Kind.TIMESTAMP),
    SCORE("score", SearchValue.Kind.FLOAT);

    private final String fieldName;
    private final SearchValue.Kind kind;

    SearchField(String fieldName, SearchValue.Kind kind) {
        this.fieldName = fieldName;
        this.kind = kind;
    }

    public String fieldName() {
        return fieldName;
    }

    public SearchValue.Kind kind() {
        return kind;
    }

    public static Optional<SearchField> fromName(String name) {
        return Arrays.stream(values())
            .filter(f -> f.fieldName.equals(name))
            .findFirst();
    }
}
