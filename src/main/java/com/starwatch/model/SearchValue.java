package com.starwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A single cell of a search result, tagged with its kind.
 */
public record SearchValue(Kind kind, Object value) {

    public enum Kind {
        TEXT,
        INTEGER,
        FLOAT,
        LIST,
        TIMESTAMP,
        ABSENT
    }

    private static final SearchValue ABSENT_VALUE = new SearchValue(Kind.ABSENT, null);

    public static SearchValue absent() {
        return ABSENT_VALUE;
    }

    public static SearchValue text(String value) {
        return value == null ? ABSENT_VALUE : new SearchValue(Kind.TEXT, value);
    }

    public static SearchValue integer(Long value) {
        return value == null ? ABSENT_VALUE : new SearchValue(Kind.INTEGER, value);
    }

    public static SearchValue decimal(Double value) {
        return value == null ? ABSENT_VALUE : new SearchValue(Kind.FLOAT, value);
    }

    public static SearchValue list(List<String> value) {
        return value == null ? ABSENT_VALUE : new SearchValue(Kind.LIST, List.copyOf(value));
    }

    public static SearchValue timestamp(OffsetDateTime value) {
        return value == null ? ABSENT_VALUE : new SearchValue(Kind.TIMESTAMP, value);
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }

    @JsonValue
    public Object json() {
        return value;
    }
}
