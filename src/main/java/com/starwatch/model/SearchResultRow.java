package com.starwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One search hit: requested field name to value, in request order, plus the similarity score.
 */
public record SearchResultRow(Map<String, SearchValue> values) {

    public SearchResultRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public SearchValue get(String field) {
        return values.getOrDefault(field, SearchValue.absent());
    }

    public double score() {
        SearchValue score = get(SearchField.SCORE.fieldName());
        return score.isAbsent() ? 0.0 : ((Number) score.value()).doubleValue();
    }

    @JsonValue
    public Map<String, SearchValue> json() {
        return values;
    }
}
