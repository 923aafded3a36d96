package com.starwatch.model;

import java.util.List;

public record SummaryResult(
    String summary,
    List<String> categories
) {

    public SummaryResult {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
