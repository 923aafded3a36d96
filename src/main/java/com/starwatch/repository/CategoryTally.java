package com.starwatch.repository;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class CategoryTally {

    private CategoryTally() {
    }

    /**
     * Counts every tag occurrence; a repository with N tags adds to N counters.
     */
    static Map<String, Long> tally(List<List<String>> categoryLists) {
        Map<String, Long> counts = new HashMap<>();
        for (List<String> categories : categoryLists) {
            if (categories == null) {
                continue;
            }
            for (String category : categories) {
                counts.merge(category, 1L, Long::sum);
            }
        }
        return counts;
    }
}
