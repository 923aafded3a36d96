package com.starwatch.repository;

import com.starwatch.model.SearchField;
import com.starwatch.model.SortDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SearchQueryBuilderTest {

    @Test
    @DisplayName("Should select the score expression and the requested columns")
    void shouldBuildQuery() {
        SearchPlan plan = new SearchPlan(10,
            List.of(SearchField.SCORE, SearchField.FULL_NAME, SearchField.STARS),
            List.of(new SearchPlan.Order(SearchField.STARS, SortDirection.DESC),
                new SearchPlan.Order(SearchField.SCORE, SortDirection.DESC)));

        assertThat(SearchQueryBuilder.build(plan)).isEqualTo(
            "SELECT 1 - (embedding <=> :vector) AS score, full_name, stars"
                + " FROM starred_repos"
                + " WHERE embedding IS NOT NULL"
                + " ORDER BY stars DESC, score DESC"
                + " LIMIT :limit");
    }

    @Test
    @DisplayName("Should keep the vector and limit as bind parameters")
    void shouldNotInlineValues() {
        SearchPlan plan = new SearchPlan(3, List.of(SearchField.SCORE),
            List.of(new SearchPlan.Order(SearchField.SCORE, SortDirection.ASC)));

        String sql = SearchQueryBuilder.build(plan);

        assertThat(sql).contains(":vector", ":limit").doesNotContain(" 3");
    }
}
