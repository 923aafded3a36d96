package com.starwatch.service;

import com.starwatch.model.SearchResultRow;
import com.starwatch.model.StatsResponse;

import java.util.List;

public interface SearchService {

    /**
     * @param fields comma-separated result fields, or {@code null} for the default set
     * @param sort   comma-separated {@code "field [asc|desc]"} clauses, or {@code null} for {@code score desc}
     */
    List<SearchResultRow> search(String query, int limit, String fields, String sort);

    StatsResponse stats();
}
