package com.starwatch.controller;

import com.starwatch.model.SearchResultRow;
import com.starwatch.model.StatsResponse;
import com.starwatch.service.SearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class SearchController {

    private final SearchService searchService;

    @GetMapping("/search")
    public ResponseEntity<List<SearchResultRow>> search(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "k", defaultValue = "10") int limit,
        @RequestParam(name = "fields", required = false) String fields,
        @RequestParam(name = "sort", required = false) String sort) {

        return ResponseEntity.ok(searchService.search(query, limit, fields, sort));
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        return ResponseEntity.ok(searchService.stats());
    }
}
