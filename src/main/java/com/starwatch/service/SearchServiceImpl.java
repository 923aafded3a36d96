package com.starwatch.service;

import com.starwatch.exception.WrongQueryException;
import com.starwatch.model.CategoryCount;
import com.starwatch.model.RepoStats;
import com.starwatch.model.SearchOptions;
import com.starwatch.model.SearchResultRow;
import com.starwatch.model.SortClause;
import com.starwatch.model.SortDirection;
import com.starwatch.model.StatsResponse;
import com.starwatch.repository.SearchFieldAllowList;
import com.starwatch.repository.StarredRepoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchServiceImpl implements SearchService {

    static final String DEFAULT_FIELDS = "full_name,description,ai_summary,ai_categories,stars,url,score";
    static final int MAX_LIMIT = 100;

    private final StarredRepoRepository repository;
    private final EmbeddingService embeddingService;

    @Override
    public List<SearchResultRow> search(String query, int limit, String fields, String sort) {
        validateQuery(query);
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new WrongQueryException("Limit must be between 1 and " + MAX_LIMIT);
        }

        SearchOptions options = new SearchOptions(limit, parseFields(fields), parseSort(sort));
        // Reject bad field names before paying for the query embedding.
        SearchFieldAllowList.resolve(options);

        log.debug("Semantic search for '{}' with {}", query, options);
        float[] queryVector = embeddingService.embedQuery(query);
        return repository.search(queryVector, options);
    }

    @Override
    public StatsResponse stats() {
        RepoStats stats = repository.stats();
        Map<String, Long> breakdown = repository.categoryBreakdown();

        List<CategoryCount> categories = breakdown.entrySet().stream()
            .map(entry -> new CategoryCount(entry.getKey(), entry.getValue()))
            .sorted(Comparator.comparingLong(CategoryCount::count).reversed()
                .thenComparing(CategoryCount::category))
            .toList();

        return new StatsResponse(stats.total(), stats.enriched(), stats.embedded(), categories);
    }

    private static void validateQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new WrongQueryException("Query cannot be blank");
        }
    }

    static List<String> parseFields(String fields) {
        String value = fields == null || fields.isBlank() ? DEFAULT_FIELDS : fields;
        List<String> parsed = Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(field -> !field.isEmpty())
            .toList();
        if (parsed.isEmpty()) {
            throw new WrongQueryException("No fields specified");
        }
        return parsed;
    }

    static List<SortClause> parseSort(String sort) {
        if (sort == null || sort.isBlank()) {
            return List.of(SortClause.desc("score"));
        }

        List<SortClause> clauses = new ArrayList<>();
        for (String part : sort.split(",")) {
            String[] tokens = part.trim().split("\\s+");
            if (tokens[0].isEmpty()) {
                continue;
            }
            if (tokens.length > 2) {
                throw new WrongQueryException("Invalid sort clause '" + part.trim() + "'");
            }
            SortDirection direction = SortDirection.ASC;
            if (tokens.length == 2) {
                direction = switch (tokens[1].toLowerCase()) {
                    case "asc" -> SortDirection.ASC;
                    case "desc" -> SortDirection.DESC;
                    default -> throw new WrongQueryException("Invalid sort direction '" + tokens[1] + "'");
                };
            }
            clauses.add(new SortClause(tokens[0], direction));
        }
        return clauses;
    }
}
