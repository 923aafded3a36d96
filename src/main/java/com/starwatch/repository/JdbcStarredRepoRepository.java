package com.starwatch.repository;

import com.pgvector.PGvector;
import com.starwatch.exception.EntityNotFoundException;
import com.starwatch.model.RepoStats;
import com.starwatch.model.SearchField;
import com.starwatch.model.SearchOptions;
import com.starwatch.model.SearchResultRow;
import com.starwatch.model.SearchValue;
import com.starwatch.model.StarredRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcStarredRepoRepository implements StarredRepoRepository {

    static final String SCHEMA_SCRIPT = "db/starwatch-schema.sql";

    private final JdbcClient jdbcClient;
    private final DataSource dataSource;

    private final RowMapper<StarredRepo> repoRowMapper = (rs, rowNum) -> {
        String embedding = rs.getString("embedding");
        return new StarredRepo(
            rs.getString("owner"),
            rs.getString("name"),
            rs.getString("full_name"),
            rs.getString("description"),
            rs.getString("url"),
            rs.getString("homepage_url"),
            rs.getInt("stars"),
            rs.getString("language"),
            textArray(rs.getArray("topics")),
            rs.getString("readme_excerpt"),
            rs.getString("ai_summary"),
            textArray(rs.getArray("ai_categories")),
            embedding == null ? null : new PGvector(embedding).toArray(),
            rs.getObject("fetched_at", OffsetDateTime.class),
            rs.getObject("enriched_at", OffsetDateTime.class)
        );
    };

    @Override
    public void initSchema() {
        log.info("Applying schema {}", SCHEMA_SCRIPT);
        new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT)).execute(dataSource);
    }

    @Override
    public void upsert(StarredRepo repo) {
        // Nullable columns keep their stored value when the incoming one is absent.
        jdbcClient.sql("""
                INSERT INTO starred_repos
                    (full_name, owner, name, description, url, homepage_url, stars, language, topics, readme_excerpt, fetched_at)
                VALUES
                    (:fullName, :owner, :name, :description, :url, :homepageUrl, :stars, :language, :topics, :readmeExcerpt, NOW())
                ON CONFLICT (full_name) DO UPDATE SET
                    owner = EXCLUDED.owner,
                    name = EXCLUDED.name,
                    description = COALESCE(EXCLUDED.description, starred_repos.description),
                    url = EXCLUDED.url,
                    homepage_url = COALESCE(EXCLUDED.homepage_url, starred_repos.homepage_url),
                    stars = EXCLUDED.stars,
                    language = COALESCE(EXCLUDED.language, starred_repos.language),
                    topics = EXCLUDED.topics,
                    readme_excerpt = COALESCE(EXCLUDED.readme_excerpt, starred_repos.readme_excerpt),
                    fetched_at = EXCLUDED.fetched_at
                """)
            .param("fullName", repo.fullName())
            .param("owner", repo.owner())
            .param("name", repo.name())
            .param("description", repo.description())
            .param("url", repo.url())
            .param("homepageUrl", repo.homepageUrl())
            .param("stars", repo.stars())
            .param("language", repo.language())
            .param("topics", repo.topics().toArray(new String[0]))
            .param("readmeExcerpt", repo.readmeExcerpt())
            .update();
    }

    @Override
    @Transactional(readOnly = true)
    public List<StarredRepo> findAll() {
        return jdbcClient.sql("SELECT * FROM starred_repos ORDER BY full_name")
            .query(repoRowMapper)
            .list();
    }

    @Override
    @Transactional(readOnly = true)
    public List<StarredRepo> findUnenriched() {
        return jdbcClient.sql("SELECT * FROM starred_repos WHERE ai_summary IS NULL ORDER BY full_name")
            .query(repoRowMapper)
            .list();
    }

    @Override
    @Transactional(readOnly = true)
    public List<StarredRepo> findNeedingEmbedding() {
        return jdbcClient.sql("""
                SELECT * FROM starred_repos
                WHERE ai_summary IS NOT NULL
                  AND embedding IS NULL
                ORDER BY full_name
                """)
            .query(repoRowMapper)
            .list();
    }

    @Override
    public void updateEnrichment(String fullName, String summary, List<String> categories) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE starred_repos
                SET ai_summary = :summary,
                    ai_categories = :categories,
                    enriched_at = NOW()
                WHERE full_name = :fullName
                """)
            .param("summary", summary)
            .param("categories", categories == null ? new String[0] : categories.toArray(new String[0]))
            .param("fullName", fullName)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException(fullName);
        }
    }

    @Override
    public void updateEmbedding(String fullName, float[] vector) {
        int rowsAffected = jdbcClient.sql("UPDATE starred_repos SET embedding = :embedding WHERE full_name = :fullName")
            .param("embedding", new PGvector(vector))
            .param("fullName", fullName)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException(fullName);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<SearchResultRow> search(float[] queryVector, SearchOptions options) {
        SearchPlan plan = SearchFieldAllowList.resolve(options);
        String sql = SearchQueryBuilder.build(plan);
        log.debug("Vector search: {}", sql);

        return jdbcClient.sql(sql)
            .param("vector", new PGvector(queryVector))
            .param("limit", plan.limit())
            .query((rs, rowNum) -> {
                Map<String, SearchValue> values = new LinkedHashMap<>();
                for (SearchField field : plan.fields()) {
                    values.put(field.fieldName(), readValue(rs, field));
                }
                return new SearchResultRow(values);
            })
            .list();
    }

    @Override
    @Transactional(readOnly = true)
    public RepoStats stats() {
        return jdbcClient.sql("""
                SELECT COUNT(*) AS total,
                       COUNT(ai_summary) AS enriched,
                       COUNT(embedding) AS embedded
                FROM starred_repos
                """)
            .query((rs, rowNum) -> new RepoStats(
                rs.getLong("total"),
                rs.getLong("enriched"),
                rs.getLong("embedded")
            ))
            .single();
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Long> categoryBreakdown() {
        List<List<String>> categoryLists = jdbcClient
            .sql("SELECT ai_categories FROM starred_repos WHERE ai_categories IS NOT NULL")
            .query((rs, rowNum) -> textArray(rs.getArray("ai_categories")))
            .list();

        return CategoryTally.tally(categoryLists);
    }

    private static SearchValue readValue(ResultSet rs, SearchField field) throws SQLException {
        String column = field.fieldName();
        return switch (field.kind()) {
            case TEXT -> SearchValue.text(rs.getString(column));
            case INTEGER -> {
                long value = rs.getLong(column);
                yield rs.wasNull() ? SearchValue.absent() : SearchValue.integer(value);
            }
            case FLOAT -> {
                double value = rs.getDouble(column);
                yield rs.wasNull() ? SearchValue.absent() : SearchValue.decimal(value);
            }
            case LIST -> {
                Array array = rs.getArray(column);
                yield array == null ? SearchValue.absent() : SearchValue.list(textArray(array));
            }
            case TIMESTAMP -> SearchValue.timestamp(rs.getObject(column, OffsetDateTime.class));
            case ABSENT -> SearchValue.absent();
        };
    }

    private static List<String> textArray(Array array) throws SQLException {
        return array == null ? List.of() : Arrays.asList((String[]) array.getArray());
    }
}
