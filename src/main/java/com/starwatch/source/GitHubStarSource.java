package com.starwatch.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.starwatch.config.GitHubProperties;
import com.starwatch.exception.StarSourceException;
import com.starwatch.exception.StarSourceUnavailableException;
import com.starwatch.model.PageDirection;
import com.starwatch.model.RepoPage;
import com.starwatch.model.StarredRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a GitHub star list ({@code UserList}) through the GraphQL API.
 *
 * <p>The {@code UserList.items} connection is not part of GitHub's documented schema; forward
 * and backward Relay pagination are both supported by passing either {@code first/after} or
 * {@code last/before}.
 */
@Component
@Slf4j
public class GitHubStarSource implements StarSource {

    static final String PAGE_QUERY = """
        query($listId: ID!, $first: Int, $after: String, $last: Int, $before: String) {
          node(id: $listId) {
            ... on UserList {
              items(first: $first, after: $after, last: $last, before: $before) {
                totalCount
                pageInfo {
                  hasNextPage
                  endCursor
                  hasPreviousPage
                  startCursor
                }
                nodes {
                  ... on Repository {
                    owner { login }
                    name
                    description
                    url
                    homepageUrl
                    stargazerCount
                    primaryLanguage { name }
                    repositoryTopics(first: 20) {
                      nodes { topic { name } }
                    }
                    object(expression: "HEAD:README.md") {
                      ... on Blob { text }
                    }
                  }
                }
              }
            }
          }
        }
        """;

    private final RestClient restClient;
    private final GitHubProperties properties;

    public GitHubStarSource(
        @Qualifier("gitHubRestClient") RestClient restClient,
        GitHubProperties properties
    ) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    @Retryable(
        retryFor = StarSourceUnavailableException.class,
        maxAttemptsExpression = "${app.github.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.github.retry-delay-ms:1000}", multiplier = 2)
    )
    public RepoPage fetchPage(PageDirection direction, Optional<String> cursor) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("listId", properties.listId());
        if (direction == PageDirection.FORWARD) {
            variables.put("first", properties.pageSize());
            cursor.ifPresent(c -> variables.put("after", c));
        } else {
            variables.put("last", properties.pageSize());
            cursor.ifPresent(c -> variables.put("before", c));
        }

        log.debug("Fetching {} page of star list {} (cursor: {})", direction, properties.listId(), cursor.orElse("-"));

        JsonNode response;
        try {
            response = restClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("query", PAGE_QUERY, "variables", variables))
                .retrieve()
                .body(JsonNode.class);
        } catch (HttpServerErrorException | ResourceAccessException e) {
            log.warn("GitHub API call failed, may retry: {}", e.getMessage());
            throw new StarSourceUnavailableException("GitHub API unavailable: " + e.getMessage(), e);
        } catch (RestClientResponseException e) {
            throw new StarSourceException(
                "GitHub API returned " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new StarSourceException("Could not read GitHub API response: " + e.getMessage(), e);
        }

        return parsePage(response);
    }

    RepoPage parsePage(JsonNode response) {
        if (response == null) {
            throw new StarSourceException("GitHub API returned an empty body");
        }

        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new StarSourceException("GraphQL error: " + errors.get(0).path("message").asText());
        }

        JsonNode items = response.path("data").path("node").path("items");
        if (items.isMissingNode() || items.isNull()) {
            throw new StarSourceException("Star list " + properties.listId() + " not found");
        }

        List<StarredRepo> repos = new ArrayList<>();
        for (JsonNode node : items.path("nodes")) {
            // Non-repository list entries come back as empty objects.
            if (node.hasNonNull("name")) {
                repos.add(toRepo(node));
            }
        }

        JsonNode pageInfo = items.path("pageInfo");
        return new RepoPage(
            repos,
            items.path("totalCount").asInt(),
            new RepoPage.PageInfo(
                pageInfo.path("hasNextPage").asBoolean(false),
                textOrNull(pageInfo, "endCursor"),
                pageInfo.path("hasPreviousPage").asBoolean(false),
                textOrNull(pageInfo, "startCursor")
            )
        );
    }

    private StarredRepo toRepo(JsonNode node) {
        List<String> topics = new ArrayList<>();
        for (JsonNode topic : node.path("repositoryTopics").path("nodes")) {
            String topicName = textOrNull(topic.path("topic"), "name");
            if (topicName != null) {
                topics.add(topicName);
            }
        }

        return StarredRepo.fetched(
            node.path("owner").path("login").asText(),
            node.path("name").asText(),
            textOrNull(node, "description"),
            node.path("url").asText(),
            blankToNull(textOrNull(node, "homepageUrl")),
            node.path("stargazerCount").asInt(),
            textOrNull(node.path("primaryLanguage"), "name"),
            topics,
            readmeExcerpt(textOrNull(node.path("object"), "text"))
        );
    }

    private String readmeExcerpt(String readme) {
        if (readme == null || readme.isEmpty()) {
            return null;
        }
        int max = properties.readmeMaxChars();
        return readme.length() > max ? readme.substring(0, max) : readme;
    }

    private static String textOrNull(JsonNode parent, String field) {
        JsonNode value = parent.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
