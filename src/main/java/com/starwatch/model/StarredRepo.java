package com.starwatch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One repository of the star list, with the AI enrichment attached by the sync pipeline.
 *
 * <p>{@code fullName} ({@code owner/name}) is the key of every store write.
 * Equality compares the embedding by content.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StarredRepo(
    String owner,
    String name,
    @JsonProperty("full_name") String fullName,
    String description,
    String url,
    @JsonProperty("homepage_url") String homepageUrl,
    int stars,
    String language,
    List<String> topics,
    @JsonProperty("readme_excerpt") String readmeExcerpt,
    @JsonProperty("ai_summary") String aiSummary,
    @JsonProperty("ai_categories") List<String> aiCategories,
    float[] embedding,
    @JsonProperty("fetched_at") OffsetDateTime fetchedAt,
    @JsonProperty("enriched_at") OffsetDateTime enrichedAt
) {

    public StarredRepo {
        topics = topics == null ? List.of() : List.copyOf(topics);
        aiCategories = aiCategories == null ? List.of() : List.copyOf(aiCategories);
        if (fullName == null && owner != null && name != null) {
            fullName = owner + "/" + name;
        }
    }

    /**
     * Repository as it comes from the source, without enrichment.
     */
    public static StarredRepo fetched(
        String owner,
        String name,
        String description,
        String url,
        String homepageUrl,
        int stars,
        String language,
        List<String> topics,
        String readmeExcerpt
    ) {
        return new StarredRepo(owner, name, owner + "/" + name, description, url, homepageUrl, stars,
            language, topics, readmeExcerpt, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isEnriched() {
        return aiSummary != null;
    }

    @JsonIgnore
    public boolean isEmbedded() {
        return embedding != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StarredRepo other)) return false;
        return stars == other.stars
            && Objects.equals(owner, other.owner)
            && Objects.equals(name, other.name)
            && Objects.equals(fullName, other.fullName)
            && Objects.equals(description, other.description)
            && Objects.equals(url, other.url)
            && Objects.equals(homepageUrl, other.homepageUrl)
            && Objects.equals(language, other.language)
            && Objects.equals(topics, other.topics)
            && Objects.equals(readmeExcerpt, other.readmeExcerpt)
            && Objects.equals(aiSummary, other.aiSummary)
            && Objects.equals(aiCategories, other.aiCategories)
            && Arrays.equals(embedding, other.embedding)
            && Objects.equals(fetchedAt, other.fetchedAt)
            && Objects.equals(enrichedAt, other.enrichedAt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(owner, name, fullName, description, url, homepageUrl, stars, language, topics,
            readmeExcerpt, aiSummary, aiCategories, fetchedAt, enrichedAt);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "StarredRepo[fullName=" + fullName + ", stars=" + stars + ", enriched=" + isEnriched()
            + ", embedded=" + isEmbedded() + "]";
    }
}
