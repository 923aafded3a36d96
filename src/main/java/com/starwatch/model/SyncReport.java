package com.starwatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SyncReport(
    @JsonProperty("fetch_source") FetchSource fetchSource,
    int resolved,
    @JsonProperty("new_repos") int newRepos,
    int upserted,
    @JsonProperty("enrichment_targets") int enrichmentTargets,
    int enriched,
    @JsonProperty("embedding_targets") int embeddingTargets,
    int embedded
) {}
