package com.starwatch.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class StarredRepoTest {

    @Test
    @DisplayName("Repos with equal vectors should be equal and hash alike")
    void shouldCompareEmbeddingByContent() {
        StarredRepo first = embedded(new float[]{0.1f, 0.2f});
        StarredRepo second = embedded(new float[]{0.1f, 0.2f});

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(Set.of(first)).contains(second);
    }

    @Test
    @DisplayName("Repos with different vectors should differ")
    void shouldDistinguishEmbeddings() {
        assertThat(embedded(new float[]{0.1f, 0.2f})).isNotEqualTo(embedded(new float[]{0.2f, 0.1f}));
        assertThat(embedded(new float[]{0.1f})).isNotEqualTo(embedded(null));
    }

    @Test
    @DisplayName("Should report enrichment and embedding state")
    void shouldReportState() {
        StarredRepo fetched = StarredRepo.fetched("pgvector", "pgvector", null, "https://github.com/pgvector/pgvector",
            null, 1, null, null, null);

        assertThat(fetched.fullName()).isEqualTo("pgvector/pgvector");
        assertThat(fetched.topics()).isEmpty();
        assertThat(fetched.isEnriched()).isFalse();
        assertThat(fetched.isEmbedded()).isFalse();
        assertThat(embedded(new float[]{1f}).isEnriched()).isTrue();
        assertThat(embedded(new float[]{1f}).isEmbedded()).isTrue();
    }

    private static StarredRepo embedded(float[] vector) {
        return new StarredRepo("pgvector", "pgvector", null, null, "https://github.com/pgvector/pgvector", null, 1,
            "C", List.of("postgres"), null, "Vector search.", List.of("Vector Database"), vector, null, null);
    }
}
