package com.starwatch.service;

import com.starwatch.exception.EmbeddingException;
import com.starwatch.infra.InMemoryDualRateLimiter;
import com.starwatch.infra.RateLimiter;
import com.starwatch.model.IndexedEmbedding;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@SpringBootTest(
    classes = {EmbeddingServiceImpl.class, EmbeddingServiceTest.RetryTestConfig.class},
    properties = {"app.embedding.max-attempts=3", "app.embedding.retry-delay-ms=1"}
)
class EmbeddingServiceTest {

    @TestConfiguration
    @EnableRetry
    static class RetryTestConfig {

        @Bean
        RateLimiter embeddingLimiter() {
            return new InMemoryDualRateLimiter(10_000, 10_000_000);
        }
    }

    @Autowired
    private EmbeddingService embeddingService;

    @MockitoBean
    private EmbeddingModel embeddingModel;

    @Test
    @DisplayName("Should retry a retriable failure and then succeed")
    void shouldRetryAndEventuallySucceed() {
        when(embeddingModel.embedAll(anyList()))
            .thenThrow(new RetriableException("API Timeout"))
            .thenReturn(Response.from(List.of(Embedding.from(new float[]{1f}), Embedding.from(new float[]{2f}))));

        List<IndexedEmbedding> result = embeddingService.embed(List.of("a", "b"));

        verify(embeddingModel, times(2)).embedAll(anyList());
        assertThat(result).extracting(IndexedEmbedding::index).containsExactly(0, 1);
        assertThat(result.get(1).vector()).containsExactly(2f);
    }

    @Test
    @DisplayName("Should give up with EmbeddingException after the last attempt")
    void shouldRecoverAfterExhaustingRetries() {
        when(embeddingModel.embedAll(anyList())).thenThrow(new RetriableException("Gemini is down"));

        assertThatThrownBy(() -> embeddingService.embed(List.of("a")))
            .isInstanceOf(EmbeddingException.class)
            .hasMessageContaining("batch vectorization");

        verify(embeddingModel, times(3)).embedAll(anyList());
    }

    @Test
    @DisplayName("Should not retry non-retriable exceptions")
    void shouldNotRetryOnFatalErrors() {
        when(embeddingModel.embedAll(anyList())).thenThrow(new IllegalArgumentException("Fatal developer error"));

        assertThatThrownBy(() -> embeddingService.embed(List.of("a")))
            .isInstanceOf(EmbeddingException.class)
            .hasRootCauseMessage("Fatal developer error");

        verify(embeddingModel, times(1)).embedAll(anyList());
    }

    @Test
    @DisplayName("Should fail when the model returns fewer vectors than texts")
    void shouldFailOnMismatch() {
        when(embeddingModel.embedAll(anyList())).thenReturn(Response.from(List.of(Embedding.from(new float[]{1f}))));

        assertThatThrownBy(() -> embeddingService.embed(List.of("a", "b")))
            .isInstanceOf(EmbeddingException.class)
            .hasMessageContaining("1 vectors for 2 texts");
    }

    @Test
    @DisplayName("Should not call the model for an empty batch")
    void shouldHandleEmptyBatch() {
        assertThat(embeddingService.embed(List.of())).isEmpty();
        verifyNoInteractions(embeddingModel);
    }

    @Nested
    @DisplayName("embedQuery tests")
    class EmbedQueryTests {

        @Test
        @DisplayName("Should return vector for a trimmed query")
        void shouldReturnVectorForValidQuery() {
            float[] expectedVector = new float[]{0.5f, 0.1f};
            when(embeddingModel.embed("vector database")).thenReturn(Response.from(Embedding.from(expectedVector)));

            float[] result = embeddingService.embedQuery("  vector database ");

            assertThat(result).isEqualTo(expectedVector);
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\n", "\t"})
        @DisplayName("Should throw exception for null, empty or blank input")
        void shouldThrowExceptionForEmptyInput(String input) {
            assertThatThrownBy(() -> embeddingService.embedQuery(input))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Query cannot be empty");
        }

        @Test
        @DisplayName("Should truncate query if it exceeds 1000 characters")
        void shouldTruncateLongQuery() {
            String longQuery = "a".repeat(1100);
            String truncated = "a".repeat(1000);
            when(embeddingModel.embed(truncated)).thenReturn(Response.from(Embedding.from(new float[]{1f})));

            embeddingService.embedQuery(longQuery);

            verify(embeddingModel).embed(truncated);
            verify(embeddingModel, never()).embed(longQuery);
        }

        @Test
        @DisplayName("Should throw EmbeddingException if model returns empty vector")
        void shouldThrowExceptionWhenModelReturnsEmptyVector() {
            when(embeddingModel.embed(anyString())).thenReturn(Response.from(Embedding.from(new float[0])));

            assertThatThrownBy(() -> embeddingService.embedQuery("some query"))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("Error during query vectorization");
        }
    }
}
