package com.starwatch.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LangChainConfig {

    public static final int EMBEDDING_DIMENSION = 768;

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Value("${app.gemini.chat-model:gemini-2.0-flash}")
    private String chatModelName;

    @Value("${app.gemini.embedding-model:gemini-embedding-001}")
    private String embeddingModelName;

    @Bean
    public ChatModel chatLanguageModel() {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(apiKey)
            .modelName(chatModelName)
            .temperature(0.3)
            .timeout(Duration.ofSeconds(60))
            .maxRetries(3)
            .build();
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        return GoogleAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName(embeddingModelName)
            .outputDimensionality(EMBEDDING_DIMENSION)
            .maxRetries(3)
            .build();
    }
}
