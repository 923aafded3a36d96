package com.starwatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starwatch.exception.SummaryGenerationException;
import com.starwatch.exception.SyncCancelledException;
import com.starwatch.infra.RateLimiter;
import com.starwatch.model.StarredRepo;
import com.starwatch.model.SummaryResult;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class SummaryGeneratorServiceImpl implements SummaryGeneratorService {

    public static final String CHAT_LIMIT = "chat_limit";

    private static final String SUMMARY_PROMPT_TEMPLATE =
        """
            You are a technical analyst. Given a GitHub repository's name, description, and README excerpt, produce a JSON object with:

            1. "summary": A 2-3 sentence summary of what the repo does, its main use case, and why it's notable.
            2. "categories": An array of 1-3 categories from this list:
               LLM Framework, Vector Database, ML Training, NLP, Computer Vision, AI Agent, RAG, Model Serving, Data Pipeline, Developer Tool, Library/SDK, Research, Observability, Other

            Return ONLY valid JSON. No markdown, no code fences.

            %s
            """;

    private final ChatModel chatModel;
    private final RateLimiter chatLimiter;
    private final ObjectMapper objectMapper;

    public SummaryGeneratorServiceImpl(
        ChatModel chatModel,
        @Qualifier("chatLimiter") RateLimiter chatLimiter,
        ObjectMapper objectMapper
    ) {
        this.chatModel = chatModel;
        this.chatLimiter = chatLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public SummaryResult summarize(StarredRepo repo) {
        String prompt = String.format(SUMMARY_PROMPT_TEMPLATE, describe(repo));
        log.debug("Requesting summary for {}", repo.fullName());

        String answer;
        try {
            answer = chatLimiter.execute(CHAT_LIMIT, 1, () -> chatModel.chat(prompt));
        } catch (SyncCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SummaryGenerationException(repo.fullName(), e.getMessage(), e);
        }

        return parse(repo.fullName(), answer);
    }

    private static String describe(StarredRepo repo) {
        List<String> parts = new ArrayList<>();
        parts.add("Repository: " + repo.fullName());
        if (repo.description() != null) {
            parts.add("Description: " + repo.description());
        }
        if (repo.readmeExcerpt() != null) {
            parts.add("README excerpt:\n" + repo.readmeExcerpt());
        }
        return String.join("\n\n", parts);
    }

    SummaryResult parse(String fullName, String answer) {
        if (answer == null || answer.isBlank()) {
            throw new SummaryGenerationException(fullName, "empty model answer", null);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFences(answer));
        } catch (JsonProcessingException e) {
            throw new SummaryGenerationException(fullName, "answer is not JSON: " + answer, e);
        }

        String summary = root.path("summary").asText("").trim();
        if (summary.isEmpty()) {
            throw new SummaryGenerationException(fullName, "answer has no summary: " + answer, null);
        }

        List<String> categories = new ArrayList<>();
        for (JsonNode category : root.path("categories")) {
            String value = category.asText("").trim();
            if (!value.isEmpty()) {
                categories.add(value);
            }
        }

        return new SummaryResult(summary, categories);
    }

    // Some models wrap JSON in ``` fences even when told not to.
    static String stripCodeFences(String answer) {
        String text = answer.trim();
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        text = firstNewline == -1 ? "" : text.substring(firstNewline + 1);
        int closing = text.lastIndexOf("```");
        if (closing != -1) {
            text = text.substring(0, closing);
        }
        return text.trim();
    }
}
