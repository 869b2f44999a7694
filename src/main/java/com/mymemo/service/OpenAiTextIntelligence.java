package com.mymemo.service;

import com.mymemo.config.BotConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

@Singleton
public class OpenAiTextIntelligence implements TextIntelligence {
    private static final Logger log = LoggerFactory.getLogger(OpenAiTextIntelligence.class);

    static final String SUMMARY_PROMPT = "You summarise reminder texts in one short sentence.";
    static final String CLASSIFY_PROMPT = "Classify the user's request for a reminder bot. "
            + "Reply with exactly one label: add_reminder, list_reminders, delete_reminder, "
            + "clear_reminders, help, or unknown.";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final URI completionsUri;
    private final Duration classifyTimeout;
    private final Duration summarizeTimeout;

    @Inject
    public OpenAiTextIntelligence(BotConfig config, HttpClient httpClient) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.apiKey = config.getOpenAiApiKey();
        this.model = config.getOpenAiModel();
        this.completionsUri = URI.create(stripTrailingSlash(config.getOpenAiApiBase()) + "/chat/completions");
        this.classifyTimeout = config.getOpenAiClassifyTimeout();
        this.summarizeTimeout = config.getOpenAiSummarizeTimeout();
        log.info("OpenAI text intelligence enabled with model {}", model);
    }

    @Override
    public CompletableFuture<String> classifyIntent(String text) {
        if (text == null || text.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("content cannot be empty"));
        }
        return complete(CLASSIFY_PROMPT, text, 0.0, 8, classifyTimeout)
                .thenApply(label -> {
                    log.debug("Intent label from model: {}", label);
                    return label;
                });
    }

    @Override
    public CompletableFuture<String> summarize(String text) {
        if (text == null || text.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("content cannot be empty"));
        }
        String userPrompt = "Summarise the following reminder in one sentence: " + text;
        return complete(SUMMARY_PROMPT, userPrompt, 0.3, 60, summarizeTimeout);
    }

    private CompletableFuture<String> complete(String systemPrompt, String userPrompt,
                                               double temperature, int maxTokens, Duration timeout) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(completionsUri)
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(
                            buildRequestBody(systemPrompt, userPrompt, temperature, maxTokens)))
                    .build();
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(this::extractContent);
    }

    String buildRequestBody(String systemPrompt, String userPrompt,
                            double temperature, int maxTokens) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        body.put("temperature", temperature);
        body.put("max_completion_tokens", maxTokens);
        return objectMapper.writeValueAsString(body);
    }

    private String extractContent(HttpResponse<String> response) {
        if (response.statusCode() / 100 != 2) {
            throw new IllegalStateException("OpenAI request failed with status " + response.statusCode());
        }
        try {
            JsonNode root = objectMapper.readTree(response.body());
            JsonNode choices = root.path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                throw new IllegalStateException("no completion received");
            }
            return choices.get(0).path("message").path("content").asText("").trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid OpenAI response", e);
        }
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
