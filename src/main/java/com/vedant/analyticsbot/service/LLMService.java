package com.vedant.analyticsbot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.analyticsbot.config.LlmConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.*;

/**
 * Thin client for an OpenAI-compatible chat completions endpoint
 * (OpenRouter by default). Prompt in, text out.
 */
@Service
public class LLMService {

    private static final Logger log = LoggerFactory.getLogger(LLMService.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private volatile LlmConfig config;

    public LLMService(LlmConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    public record LlmCompletion(String text, int promptTokens, int completionTokens, boolean usageReported) {}

    public boolean isConfigured() {
        return config.isConfigured();
    }

    public LlmConfig getConfig() {
        return config;
    }

    public void updateConfig(LlmConfig newConfig) {
        this.config = Objects.requireNonNull(newConfig);
        log.info("LLM config updated: {}", newConfig);
    }

    public LlmCompletion complete(String systemPrompt, String userPrompt, double temperature, int maxTokens) throws LlmException {
        LlmConfig cfg = this.config;
        if (!cfg.isConfigured()) {
            throw new LlmException("LLM API key is not configured");
        }

        String body;
        try {
            Map<String, Object> payload = new HashMap<>();
            payload.put("model", cfg.model());
            payload.put("temperature", temperature);
            payload.put("max_tokens", maxTokens);
            payload.put("messages", List.of(
                    Map.of("role", "system", "content", systemPrompt),
                    Map.of("role", "user", "content", userPrompt)
            ));
            body = mapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new LlmException("Could not encode LLM request", e);
        }

        log.debug("=== LLM REQUEST ===\n{}\n===================", userPrompt);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(cfg.apiUrl()))
                .timeout(Duration.ofSeconds(cfg.timeoutSeconds()))
                .header("Authorization", "Bearer " + cfg.apiKey())
                .header("Content-Type", "application/json")
                .header("HTTP-Referer", "http://localhost")
                .header("X-Title", "AnalyticsBot")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new LlmException("LLM request timed out after " + cfg.timeoutSeconds() + "s", e);
        } catch (IOException e) {
            throw new LlmException("LLM request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("LLM request interrupted", e);
        }

        log.debug("=== LLM RAW RESPONSE ===\n{}\n========================", response.body());

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.error("LLM returned non-2xx status: {}", response.statusCode());
            throw new LlmException("LLM returned status " + response.statusCode());
        }

        return parse(response.body());
    }

    private LlmCompletion parse(String responseBody) throws LlmException {
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (IOException e) {
            throw new LlmException("LLM response is not valid JSON", e);
        }

        JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
        if (contentNode.isMissingNode() || contentNode.isNull()) {
            throw new LlmException("LLM response missing 'message.content'");
        }

        JsonNode usage = root.path("usage");
        boolean reported = usage.isObject();
        return new LlmCompletion(
                contentNode.asText().trim(),
                usage.path("prompt_tokens").asInt(0),
                usage.path("completion_tokens").asInt(0),
                reported);
    }
}
