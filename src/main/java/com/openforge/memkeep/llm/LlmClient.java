package com.openforge.memkeep.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.memkeep.llm.model.ChatRequest;
import com.openforge.memkeep.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Zero-dependency, stateless LLM HTTP client for one OpenAI-compatible provider.
 *
 * Two modes of operation:
 *
 *  chat()          — text-only chat completion.
 *  chatWithImage() — same endpoint, the last user message carries an image part.
 *
 * Both methods are synchronous.  The scheduler runs them on a background thread
 * and enforces its own hard deadline on top of the per-request HTTP timeout.
 */
@Slf4j
public class LlmClient {

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Blocking (non-streaming) chat completion.
     */
    public ChatResponse chat(ChatRequest request) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()));
        }
        String requestBody = serialize(request);
        log.debug("[LlmClient:{}] → chat POST model={} body-length={}",
                config.name(), request.model(), requestBody.length());

        return parseFullResponse(sendBlocking(buildHttpRequest(requestBody)));
    }

    /**
     * Vision chat completion.  The message list is serialized as usual, then the
     * trailing user message is rewritten into the multi-part content form:
     *
     *   {"role":"user","content":[{"type":"text","text":"…"},
     *                             {"type":"image_url","image_url":{"url":"data:…"}}]}
     */
    public ChatResponse chatWithImage(ChatRequest request, String userText, ImageInput image) {
        ObjectNode root = objectMapper.valueToTree(request);
        ArrayNode messages = root.has("messages")
                ? (ArrayNode) root.get("messages")
                : root.putArray("messages");

        ObjectNode imageMessage = objectMapper.createObjectNode();
        imageMessage.put("role", "user");
        ArrayNode parts = imageMessage.putArray("content");
        parts.addObject().put("type", "text").put("text", userText);
        parts.addObject().put("type", "image_url")
                .putObject("image_url").put("url", image.toDataUrl());
        messages.add(imageMessage);

        String requestBody = serialize(root);
        log.debug("[LlmClient:{}] → vision POST model={} image-bytes={}",
                config.name(), request.model(), image.data().length);

        return parseFullResponse(sendBlocking(buildHttpRequest(requestBody)));
    }

    /** The chat model configured for this provider. */
    public String modelName() {
        return config.model();
    }

    public LlmProperties.ProviderConfig config() {
        return config;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted calling provider [%s]".formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]".formatted(config.name()), e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException(
                "Rate-limited by provider [%s].".formatted(config.name()));
        if (status < 200 || status >= 300) throw new LlmException(
                "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, abbreviate(body)));

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]: %s".formatted(config.name(), abbreviate(body)), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 2048 ? body : body.substring(0, 2048) + "…";
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
