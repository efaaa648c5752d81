package com.openforge.memkeep.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Telegram Bot HTTP API over the shared {@link HttpClient}.
 *
 *  sendMessage()  — POST /bot{token}/sendMessage
 *  fetchUpdates() — POST /bot{token}/getUpdates, used by the inbound poller
 */
@Slf4j
@Component
public class TelegramGateway implements MessagingGateway {

    private final HttpClient         httpClient;
    private final ObjectMapper       objectMapper;
    private final TelegramProperties properties;
    private final AtomicBoolean      missingConfigLogged = new AtomicBoolean();

    public TelegramGateway(HttpClient httpClient, ObjectMapper objectMapper, TelegramProperties properties) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.properties   = properties;
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    public String defaultChannel() {
        return properties.chatId();
    }

    @Override
    public void sendMessage(String channel, String text) {
        requireConfigured();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("chat_id", channel);
        body.put("text", text);
        JsonNode response = call("sendMessage", body);
        log.info("[Telegram] Sent message {} to chat {}.",
                response.path("result").path("message_id").asText("?"), channel);
    }

    /**
     * Long-poll style fetch of pending updates.
     *
     * @param offset first update id not yet processed
     */
    public List<InboundMessage> fetchUpdates(long offset) {
        requireConfigured();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("offset", offset);
        body.put("timeout", 0);
        body.putArray("allowed_updates").add("message");
        JsonNode response = call("getUpdates", body);

        List<InboundMessage> messages = new ArrayList<>();
        for (JsonNode update : response.path("result")) {
            JsonNode message = update.path("message");
            messages.add(new InboundMessage(
                    update.path("update_id").asLong(),
                    message.path("chat").path("id").asText(""),
                    message.path("text").asText(""),
                    message.path("from").path("first_name").asText("")));
        }
        return messages;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void requireConfigured() {
        if (isConfigured()) {
            return;
        }
        if (missingConfigLogged.compareAndSet(false, true)) {
            log.warn("[Telegram] Not configured: set agent.telegram.bot-token and agent.telegram.chat-id.");
        }
        throw new GatewayException("Telegram not configured.");
    }

    private JsonNode call(String method, ObjectNode body) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(properties.apiBaseUrl() + "/bot" + properties.botToken() + "/" + method))
                    .timeout(properties.requestTimeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new GatewayException("Failed to serialize Telegram request", e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Telegram " + method + " interrupted", e);
        } catch (IOException e) {
            throw new GatewayException("Telegram " + method + " failed: " + e.getMessage(), e);
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new GatewayException("Telegram " + method + " returned HTTP " + response.statusCode(), e);
        }
        if (!json.path("ok").asBoolean(false)) {
            throw new GatewayException("Telegram %s failed: %s".formatted(
                    method, json.path("description").asText("HTTP " + response.statusCode())));
        }
        return json;
    }

    public record InboundMessage(long updateId, String chatId, String text, String senderName) {}
}
