package com.openforge.memkeep.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memkeep.llm.model.ChatRequest;
import com.openforge.memkeep.llm.model.ChatResponse;
import com.openforge.memkeep.llm.model.Message;
import com.openforge.memkeep.stream.ConversationTurn;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * High-availability {@link ReasoningService} over OpenAI-compatible providers.
 *
 * Call graph (text and vision):
 *
 *   generate(system, turns, config)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryLlmClient.chat(request)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry      (only when configured)
 *           └─ fallbackLlmClient.chat(request)
 *
 * Model selection per purpose happens here, once per provider:
 *   CLASSIFICATION / ANALYTICAL → sifter model, VISION → vision model, else chat model.
 */
@Slf4j
@Component
public class LlmRouter implements ReasoningService {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this.primaryClient  = properties.primary() != null && properties.primary().isConfigured()
                ? new LlmClient(httpClient, objectMapper, properties.primary()) : null;
        this.fallbackClient = properties.fallback() != null && properties.fallback().isConfigured()
                ? new LlmClient(httpClient, objectMapper, properties.fallback()) : null;
        this.primaryCb      = primaryLlmCircuitBreaker;
        this.fallbackCb     = fallbackLlmCircuitBreaker;
        this.primaryRetry   = primaryLlmRetry;
        this.fallbackRetry  = fallbackLlmRetry;
        if (primaryClient == null) {
            log.warn("[LlmRouter] Primary provider is not configured — reasoning calls will degrade.");
        }
    }

    // ── ReasoningService ─────────────────────────────────────────────────────

    @Override
    public String generate(String systemContext, List<ConversationTurn> turns, GenerationConfig config) {
        List<Message> messages = toMessages(systemContext, turns);
        ChatResponse response = route(config,
                client -> client.chat(buildRequest(client, messages, config)));
        return textOf(response, config);
    }

    @Override
    public String generateWithImage(String systemContext,
                                    List<ConversationTurn> turns,
                                    ImageInput image,
                                    GenerationConfig config) {
        // The trailing user turn becomes the text part of the image message.
        List<ConversationTurn> history = new ArrayList<>(turns);
        String userText = "";
        if (!history.isEmpty() && history.get(history.size() - 1).role() == ConversationTurn.Role.USER) {
            userText = history.remove(history.size() - 1).text();
        }
        List<Message> messages = toMessages(systemContext, history);
        String finalUserText = userText;
        ChatResponse response = route(config,
                client -> client.chatWithImage(buildRequest(client, messages, config), finalUserText, image));
        return textOf(response, config);
    }

    // ── Routing ──────────────────────────────────────────────────────────────

    private ChatResponse route(GenerationConfig config, Function<LlmClient, ChatResponse> call) {
        if (primaryClient == null && fallbackClient == null) {
            throw new LlmClient.LlmException("No reasoning provider configured");
        }
        if (primaryClient == null) {
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> call.apply(fallbackClient), "fallback");
        }
        try {
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> call.apply(primaryClient), "primary");
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null) {
                throw primaryException;
            }
            log.warn("[LlmRouter] Primary provider failed for {} ({}), engaging fallback. Cause: {}",
                    config.purpose(), primaryException.getClass().getSimpleName(), primaryException.getMessage());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> call.apply(fallbackClient), "fallback");
        }
    }

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     * Fully programmatic — no AOP proxies, no annotations.
     */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               String label) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (RuntimeException e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static ChatRequest buildRequest(LlmClient client, List<Message> messages, GenerationConfig config) {
        LlmProperties.ProviderConfig provider = client.config();
        String model;
        if (config.purpose() == InferencePurpose.VISION) {
            model = provider.visionModelOrDefault();
        } else if (config.purpose().usesSifterModel()) {
            model = provider.sifterModelOrDefault();
        } else {
            model = provider.model();
        }
        return ChatRequest.of(model, messages, config.temperature(), config.maxOutputTokens());
    }

    private static List<Message> toMessages(String systemContext, List<ConversationTurn> turns) {
        List<Message> messages = new ArrayList<>(turns.size() + 1);
        if (systemContext != null && !systemContext.isBlank()) {
            messages.add(Message.system(systemContext));
        }
        for (ConversationTurn turn : turns) {
            messages.add(new Message(turn.role().wireName(), turn.text()));
        }
        return messages;
    }

    private static String textOf(ChatResponse response, GenerationConfig config) {
        if (response.usage() != null) {
            log.info("[Token Usage] {}: prompt={} completion={} total={}",
                    config.purpose(),
                    response.usage().promptTokens(),
                    response.usage().completionTokens(),
                    response.usage().totalTokens());
        }
        return response.text();
    }
}
