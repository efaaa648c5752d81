package com.openforge.memkeep.intake;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memkeep.graph.GraphExtraction;
import com.openforge.memkeep.graph.GraphMemoryService;
import com.openforge.memkeep.llm.InferencePurpose;
import com.openforge.memkeep.llm.ModelReplies;
import com.openforge.memkeep.memory.MemoryStore;
import com.openforge.memkeep.scheduler.InferenceRequest;
import com.openforge.memkeep.scheduler.InferenceScheduler;
import com.openforge.memkeep.stream.ConversationTurn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Decides, off the request thread, whether a message is worth remembering.
 *
 * YES → the message becomes an experience record and its entities and
 * relationships are folded into the graph.  Nothing here ever reaches the
 * caller: every failure ends in a log line.
 */
@Slf4j
@Component
public class IntakeValve {

    private static final String CLASSIFY_PROMPT =
            "Classify if the following message contains important facts, preferences, or patterns "
                    + "to remember long-term. Respond ONLY with \"YES\" or \"NO\".";

    private static final String EXTRACT_PROMPT = """
            Extract the key entities and relationships from the message.
            Respond ONLY with raw JSON, no markdown:
            {"entities":[{"label":"name","type":"person|place|concept|preference|event|object"}],
             "relationships":[{"source":"name","target":"name","relationship":"verb phrase"}]}
            Use short lower-case labels. Use "user" for the person speaking.
            """;

    private final InferenceScheduler scheduler;
    private final MemoryStore        memoryStore;
    private final GraphMemoryService graph;
    private final ObjectMapper       objectMapper;
    private final Executor           executor;

    public IntakeValve(InferenceScheduler scheduler,
                       MemoryStore memoryStore,
                       GraphMemoryService graph,
                       ObjectMapper objectMapper,
                       @Qualifier("agentBackgroundExecutor") Executor executor) {
        this.scheduler    = scheduler;
        this.memoryStore  = memoryStore;
        this.graph        = graph;
        this.objectMapper = objectMapper;
        this.executor     = executor;
    }

    /** Fire-and-forget. */
    public void submit(String message) {
        if (message == null || message.isBlank()) {
            return;
        }
        try {
            executor.execute(() -> process(message));
        } catch (RejectedExecutionException e) {
            log.warn("[Intake] Background executor saturated, message not classified.");
        }
    }

    /**
     * The synchronous body of {@link #submit(String)}.
     *
     * @return true when the message was judged worth remembering
     */
    public boolean process(String message) {
        try {
            String decision = scheduler.schedule(InferencePurpose.CLASSIFICATION,
                    new InferenceRequest(CLASSIFY_PROMPT, List.of(ConversationTurn.user(message)), null));
            if (!decision.toUpperCase(Locale.ROOT).contains("YES")) {
                return false;
            }
            memoryStore.saveExperience(message);
            log.info("[Intake] Fact recorded to experience memory.");

            extract(message).ifPresent(graph::upsert);
            return true;
        } catch (RuntimeException e) {
            log.error("[Intake] Processing failed: {}", e.getMessage(), e);
            return false;
        }
    }

    private Optional<GraphExtraction> extract(String message) {
        String raw = scheduler.schedule(InferencePurpose.ANALYTICAL,
                new InferenceRequest(EXTRACT_PROMPT, List.of(ConversationTurn.user(message)), null));
        Optional<String> json = ModelReplies.extractJsonObject(raw);
        if (json.isEmpty()) {
            log.warn("[Intake] No graph JSON in extraction output, skipping graph update.");
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json.get(), GraphExtraction.class));
        } catch (JsonProcessingException e) {
            log.warn("[Intake] Unparsable graph extraction, skipping graph update: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
