package com.openforge.memkeep.stream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The Stream: the ordered, in-memory conversation buffer.
 *
 * Every mutation rewrites a JSON snapshot file so the buffer survives a restart.
 * Snapshot I/O failures are logged and never reach the caller; on startup a
 * missing or unreadable file yields an empty buffer.
 *
 * All public methods are synchronized on this instance.
 */
@Slf4j
@Component
public class StreamManager {

    private static final TypeReference<List<ConversationTurn>> TURN_LIST = new TypeReference<>() {};

    private final StreamProperties properties;
    private final ObjectMapper     objectMapper;
    private final Path             streamFile;

    private final List<ConversationTurn> turns = new ArrayList<>();

    public StreamManager(StreamProperties properties, ObjectMapper objectMapper) {
        this.properties   = properties;
        this.objectMapper = objectMapper;
        this.streamFile   = Path.of(properties.streamFile());
        rehydrate();
    }

    // ── Token accounting ─────────────────────────────────────────────────────

    /** ceil(length / 4) per turn; deterministic and additive across turns. */
    public static int estimateTokens(String text) {
        return text == null ? 0 : (text.length() + 3) / 4;
    }

    public synchronized int estimateTokens() {
        int total = 0;
        for (ConversationTurn turn : turns) {
            total += estimateTokens(turn.text());
        }
        return total;
    }

    public synchronized boolean isOverBudget() {
        return isOverBudget(properties.contextCap());
    }

    public synchronized boolean isOverBudget(int contextCap) {
        return estimateTokens() > contextCap * properties.capacityFraction();
    }

    // ── Buffer operations ────────────────────────────────────────────────────

    public synchronized void append(ConversationTurn... newTurns) {
        for (ConversationTurn turn : newTurns) {
            turns.add(turn);
        }
        persist();
    }

    /** Last {@code n} turns, oldest first. */
    public synchronized List<ConversationTurn> recent(int n) {
        int from = Math.max(0, turns.size() - Math.max(0, n));
        return List.copyOf(turns.subList(from, turns.size()));
    }

    public synchronized List<ConversationTurn> snapshot() {
        return List.copyOf(turns);
    }

    public synchronized void replace(List<ConversationTurn> replacement) {
        turns.clear();
        turns.addAll(replacement);
        persist();
    }

    public synchronized void clear() {
        turns.clear();
        persist();
    }

    public synchronized int size() {
        return turns.size();
    }

    public StreamProperties properties() {
        return properties;
    }

    // ── File snapshot ────────────────────────────────────────────────────────

    private void rehydrate() {
        if (!Files.exists(streamFile)) {
            log.info("[Stream] No stream file at {}, starting empty.", streamFile);
            return;
        }
        try {
            List<ConversationTurn> loaded = objectMapper.readValue(streamFile.toFile(), TURN_LIST);
            if (loaded != null) {
                turns.addAll(loaded);
            }
            log.info("[Stream] Rehydrated {} turns from {}.", turns.size(), streamFile);
        } catch (IOException | RuntimeException e) {
            turns.clear();
            log.warn("[Stream] Could not read stream file {}, starting empty: {}", streamFile, e.getMessage());
        }
    }

    private void persist() {
        try {
            Path parent = streamFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(streamFile.toFile(), turns);
        } catch (IOException e) {
            log.warn("[Stream] Failed to write stream file {}: {}", streamFile, e.getMessage());
        }
    }
}
