package com.openforge.memkeep.consolidation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memkeep.graph.GraphMemoryService;
import com.openforge.memkeep.graph.PruneReport;
import com.openforge.memkeep.llm.InferencePurpose;
import com.openforge.memkeep.llm.ModelReplies;
import com.openforge.memkeep.memory.MemoryStore;
import com.openforge.memkeep.scheduler.InferenceRequest;
import com.openforge.memkeep.scheduler.InferenceScheduler;
import com.openforge.memkeep.stream.ConversationTurn;
import com.openforge.memkeep.stream.StreamManager;
import com.openforge.memkeep.stream.StreamProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The sleep cycle: Snapshot → Sift → Persist &amp; Decay → Flush.
 *
 * When the Sifter's reply cannot be used, the raw snapshot is stored verbatim
 * as an experience before the stream is truncated.  If even that write fails
 * (data access error, or no transaction could be opened) the stream is left
 * as it was.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsolidationEngine {

    public static final String SUMMARY_PREFIX = "[CONSOLIDATION SUMMARY] ";

    private static final String SIFTER_PROMPT = """
            You are 'The Sifter', an independent analytical observer. You are NOT the assistant.
            Analyze this snapshot of a raw conversation. Look for the 'Aha!' moments, structural
            behavioral patterns and recurring themes.
            Respond ONLY with raw JSON, no markdown:
            {"summary": "A high-level synthesis of what occurred", "patterns": ["Deep pattern 1", "Structural insight 2"]}
            """;

    private final StreamManager      stream;
    private final InferenceScheduler scheduler;
    private final MemoryStore        memoryStore;
    private final GraphMemoryService graph;
    private final ObjectMapper       objectMapper;

    public ConsolidationOutcome consolidate() {
        List<ConversationTurn> buffer = stream.snapshot();
        if (buffer.isEmpty()) {
            return new ConsolidationOutcome(ConsolidationOutcome.Status.EMPTY_STREAM, 0, 0, 0, null);
        }
        StreamProperties props = stream.properties();
        log.info("[Sleep] Initiating consolidation: {} turns, ~{} tokens.", buffer.size(), stream.estimateTokens());

        // 1. Snapshot
        String snapshot = buffer.stream().map(ConversationTurn::render).collect(Collectors.joining("\n"));
        writeSnapshotFile(Path.of(props.snapshotFile()), snapshot);

        // 2. Sift
        String raw = scheduler.schedule(InferencePurpose.ANALYTICAL, new InferenceRequest(
                SIFTER_PROMPT, List.of(ConversationTurn.user("SNAPSHOT FOR ANALYSIS:\n" + snapshot)), null));
        Optional<SiftResult> sift = parseSift(raw);

        if (sift.isPresent()) {
            // 3. Persist & decay
            try {
                for (String pattern : sift.get().patterns()) {
                    memoryStore.saveExperience(MemoryStore.SIFTER_PATTERN_TAG + pattern);
                }
                PruneReport prune = graph.decayAndPrune();

                // 4. Flush & resume
                List<ConversationTurn> flushed = new ArrayList<>();
                flushed.add(ConversationTurn.system(SUMMARY_PREFIX + sift.get().summary()));
                flushed.addAll(tail(buffer, props.rollingOverlap()));
                stream.replace(flushed);

                log.info("[Sleep] Consolidation complete: {} patterns stored, stream {} → {} turns.",
                        sift.get().patterns().size(), buffer.size(), flushed.size());
                return new ConsolidationOutcome(ConsolidationOutcome.Status.CONSOLIDATED,
                        buffer.size(), flushed.size(), sift.get().patterns().size(), prune);
            } catch (DataAccessException | TransactionException e) {
                log.warn("[Sleep] Persisting sift result failed, preserving raw snapshot instead: {}", e.getMessage());
            }
        }

        return preserveRawSnapshot(buffer, snapshot, props.fallbackRetainTurns());
    }

    // ── Fallback ─────────────────────────────────────────────────────────────

    private ConsolidationOutcome preserveRawSnapshot(List<ConversationTurn> buffer, String snapshot, int retain) {
        try {
            memoryStore.saveExperience(snapshot);
        } catch (DataAccessException | TransactionException e) {
            log.error("[Sleep] Could not store raw snapshot, leaving stream untouched: {}", e.getMessage());
            return new ConsolidationOutcome(ConsolidationOutcome.Status.STORAGE_UNAVAILABLE,
                    buffer.size(), stream.size(), 0, null);
        }
        List<ConversationTurn> kept = tail(buffer, retain);
        stream.replace(kept);
        log.warn("[Sleep] Sift unusable; raw snapshot preserved, stream truncated {} → {} turns.",
                buffer.size(), kept.size());
        return new ConsolidationOutcome(ConsolidationOutcome.Status.FALLBACK_PRESERVED,
                buffer.size(), kept.size(), 0, null);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Optional<SiftResult> parseSift(String raw) {
        if (raw == null || raw.isBlank()) {
            log.warn("[Sleep] Sifter returned nothing.");
            return Optional.empty();
        }
        Optional<String> json = ModelReplies.extractJsonObject(raw);
        if (json.isEmpty()) {
            log.warn("[Sleep] No JSON object in sifter output.");
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json.get(), SiftResult.class));
        } catch (JsonProcessingException e) {
            log.warn("[Sleep] Unparsable sifter output: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static List<ConversationTurn> tail(List<ConversationTurn> turns, int n) {
        return List.copyOf(turns.subList(Math.max(0, turns.size() - n), turns.size()));
    }

    private static void writeSnapshotFile(Path file, String snapshot) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, snapshot);
        } catch (IOException e) {
            log.warn("[Sleep] Could not write snapshot file {}: {}", file, e.getMessage());
        }
    }
}
