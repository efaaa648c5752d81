package com.openforge.memkeep.consolidation;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memkeep.graph.GraphMemoryService;
import com.openforge.memkeep.graph.PruneReport;
import com.openforge.memkeep.llm.InferencePurpose;
import com.openforge.memkeep.memory.MemoryStore;
import com.openforge.memkeep.scheduler.InferenceScheduler;
import com.openforge.memkeep.stream.ConversationTurn;
import com.openforge.memkeep.stream.StreamManager;
import com.openforge.memkeep.stream.StreamProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConsolidationEngineTest {

    @TempDir
    Path dir;

    @Mock InferenceScheduler scheduler;
    @Mock MemoryStore        memoryStore;
    @Mock GraphMemoryService graph;

    private StreamManager stream;
    private ConsolidationEngine engine;

    @BeforeEach
    void setUp() {
        StreamProperties props = new StreamProperties(64000, 0.85, 12, 3, 15,
                dir.resolve("stream.json").toString(), dir.resolve("snapshot.txt").toString(), true);
        ObjectMapper objectMapper = new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        stream = new StreamManager(props, objectMapper);
        engine = new ConsolidationEngine(stream, scheduler, memoryStore, graph, objectMapper);
    }

    /** 100 turns of 660 tokens each: 66,000 tokens against a 54,400 threshold. */
    private void fillOverBudget() {
        for (int i = 0; i < 100; i++) {
            String marker = "turn-" + i + " ";
            String text = marker + "x".repeat(2640 - marker.length());
            stream.append(i % 2 == 0 ? ConversationTurn.user(text) : ConversationTurn.assistant(text));
        }
        assertThat(stream.estimateTokens()).isEqualTo(66000);
        assertThat(stream.isOverBudget()).isTrue();
    }

    private String expectedSnapshot(List<ConversationTurn> turns) {
        return turns.stream().map(ConversationTurn::render).collect(Collectors.joining("\n"));
    }

    @Test
    void successfulSiftStoresPatternsDecaysAndFlushesToSummaryPlusOverlap() throws Exception {
        fillOverBudget();
        List<ConversationTurn> before = stream.snapshot();
        PruneReport prune = new PruneReport(4, 2, 1, 0);
        when(scheduler.schedule(eq(InferencePurpose.ANALYTICAL), any()))
                .thenReturn("```json\n{\"summary\": \"User talked about weekend plans.\", \"patterns\": [\"likes hiking\"]}\n```");
        when(graph.decayAndPrune()).thenReturn(prune);

        ConsolidationOutcome outcome = engine.consolidate();

        assertThat(outcome.status()).isEqualTo(ConsolidationOutcome.Status.CONSOLIDATED);
        assertThat(outcome.turnsBefore()).isEqualTo(100);
        assertThat(outcome.turnsAfter()).isEqualTo(4);
        assertThat(outcome.patternsStored()).isEqualTo(1);
        assertThat(outcome.prune()).isEqualTo(prune);

        verify(memoryStore).saveExperience("[Sifter Pattern] likes hiking");
        verify(graph).decayAndPrune();

        List<ConversationTurn> after = stream.snapshot();
        assertThat(after).hasSize(4);
        assertThat(after.get(0)).isEqualTo(ConversationTurn.system(
                ConsolidationEngine.SUMMARY_PREFIX + "User talked about weekend plans."));
        assertThat(after.subList(1, 4)).isEqualTo(before.subList(97, 100));
        assertThat(stream.isOverBudget()).isFalse();

        assertThat(Files.readString(dir.resolve("snapshot.txt"))).isEqualTo(expectedSnapshot(before));
    }

    @Test
    void unparsableSiftPreservesRawSnapshotVerbatim() {
        fillOverBudget();
        List<ConversationTurn> before = stream.snapshot();
        when(scheduler.schedule(eq(InferencePurpose.ANALYTICAL), any())).thenReturn("I'd rather not.");

        ConsolidationOutcome outcome = engine.consolidate();

        assertThat(outcome.status()).isEqualTo(ConsolidationOutcome.Status.FALLBACK_PRESERVED);
        verify(memoryStore).saveExperience(expectedSnapshot(before));
        verify(graph, never()).decayAndPrune();
        assertThat(stream.snapshot()).isEqualTo(before.subList(85, 100));
    }

    @Test
    void emptySiftReplyTakesTheFallbackPath() {
        fillOverBudget();
        when(scheduler.schedule(eq(InferencePurpose.ANALYTICAL), any())).thenReturn("");

        assertThat(engine.consolidate().status()).isEqualTo(ConsolidationOutcome.Status.FALLBACK_PRESERVED);
        assertThat(stream.size()).isEqualTo(15);
    }

    @Test
    void patternWriteFailureFallsBackToRawPreservation() {
        fillOverBudget();
        List<ConversationTurn> before = stream.snapshot();
        when(scheduler.schedule(eq(InferencePurpose.ANALYTICAL), any()))
                .thenReturn("{\"summary\": \"s\", \"patterns\": [\"p\"]}");
        when(memoryStore.saveExperience(anyString())).thenAnswer(invocation -> {
            if (invocation.<String>getArgument(0).startsWith(MemoryStore.SIFTER_PATTERN_TAG)) {
                throw new DataAccessResourceFailureException("db down");
            }
            return null;
        });

        ConsolidationOutcome outcome = engine.consolidate();

        assertThat(outcome.status()).isEqualTo(ConsolidationOutcome.Status.FALLBACK_PRESERVED);
        verify(memoryStore).saveExperience(expectedSnapshot(before));
        assertThat(stream.size()).isEqualTo(15);
    }

    @Test
    void streamIsLeftUntouchedWhenNothingCanBeStored() {
        fillOverBudget();
        List<ConversationTurn> before = stream.snapshot();
        when(scheduler.schedule(eq(InferencePurpose.ANALYTICAL), any())).thenReturn("not json");
        when(memoryStore.saveExperience(anyString())).thenThrow(new DataAccessResourceFailureException("db down"));

        ConsolidationOutcome outcome = engine.consolidate();

        assertThat(outcome.status()).isEqualTo(ConsolidationOutcome.Status.STORAGE_UNAVAILABLE);
        assertThat(stream.snapshot()).isEqualTo(before);
    }

    @Test
    void streamIsLeftUntouchedWhenNoTransactionCanBeOpened() {
        fillOverBudget();
        List<ConversationTurn> before = stream.snapshot();
        when(scheduler.schedule(eq(InferencePurpose.ANALYTICAL), any())).thenReturn("not json");
        when(memoryStore.saveExperience(anyString())).thenThrow(
                new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

        ConsolidationOutcome outcome = engine.consolidate();

        assertThat(outcome.status()).isEqualTo(ConsolidationOutcome.Status.STORAGE_UNAVAILABLE);
        assertThat(stream.snapshot()).isEqualTo(before);
    }

    @Test
    void decayFailingToOpenATransactionFallsBackToRawPreservation() {
        fillOverBudget();
        when(scheduler.schedule(eq(InferencePurpose.ANALYTICAL), any()))
                .thenReturn("{\"summary\": \"s\", \"patterns\": []}");
        when(graph.decayAndPrune()).thenThrow(new CannotCreateTransactionException("connection refused"));

        ConsolidationOutcome outcome = engine.consolidate();

        assertThat(outcome.status()).isEqualTo(ConsolidationOutcome.Status.FALLBACK_PRESERVED);
        assertThat(stream.size()).isEqualTo(15);
    }

    @Test
    void emptyStreamIsANoOp() {
        ConsolidationOutcome outcome = engine.consolidate();

        assertThat(outcome.status()).isEqualTo(ConsolidationOutcome.Status.EMPTY_STREAM);
        verify(scheduler, never()).schedule(any(), any());
    }

    @Test
    void blankSummaryAndPatternsAreNormalised() {
        SiftResult result = new SiftResult("  ", java.util.Arrays.asList("a", " ", null, " b "));

        assertThat(result.summary()).isEqualTo("Conversation consolidated.");
        assertThat(result.patterns()).containsExactly("a", "b");
    }
}
