package com.openforge.memkeep.tool;

import com.openforge.memkeep.llm.InferencePurpose;
import com.openforge.memkeep.scheduler.InferenceRequest;
import com.openforge.memkeep.scheduler.InferenceScheduler;
import com.openforge.memkeep.stream.ConversationTurn;
import com.openforge.memkeep.support.StubTool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolOrchestratorTest {

    @Mock
    InferenceScheduler scheduler;

    private final AtomicInteger searches = new AtomicInteger();
    private final ToolRegistry registry = new ToolRegistry(List.of(
            new StubTool("SEARCH", args -> "results #" + searches.incrementAndGet() + " for " + args),
            new StubTool("TIME", args -> "noon")));

    private ToolOrchestrator orchestrator() {
        return new ToolOrchestrator(scheduler, ToolProperties.defaults());
    }

    @Test
    void replyWithoutDirectivesIsReturnedAsIs() {
        ToolLoopResult result = orchestrator().run(InferencePurpose.INFERENCE, "sys",
                List.of(ConversationTurn.user("hi")), "Hello there!", registry);

        assertThat(result.text()).isEqualTo("Hello there!");
        assertThat(result.rounds()).isZero();
        assertThat(result.usedTools()).isFalse();
        verifyNoInteractions(scheduler);
    }

    @Test
    void resultsAreFedBackAsOneSystemTurn() {
        when(scheduler.schedule(eq(InferencePurpose.INFERENCE), any())).thenReturn("It is noon and sunny.");

        ToolLoopResult result = orchestrator().run(InferencePurpose.INFERENCE, "sys",
                List.of(ConversationTurn.user("time and weather?")), "TIME\nSEARCH: weather", registry);

        assertThat(result.text()).isEqualTo("It is noon and sunny.");
        assertThat(result.rounds()).isEqualTo(1);
        assertThat(result.executions()).extracting(e -> e.directive().tool()).containsExactly("TIME", "SEARCH");

        ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
        verify(scheduler).schedule(eq(InferencePurpose.INFERENCE), captor.capture());
        List<ConversationTurn> sent = captor.getValue().turns();
        assertThat(sent).hasSize(3);
        assertThat(sent.get(1)).isEqualTo(ConversationTurn.assistant("TIME\nSEARCH: weather"));
        assertThat(sent.get(2).role()).isEqualTo(ConversationTurn.Role.SYSTEM);
        assertThat(sent.get(2).text())
                .startsWith(ToolOrchestrator.RESULTS_HEADER)
                .contains("[TOOL RESULT] TIME\nnoon")
                .contains("[TOOL RESULT] SEARCH\nresults #1 for weather")
                .endsWith(ToolOrchestrator.RESULTS_INSTRUCTION);
    }

    @Test
    void loopStopsAfterTwoRoundsEvenIfModelKeepsAskingForTools() {
        when(scheduler.schedule(eq(InferencePurpose.INFERENCE), any())).thenReturn("SEARCH: more");

        ToolLoopResult result = orchestrator().run(InferencePurpose.INFERENCE, "sys",
                List.of(ConversationTurn.user("research")), "SEARCH: start", registry);

        assertThat(result.rounds()).isEqualTo(2);
        assertThat(result.text()).isNotEmpty();
        assertThat(searches.get()).isEqualTo(2);
        verify(scheduler, times(2)).schedule(eq(InferencePurpose.INFERENCE), any());
    }

    @Test
    void blankFinalReplyFallsBackToRawResults() {
        when(scheduler.schedule(eq(InferencePurpose.HEARTBEAT), any())).thenReturn("");

        ToolLoopResult result = orchestrator().run(InferencePurpose.HEARTBEAT, "sys",
                List.of(ConversationTurn.user("digest")), "TIME", registry);

        assertThat(result.text()).isEqualTo("[TOOL RESULT] TIME\nnoon");
    }

    @Test
    void unknownToolLinesAreNotDirectives() {
        ToolLoopResult result = orchestrator().run(InferencePurpose.INFERENCE, "sys",
                List.of(ConversationTurn.user("hi")), "EMAIL: a|b|c", registry);

        assertThat(result.rounds()).isZero();
        assertThat(result.text()).isEqualTo("EMAIL: a|b|c");
    }
}
