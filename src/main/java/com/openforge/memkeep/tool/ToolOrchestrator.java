package com.openforge.memkeep.tool;

import com.openforge.memkeep.llm.InferencePurpose;
import com.openforge.memkeep.scheduler.InferenceRequest;
import com.openforge.memkeep.scheduler.InferenceScheduler;
import com.openforge.memkeep.stream.ConversationTurn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Bounded detect → execute → regenerate loop.
 *
 *   round:
 *     1. parse directives from the current reply (none → done)
 *     2. run every directive through the registry
 *     3. append the reply and one system turn of [TOOL RESULT] blocks
 *     4. regenerate through the scheduler
 *
 * Stops after {@code maxRounds} regenerations even if the model keeps asking
 * for tools.  A blank final reply is replaced by the raw tool results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolOrchestrator {

    static final String RESULTS_HEADER = "TOOL RESULTS:";
    static final String RESULTS_INSTRUCTION =
            "Now compose your final response to the user using these results. "
                    + "Do NOT call tools again unless absolutely necessary.";

    private final InferenceScheduler scheduler;
    private final ToolProperties     properties;

    /**
     * @param purpose       purpose for the regeneration calls
     * @param systemContext system prompt of the original call
     * @param conversation  turns of the original call, oldest first
     * @param initialReply  the model's first reply
     * @param registry      tools available in this loop
     */
    public ToolLoopResult run(InferencePurpose purpose,
                              String systemContext,
                              List<ConversationTurn> conversation,
                              String initialReply,
                              ToolRegistry registry) {
        List<ConversationTurn> turns = new ArrayList<>(conversation);
        List<ToolExecution> executions = new ArrayList<>();
        String reply = initialReply == null ? "" : initialReply;
        int rounds = 0;

        while (rounds < properties.maxRounds()) {
            List<ToolDirective> directives = registry.parser().parse(reply);
            if (directives.isEmpty()) {
                break;
            }

            List<ToolExecution> roundResults = new ArrayList<>(directives.size());
            for (ToolDirective directive : directives) {
                roundResults.add(new ToolExecution(directive, registry.execute(directive)));
            }
            executions.addAll(roundResults);

            turns.add(ConversationTurn.assistant(reply));
            turns.add(ConversationTurn.system(renderResults(roundResults)));

            reply = scheduler.schedule(purpose, InferenceRequest.of(systemContext, turns));
            rounds++;
            log.debug("[ToolLoop] Round {} executed {} directive(s).", rounds, directives.size());
        }

        if (rounds == properties.maxRounds() && !registry.parser().parse(reply).isEmpty()) {
            log.info("[ToolLoop] Round limit ({}) reached with directives still pending.", properties.maxRounds());
        }

        if (reply.isBlank() && !executions.isEmpty()) {
            reply = executions.stream().map(ToolExecution::render).collect(Collectors.joining("\n\n"));
        }
        return new ToolLoopResult(reply, rounds, List.copyOf(executions));
    }

    static String renderResults(List<ToolExecution> results) {
        return RESULTS_HEADER + "\n"
                + results.stream().map(ToolExecution::render).collect(Collectors.joining("\n\n"))
                + "\n\n" + RESULTS_INSTRUCTION;
    }
}
