package com.openforge.memkeep.heartbeat;

import com.openforge.memkeep.graph.GraphMemoryService;
import com.openforge.memkeep.graph.GraphStats;
import com.openforge.memkeep.graph.NodeView;
import com.openforge.memkeep.llm.InferencePurpose;
import com.openforge.memkeep.llm.PromptLibrary;
import com.openforge.memkeep.memory.MemoryStore;
import com.openforge.memkeep.scheduler.InferenceRequest;
import com.openforge.memkeep.scheduler.InferenceScheduler;
import com.openforge.memkeep.stream.ConversationTurn;
import com.openforge.memkeep.tool.ToolLoopResult;
import com.openforge.memkeep.tool.ToolOrchestrator;
import com.openforge.memkeep.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Autonomous background cycle.
 *
 * Each tick is skipped while inference is in flight or a user spoke within
 * the idle window.  Otherwise the agent gets a status digest, may use the
 * heartbeat tool set for up to the tool-loop round limit, and a final plain
 * thought is kept as a "[Heartbeat Insight]" experience.
 */
@Slf4j
@Service
public class HeartbeatService {

    private static final DateTimeFormatter DIGEST_TIME =
            DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM).withLocale(Locale.US);

    private static final String HEARTBEAT_MODE = """
            You are in AUTONOMOUS HEARTBEAT mode. The user is away. You have these tools, one per line:

            %s

            Use this time wisely: explore topics from your graph, search for new information about things
            you have discussed, send insightful findings via Telegram or email, create tasks for follow-ups.

            Respond with tool calls OR a brief internal thought to remember.""";

    private final InferenceScheduler  scheduler;
    private final ToolOrchestrator    orchestrator;
    private final ToolRegistry        tools;
    private final GraphMemoryService  graph;
    private final MemoryStore         memoryStore;
    private final PromptLibrary       prompts;
    private final ActivityMonitor     activity;
    private final HeartbeatProperties properties;
    private final Clock               clock;

    public HeartbeatService(InferenceScheduler scheduler,
                            ToolOrchestrator orchestrator,
                            @Qualifier("heartbeatToolRegistry") ToolRegistry tools,
                            GraphMemoryService graph,
                            MemoryStore memoryStore,
                            PromptLibrary prompts,
                            ActivityMonitor activity,
                            HeartbeatProperties properties,
                            Clock clock) {
        this.scheduler    = scheduler;
        this.orchestrator = orchestrator;
        this.tools        = tools;
        this.graph        = graph;
        this.memoryStore  = memoryStore;
        this.prompts      = prompts;
        this.activity     = activity;
        this.properties   = properties;
        this.clock        = clock;
        log.info("[Heartbeat] {} (every {}).", properties.enabled() ? "Enabled" : "Disabled", properties.interval());
    }

    @Scheduled(fixedDelayString = "${agent.heartbeat.interval:PT30M}",
               initialDelayString = "${agent.heartbeat.initial-delay:PT30M}")
    public void tick() {
        beat();
    }

    public HeartbeatOutcome beat() {
        if (!properties.enabled()) {
            return HeartbeatOutcome.DISABLED;
        }
        if (scheduler.isInferenceBusy()) {
            log.info("[Heartbeat] Skipping cycle: reasoning service busy.");
            return HeartbeatOutcome.SKIPPED_BUSY;
        }
        if (activity.isActiveWithin(properties.idleWindow())) {
            log.info("[Heartbeat] Skipping cycle: user active within {}.", properties.idleWindow());
            return HeartbeatOutcome.SKIPPED_ACTIVE;
        }

        log.info("[Heartbeat] Autonomous cycle starting.");
        try {
            String system = prompts.identity() + "\n\n" + HEARTBEAT_MODE.formatted(tools.describe());
            List<ConversationTurn> turns = List.of(ConversationTurn.user(digest()));

            String reply = scheduler.schedule(InferencePurpose.HEARTBEAT, InferenceRequest.of(system, turns));
            ToolLoopResult loop = orchestrator.run(InferencePurpose.HEARTBEAT, system, turns, reply, tools);

            String thought = loop.text().trim();
            if (thought.isEmpty() || !tools.parser().parse(thought).isEmpty()) {
                log.info("[Heartbeat] Cycle complete, no insight ({} tool runs).", loop.executions().size());
                return HeartbeatOutcome.NO_INSIGHT;
            }
            memoryStore.saveExperience(MemoryStore.HEARTBEAT_INSIGHT_TAG + thought);
            log.info("[Heartbeat] Insight stored: {}", thought.length() > 100 ? thought.substring(0, 100) : thought);
            return HeartbeatOutcome.INSIGHT_STORED;
        } catch (RuntimeException e) {
            log.error("[Heartbeat] Cycle failed: {}", e.getMessage(), e);
            return HeartbeatOutcome.FAILED;
        }
    }

    private String digest() {
        GraphStats stats = graph.stats();
        MemoryStore.TaskStats tasks = memoryStore.taskStats(0);
        String topics = stats.topNodes().stream().map(NodeView::label).collect(Collectors.joining(", "));
        return """
                [HEARTBEAT] Time: %s

                Graph: %d nodes, %d edges. Top topics: %s.
                Tasks: %d pending, %d done.

                What would you like to explore, learn, or do right now?"""
                .formatted(DIGEST_TIME.format(ZonedDateTime.now(clock)),
                        stats.nodeCount(), stats.edgeCount(), topics.isEmpty() ? "none yet" : topics,
                        tasks.pending(), tasks.done());
    }
}
