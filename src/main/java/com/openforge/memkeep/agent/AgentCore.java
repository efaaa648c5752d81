package com.openforge.memkeep.agent;

import com.openforge.memkeep.consolidation.ConsolidationEngine;
import com.openforge.memkeep.consolidation.ConsolidationOutcome;
import com.openforge.memkeep.domain.AgentTask;
import com.openforge.memkeep.domain.ExperienceRecord;
import com.openforge.memkeep.graph.GraphMemoryService;
import com.openforge.memkeep.graph.GraphRecall;
import com.openforge.memkeep.graph.GraphSnapshot;
import com.openforge.memkeep.graph.GraphStats;
import com.openforge.memkeep.heartbeat.ActivityMonitor;
import com.openforge.memkeep.intake.IntakeValve;
import com.openforge.memkeep.llm.ImageInput;
import com.openforge.memkeep.llm.InferencePurpose;
import com.openforge.memkeep.llm.PromptLibrary;
import com.openforge.memkeep.memory.MemoryStore;
import com.openforge.memkeep.scheduler.InferenceRequest;
import com.openforge.memkeep.scheduler.InferenceScheduler;
import com.openforge.memkeep.stream.ConversationTurn;
import com.openforge.memkeep.stream.StreamManager;
import com.openforge.memkeep.stream.StreamProperties;
import com.openforge.memkeep.tool.ToolLoopResult;
import com.openforge.memkeep.tool.ToolOrchestrator;
import com.openforge.memkeep.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The agent's single entry point for the outside world.
 *
 * One user turn:
 *   1. mark activity, hand the text to the intake valve (fire-and-forget)
 *   2. consolidate the stream if it is over budget
 *   3. recall graph context for the text
 *   4. primary INFERENCE call through the scheduler
 *   5. tool loop, 0 to 2 rounds
 *   6. append the user turn and the reply to the stream
 *
 * Turns are serialized by a fair lock, so consolidation never races an append.
 */
@Slf4j
@Service
public class AgentCore {

    static final String EMPTY_MESSAGE_REPLY = "I didn't catch anything there. What would you like to talk about?";
    static final String VISION_DISABLED_REPLY = "Vision functionality is currently disabled.";
    static final String NO_IMAGE_REPLY = "I didn't receive an image. Could you try sending it again?";
    static final String DEFAULT_VISION_PROMPT = "What do you see in this image?";
    static final String IMAGE_TURN_PREFIX = "[Image attached] ";

    private static final int VISION_CONTEXT_TURNS = 6;
    private static final int STATUS_RECENT_EXPERIENCES = 5;
    private static final int STATUS_SIFTER_PATTERNS = 3;
    private static final int STATUS_RECENT_TASKS = 5;
    private static final int EXPERIENCE_PREVIEW_CHARS = 70;

    private final StreamManager       stream;
    private final ConsolidationEngine consolidation;
    private final GraphMemoryService  graph;
    private final InferenceScheduler  scheduler;
    private final ToolOrchestrator    orchestrator;
    private final ToolRegistry        tools;
    private final IntakeValve         intake;
    private final MemoryStore         memoryStore;
    private final PromptLibrary       prompts;
    private final ActivityMonitor     activity;

    private final ReentrantLock turnLock = new ReentrantLock(true);

    public AgentCore(StreamManager stream,
                     ConsolidationEngine consolidation,
                     GraphMemoryService graph,
                     InferenceScheduler scheduler,
                     ToolOrchestrator orchestrator,
                     @Qualifier("foregroundToolRegistry") ToolRegistry tools,
                     IntakeValve intake,
                     MemoryStore memoryStore,
                     PromptLibrary prompts,
                     ActivityMonitor activity) {
        this.stream        = stream;
        this.consolidation = consolidation;
        this.graph         = graph;
        this.scheduler     = scheduler;
        this.orchestrator  = orchestrator;
        this.tools         = tools;
        this.intake        = intake;
        this.memoryStore   = memoryStore;
        this.prompts       = prompts;
        this.activity      = activity;
    }

    // ── Chat ─────────────────────────────────────────────────────────────────

    public String handleMessage(String userText) {
        return handleMessage(userText, null);
    }

    /**
     * @param identityToken opaque caller identity, logged only
     */
    public String handleMessage(String userText, @Nullable String identityToken) {
        if (userText == null || userText.isBlank()) {
            return EMPTY_MESSAGE_REPLY;
        }
        activity.markActive();
        intake.submit(userText);
        log.debug("[Agent] Turn from {}", identityToken == null ? "anonymous" : identityToken);

        turnLock.lock();
        try {
            if (stream.isOverBudget()) {
                consolidateQuietly();
            }

            String system = prompts.identity() + recallContext(userText)
                    + "\n\n[AGENTIC TOOLS] Use a tool by writing its command on its own line:\n"
                    + tools.describe();

            List<ConversationTurn> turns = new ArrayList<>(stream.recent(stream.properties().recentTurnWindow()));
            turns.add(ConversationTurn.user(userText));

            String reply = scheduler.schedule(InferencePurpose.INFERENCE, InferenceRequest.of(system, turns));
            ToolLoopResult loop = orchestrator.run(InferencePurpose.INFERENCE, system, turns, reply, tools);

            stream.append(ConversationTurn.user(userText), ConversationTurn.assistant(loop.text()));
            return loop.text();
        } finally {
            turnLock.unlock();
        }
    }

    public String handleImageMessage(byte[] imageBytes, @Nullable String userText) {
        return handleImageMessage(imageBytes, null, userText);
    }

    /**
     * Answers about an image on the vision model.  The stream keeps a text-only
     * record of the turn.
     *
     * @param mimeType MIME type of the image, or null to sniff it from the bytes
     */
    public String handleImageMessage(byte[] imageBytes, @Nullable String mimeType, @Nullable String userText) {
        if (!stream.properties().visionEnabled()) {
            log.info("[Agent] Vision request refused: vision is disabled.");
            return VISION_DISABLED_REPLY;
        }
        if (imageBytes == null || imageBytes.length == 0) {
            log.info("[Agent] Vision request without image data.");
            return NO_IMAGE_REPLY;
        }
        ImageInput image = mimeType == null ? ImageInput.of(imageBytes) : new ImageInput(mimeType, imageBytes);
        String text = userText == null || userText.isBlank() ? DEFAULT_VISION_PROMPT : userText;
        activity.markActive();
        log.info("[Agent] Vision turn: {} KB {}", imageBytes.length / 1024, image.mimeType());

        turnLock.lock();
        try {
            String system = prompts.identity()
                    + "\n\n[VISION TASK] Describe what you see in detail, then respond to the user's message.";
            List<ConversationTurn> turns = new ArrayList<>(stream.recent(VISION_CONTEXT_TURNS));
            turns.add(ConversationTurn.user(text));

            String reply = scheduler.schedule(InferencePurpose.VISION, new InferenceRequest(system, turns, image));

            stream.append(ConversationTurn.user(IMAGE_TURN_PREFIX + text), ConversationTurn.assistant(reply));
            intake.submit("[Vision] User shared an image. AI described: "
                    + (reply.length() > 200 ? reply.substring(0, 200) : reply));
            return reply;
        } finally {
            turnLock.unlock();
        }
    }

    // ── Inspection ───────────────────────────────────────────────────────────

    public AgentStatus getStatus() {
        StreamProperties props = stream.properties();
        int turns  = stream.size();
        int tokens = stream.estimateTokens();
        boolean busy = scheduler.isInferenceBusy();
        try {
            GraphStats graphStats = graph.stats();
            MemoryStore.TaskStats tasks = memoryStore.taskStats(STATUS_RECENT_TASKS);
            return new AgentStatus(turns, tokens, props.contextCap(),
                    memoryStore.experienceCount(),
                    memoryStore.domainCount(),
                    memoryStore.recentExperiences(STATUS_RECENT_EXPERIENCES).stream()
                            .map(AgentCore::summarize).toList(),
                    memoryStore.sifterPatterns(STATUS_SIFTER_PATTERNS),
                    graphStats.nodeCount(), graphStats.edgeCount(),
                    graphStats.topNodes(), graphStats.recentEdges(),
                    tasks.pending(), tasks.done(),
                    tasks.recent().stream().map(AgentCore::summarize).toList(),
                    busy, "ok");
        } catch (RuntimeException e) {
            log.warn("[Agent] Status degraded, durable store unavailable: {}", e.getMessage());
            return new AgentStatus(turns, tokens, props.contextCap(), 0, 0, List.of(), List.of(),
                    0, 0, List.of(), List.of(), 0, 0, List.of(), busy, "degraded: " + e.getMessage());
        }
    }

    public GraphSnapshot getGraphSnapshot() {
        return graph.snapshot();
    }

    /** Copy of the stream, oldest first. */
    public List<ConversationTurn> getHistory() {
        return stream.snapshot();
    }

    // ── Maintenance ──────────────────────────────────────────────────────────

    /** Wipes every memory table, the stream and the last consolidation snapshot. */
    public ResetConfirmation reset() {
        turnLock.lock();
        try {
            memoryStore.reset();
            stream.clear();
            Path snapshot = Path.of(stream.properties().snapshotFile());
            try {
                Files.deleteIfExists(snapshot);
            } catch (IOException e) {
                log.warn("[Agent] Could not delete snapshot file {}: {}", snapshot, e.getMessage());
            }
            log.info("[Agent] Brain wiped (memory, graph, tasks, stream).");
            return new ResetConfirmation("success", "Brain wiped. Memory + graph + tasks cleared.");
        } finally {
            turnLock.unlock();
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /** A failed sleep cycle leaves the stream as it was; the turn still gets answered. */
    private void consolidateQuietly() {
        try {
            ConsolidationOutcome outcome = consolidation.consolidate();
            log.info("[Agent] Stream over budget, consolidation {}.", outcome.status());
        } catch (RuntimeException e) {
            log.error("[Agent] Consolidation aborted, stream kept as is: {}", e.getMessage(), e);
        }
    }

    private String recallContext(String userText) {
        try {
            GraphRecall recall = graph.recall(userText);
            if (!recall.hasSummary()) {
                return "";
            }
            log.info("[Graph Recall] {} nodes, {} edges activated.", recall.nodes().size(), recall.edges().size());
            return "\n\n[GRAPH MEMORY] " + recall.summary();
        } catch (RuntimeException e) {
            log.warn("[Graph Recall] Skipped, store unavailable: {}", e.getMessage());
            return "";
        }
    }

    private static AgentStatus.ExperienceSummary summarize(ExperienceRecord record) {
        String content = record.getContent();
        return new AgentStatus.ExperienceSummary(
                content.length() > EXPERIENCE_PREVIEW_CHARS
                        ? content.substring(0, EXPERIENCE_PREVIEW_CHARS) + ".."
                        : content,
                record.getCreateTime());
    }

    private static AgentStatus.TaskSummary summarize(AgentTask task) {
        return new AgentStatus.TaskSummary(task.getId(), task.getDescription(),
                task.getStatus().name(), task.getCreateTime());
    }
}
