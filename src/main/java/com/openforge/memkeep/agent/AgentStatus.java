package com.openforge.memkeep.agent;

import com.openforge.memkeep.graph.EdgeView;
import com.openforge.memkeep.graph.NodeView;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Point-in-time view of the agent's memory.
 *
 * When the durable store cannot be read, the store-backed fields are zero or
 * empty and {@code storage} reads "degraded: ..." instead of "ok".
 */
public record AgentStatus(
        int streamTurns,
        int streamTokens,
        int contextCap,
        long experienceCount,
        long domainCount,
        List<ExperienceSummary> recentExperiences,
        List<String> sifterPatterns,
        long graphNodes,
        long graphEdges,
        List<NodeView> graphTopNodes,
        List<EdgeView> graphRecentEdges,
        long tasksPending,
        long tasksDone,
        List<TaskSummary> recentTasks,
        boolean inferenceBusy,
        String storage
) {

    public boolean isDegraded() {
        return !"ok".equals(storage);
    }

    public record ExperienceSummary(String content, LocalDateTime createdAt) {}

    public record TaskSummary(long id, String description, String status, LocalDateTime createdAt) {}
}
