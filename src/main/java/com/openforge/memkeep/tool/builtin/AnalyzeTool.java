package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.graph.GraphMemoryService;
import com.openforge.memkeep.graph.GraphStats;
import com.openforge.memkeep.graph.NodeView;
import com.openforge.memkeep.llm.InferencePurpose;
import com.openforge.memkeep.llm.PromptLibrary;
import com.openforge.memkeep.scheduler.InferenceRequest;
import com.openforge.memkeep.scheduler.InferenceScheduler;
import com.openforge.memkeep.stream.ConversationTurn;
import com.openforge.memkeep.tool.AgentTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Asks the sifter model for insights over the strongest part of the graph.
 */
@Component
@RequiredArgsConstructor
public class AnalyzeTool implements AgentTool {

    private final GraphMemoryService graph;
    private final InferenceScheduler scheduler;
    private final PromptLibrary      prompts;

    @Override
    public String name() {
        return "ANALYZE";
    }

    @Override
    public String usage() {
        return "ANALYZE — analyze your knowledge graph for insights";
    }

    @Override
    public String execute(String args) {
        GraphStats stats = graph.stats();
        if (stats.nodeCount() == 0) {
            return "The knowledge graph is empty. Talk more to build connections.";
        }
        String topNodes = stats.topNodes().stream()
                .map(NodeView::label)
                .collect(Collectors.joining(", "));
        String edges = stats.recentEdges().stream()
                .map(e -> e.render())
                .collect(Collectors.joining("; "));

        String system = prompts.identity()
                + "\n\n[TASK] Analyze this knowledge graph for insights. Be concise and insightful.";
        String user = "Nodes: %d, Edges: %d. Top nodes: %s. Recent links: %s"
                .formatted(stats.nodeCount(), stats.edgeCount(), topNodes, edges.isEmpty() ? "none" : edges);

        String analysis = scheduler.schedule(InferencePurpose.ANALYTICAL,
                new InferenceRequest(system, List.of(ConversationTurn.user(user)), null));
        return "Graph Analysis (%d nodes, %d edges):\n%s".formatted(stats.nodeCount(), stats.edgeCount(),
                analysis.isBlank() ? "(analysis unavailable)" : analysis);
    }
}
