package com.openforge.memkeep.graph;

import java.util.List;

/**
 * Result of a graph lookup.  {@code summary} is empty when nothing relevant
 * was found, which callers treat as "no recall context".
 */
public record GraphRecall(List<NodeView> nodes, List<EdgeView> edges, String summary) {

    public static GraphRecall empty() {
        return new GraphRecall(List.of(), List.of(), "");
    }

    public boolean hasSummary() {
        return !summary.isEmpty();
    }
}
