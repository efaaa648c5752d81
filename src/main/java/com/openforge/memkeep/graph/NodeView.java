package com.openforge.memkeep.graph;

import com.openforge.memkeep.domain.GraphNode;

import java.time.LocalDateTime;

public record NodeView(String label, String type, double strength, LocalDateTime lastSeen) {

    static NodeView of(GraphNode node) {
        return new NodeView(node.getLabel(), node.getNodeType(), node.getStrength(), node.getLastSeen());
    }
}
