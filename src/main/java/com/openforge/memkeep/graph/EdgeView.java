package com.openforge.memkeep.graph;

import com.openforge.memkeep.domain.GraphEdge;

import java.time.LocalDateTime;

public record EdgeView(String source, String target, String relationship, double weight, LocalDateTime observedAt) {

    static EdgeView of(GraphEdge edge) {
        return new EdgeView(edge.getSourceLabel(), edge.getTargetLabel(), edge.getRelationship(),
                edge.getWeight(), edge.getObservedAt());
    }

    /** "a —[rel]→ b" */
    public String render() {
        return source + " —[" + relationship + "]→ " + target;
    }
}
