package com.openforge.memkeep.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A directed, labelled relationship between two node labels.
 * Unique on (source, target, relationship).
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "graph_edges",
    uniqueConstraints = @UniqueConstraint(
            name = "uq_edge_triple",
            columnNames = {"source_label", "target_label", "relationship"})
)
public class GraphEdge extends BaseEntity {

    @Column(name = "source_label", nullable = false, length = 255)
    private String sourceLabel;

    @Column(name = "target_label", nullable = false, length = 255)
    private String targetLabel;

    @Column(name = "relationship", nullable = false, length = 255)
    private String relationship;

    @Builder.Default
    @Column(name = "weight", nullable = false)
    private Double weight = 1.0;

    @Column(name = "observed_at", nullable = false)
    private LocalDateTime observedAt;
}
