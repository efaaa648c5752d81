package com.openforge.memkeep.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * An entity in associative memory.
 *
 * label is the natural key (lower-cased, trimmed).  strength starts at 1.0,
 * grows on every sighting and decays on every consolidation; the row is
 * pruned once it falls below the forget threshold.  First-seen is create_time.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "graph_nodes",
    uniqueConstraints = @UniqueConstraint(name = "uq_node_label", columnNames = "label")
)
public class GraphNode extends BaseEntity {

    @Column(name = "label", nullable = false, length = 255)
    private String label;

    @Builder.Default
    @Column(name = "node_type", nullable = false, length = 64)
    private String nodeType = "concept";

    @Builder.Default
    @Column(name = "strength", nullable = false)
    private Double strength = 1.0;

    @Column(name = "last_seen", nullable = false)
    private LocalDateTime lastSeen;
}
