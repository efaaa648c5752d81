package com.openforge.memkeep.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A to-do the agent keeps for itself.  The only transition is PENDING → DONE.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "agent_tasks")
public class AgentTask extends BaseEntity {

    public enum TaskStatus {
        PENDING,
        DONE
    }

    @Column(name = "description", nullable = false, columnDefinition = "TEXT")
    private String description;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TaskStatus status = TaskStatus.PENDING;

    /** Populated when status = DONE. */
    @Column(name = "completed_at")
    private LocalDateTime completedAt;
}
