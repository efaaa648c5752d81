package com.openforge.memkeep.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * One unit of episodic memory.  Append-only; only a full reset deletes rows.
 *
 * Content may start with a tag such as "[Sifter Pattern] " or
 * "[Heartbeat Insight] ".  Raw consolidation snapshots carry no tag.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "experiences")
public class ExperienceRecord extends BaseEntity {

    @Column(name = "content", nullable = false, length = 1_000_000)
    private String content;
}
