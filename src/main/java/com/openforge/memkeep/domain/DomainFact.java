package com.openforge.memkeep.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * A key/value fact.  History is kept: the same key may be written many times,
 * the newest row is the current belief.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "domain_facts",
    indexes = @Index(name = "idx_fact_key", columnList = "fact_key")
)
public class DomainFact extends BaseEntity {

    @Column(name = "fact_key", nullable = false, length = 255)
    private String factKey;

    @Column(name = "fact_value", nullable = false, columnDefinition = "TEXT")
    private String factValue;
}
