package com.openforge.memkeep.repository;

import com.openforge.memkeep.domain.GraphEdge;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface GraphEdgeRepository extends JpaRepository<GraphEdge, Long> {

    Optional<GraphEdge> findBySourceLabelAndTargetLabelAndRelationship(
            String sourceLabel, String targetLabel, String relationship);

    List<GraphEdge> findByOrderByObservedAtDescIdDesc(Pageable page);

    @Query("""
            SELECT e FROM GraphEdge e
            WHERE (e.sourceLabel IN :labels OR e.targetLabel IN :labels)
              AND e.weight > :minWeight
            ORDER BY e.weight DESC, e.id ASC
            """)
    List<GraphEdge> findTouching(@Param("labels") Collection<String> labels,
                                 @Param("minWeight") double minWeight,
                                 Pageable page);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE GraphEdge e SET e.weight = e.weight * :factor")
    int decayAll(@Param("factor") double factor);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM GraphEdge e WHERE e.weight < :threshold")
    int deleteWeakerThan(@Param("threshold") double threshold);

    /** Edges whose source or target no longer names a node. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            DELETE FROM GraphEdge e
            WHERE NOT EXISTS (SELECT s.id FROM GraphNode s WHERE s.label = e.sourceLabel)
               OR NOT EXISTS (SELECT t.id FROM GraphNode t WHERE t.label = e.targetLabel)
            """)
    int deleteDangling();
}
