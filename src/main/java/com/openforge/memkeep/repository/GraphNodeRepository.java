package com.openforge.memkeep.repository;

import com.openforge.memkeep.domain.GraphNode;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GraphNodeRepository extends JpaRepository<GraphNode, Long> {

    Optional<GraphNode> findByLabel(String label);

    boolean existsByLabel(String label);

    List<GraphNode> findByOrderByStrengthDescIdAsc(Pageable page);

    List<GraphNode> findByLabelContainingAndStrengthGreaterThanOrderByStrengthDesc(String term, double minStrength);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE GraphNode n SET n.strength = n.strength * :factor")
    int decayAll(@Param("factor") double factor);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM GraphNode n WHERE n.strength < :threshold")
    int deleteWeakerThan(@Param("threshold") double threshold);
}
