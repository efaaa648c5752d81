package com.openforge.memkeep.repository;

import com.openforge.memkeep.domain.DomainFact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DomainFactRepository extends JpaRepository<DomainFact, Long> {

    /** Current belief for a key: the newest row wins. */
    Optional<DomainFact> findFirstByFactKeyOrderByIdDesc(String factKey);

    List<DomainFact> findByFactKeyOrderByIdAsc(String factKey);
}
