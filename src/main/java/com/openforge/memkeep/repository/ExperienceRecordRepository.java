package com.openforge.memkeep.repository;

import com.openforge.memkeep.domain.ExperienceRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExperienceRecordRepository extends JpaRepository<ExperienceRecord, Long> {

    /** Newest first, excluding rows that start with the given tag. */
    List<ExperienceRecord> findByContentNotLikeOrderByIdDesc(String tagPattern, Pageable page);

    /** Newest first, only rows that start with the given tag. */
    List<ExperienceRecord> findByContentLikeOrderByIdDesc(String tagPattern, Pageable page);
}
