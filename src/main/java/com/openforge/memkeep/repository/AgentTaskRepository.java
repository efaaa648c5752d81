package com.openforge.memkeep.repository;

import com.openforge.memkeep.domain.AgentTask;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AgentTaskRepository extends JpaRepository<AgentTask, Long> {

    long countByStatus(AgentTask.TaskStatus status);

    List<AgentTask> findByOrderByIdDesc(Pageable page);
}
