package com.openforge.memkeep.memory;

import com.openforge.memkeep.domain.AgentTask;
import com.openforge.memkeep.domain.DomainFact;
import com.openforge.memkeep.domain.ExperienceRecord;
import com.openforge.memkeep.repository.AgentTaskRepository;
import com.openforge.memkeep.repository.DomainFactRepository;
import com.openforge.memkeep.repository.ExperienceRecordRepository;
import com.openforge.memkeep.repository.GraphEdgeRepository;
import com.openforge.memkeep.repository.GraphNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable memory: experiences, domain facts and tasks.
 *
 * Pure storage, no reasoning.  Graph rows live in the same database but are
 * written only through GraphMemoryService; this class touches them on reset.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryStore {

    public static final String SIFTER_PATTERN_TAG    = "[Sifter Pattern] ";
    public static final String HEARTBEAT_INSIGHT_TAG = "[Heartbeat Insight] ";

    private static final String SIFTER_PATTERN_LIKE = SIFTER_PATTERN_TAG.trim() + "%";

    private final ExperienceRecordRepository experienceRepository;
    private final DomainFactRepository       domainFactRepository;
    private final AgentTaskRepository        taskRepository;
    private final GraphNodeRepository        nodeRepository;
    private final GraphEdgeRepository        edgeRepository;
    private final Clock                      clock;

    // ── Experiences & domain facts ───────────────────────────────────────────

    @Transactional
    public ExperienceRecord saveExperience(String content) {
        return experienceRepository.save(ExperienceRecord.builder().content(content).build());
    }

    @Transactional
    public DomainFact saveDomain(String key, String value) {
        return domainFactRepository.save(DomainFact.builder().factKey(key).factValue(value).build());
    }

    @Transactional(readOnly = true)
    public Optional<String> currentFact(String key) {
        return domainFactRepository.findFirstByFactKeyOrderByIdDesc(key).map(DomainFact::getFactValue);
    }

    /** Newest first, sifter patterns excluded. */
    @Transactional(readOnly = true)
    public List<ExperienceRecord> recentExperiences(int limit) {
        return experienceRepository.findByContentNotLikeOrderByIdDesc(SIFTER_PATTERN_LIKE, PageRequest.of(0, limit));
    }

    /** Newest first, with the tag stripped. */
    @Transactional(readOnly = true)
    public List<String> sifterPatterns(int limit) {
        return experienceRepository.findByContentLikeOrderByIdDesc(SIFTER_PATTERN_LIKE, PageRequest.of(0, limit))
                .stream()
                .map(r -> r.getContent().replace(SIFTER_PATTERN_TAG, ""))
                .toList();
    }

    @Transactional(readOnly = true)
    public long experienceCount() {
        return experienceRepository.count();
    }

    @Transactional(readOnly = true)
    public long domainCount() {
        return domainFactRepository.count();
    }

    // ── Tasks ────────────────────────────────────────────────────────────────

    @Transactional
    public AgentTask createTask(String description) {
        AgentTask task = taskRepository.save(AgentTask.builder().description(description.trim()).build());
        log.info("[Memory] Created task #{}: {}", task.getId(), task.getDescription());
        return task;
    }

    @Transactional(readOnly = true)
    public List<AgentTask> listTasks(int limit) {
        return taskRepository.findByOrderByIdDesc(PageRequest.of(0, limit));
    }

    /**
     * PENDING → DONE.  A task that is already DONE is returned unchanged.
     *
     * @return the task, or empty when no task has this id
     */
    @Transactional
    public Optional<AgentTask> completeTask(long id) {
        return taskRepository.findById(id).map(task -> {
            if (task.getStatus() == AgentTask.TaskStatus.PENDING) {
                task.setStatus(AgentTask.TaskStatus.DONE);
                task.setCompletedAt(LocalDateTime.now(clock));
                log.info("[Memory] Completed task #{}", id);
            }
            return task;
        });
    }

    @Transactional(readOnly = true)
    public TaskStats taskStats(int recentLimit) {
        return new TaskStats(
                taskRepository.countByStatus(AgentTask.TaskStatus.PENDING),
                taskRepository.countByStatus(AgentTask.TaskStatus.DONE),
                recentLimit <= 0 ? List.of() : taskRepository.findByOrderByIdDesc(PageRequest.of(0, recentLimit)));
    }

    // ── Maintenance ──────────────────────────────────────────────────────────

    /** Deletes every row of every memory table. */
    @Transactional
    public void reset() {
        experienceRepository.deleteAllInBatch();
        domainFactRepository.deleteAllInBatch();
        edgeRepository.deleteAllInBatch();
        nodeRepository.deleteAllInBatch();
        taskRepository.deleteAllInBatch();
        log.info("[Memory] All memory tables wiped.");
    }

    /** "ok", or "degraded: <reason>" when the store cannot be read. */
    public String health() {
        try {
            experienceRepository.count();
            return "ok";
        } catch (DataAccessException | TransactionException e) {
            log.warn("[Memory] Storage health check failed: {}", e.getMessage());
            return "degraded: " + e.getMostSpecificCause().getMessage();
        }
    }

    public record TaskStats(long pending, long done, List<AgentTask> recent) {}
}
