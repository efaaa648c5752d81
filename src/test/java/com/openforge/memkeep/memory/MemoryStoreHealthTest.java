package com.openforge.memkeep.memory;

import com.openforge.memkeep.repository.AgentTaskRepository;
import com.openforge.memkeep.repository.DomainFactRepository;
import com.openforge.memkeep.repository.ExperienceRecordRepository;
import com.openforge.memkeep.repository.GraphEdgeRepository;
import com.openforge.memkeep.repository.GraphNodeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemoryStoreHealthTest {

    @Mock ExperienceRecordRepository experienceRepository;
    @Mock DomainFactRepository       domainFactRepository;
    @Mock AgentTaskRepository        taskRepository;
    @Mock GraphNodeRepository        nodeRepository;
    @Mock GraphEdgeRepository        edgeRepository;

    private MemoryStore store;

    @BeforeEach
    void setUp() {
        store = new MemoryStore(experienceRepository, domainFactRepository, taskRepository,
                nodeRepository, edgeRepository, Clock.systemUTC());
    }

    @Test
    void dataAccessFailureReportsDegraded() {
        when(experienceRepository.count()).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThat(store.health()).isEqualTo("degraded: db down");
    }

    @Test
    void transactionThatCannotOpenReportsDegraded() {
        when(experienceRepository.count()).thenThrow(
                new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

        assertThat(store.health()).isEqualTo("degraded: Could not open JPA EntityManager for transaction");
    }
}
