package com.openforge.memkeep.graph;

import com.openforge.memkeep.config.JpaConfig;
import com.openforge.memkeep.repository.GraphEdgeRepository;
import com.openforge.memkeep.repository.GraphNodeRepository;
import com.openforge.memkeep.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JpaConfig.class, GraphMemoryService.class, GraphMemoryServiceTest.TestBeans.class})
class GraphMemoryServiceTest {

    @TestConfiguration
    @EnableConfigurationProperties(GraphProperties.class)
    static class TestBeans {
        @Bean
        Clock clock() {
            return MutableClock.startingAt("2025-03-01T09:00:00Z");
        }
    }

    @Autowired GraphMemoryService  graph;
    @Autowired GraphNodeRepository nodes;
    @Autowired GraphEdgeRepository edges;

    private static GraphExtraction lunaIsMyDog() {
        return new GraphExtraction(
                List.of(new GraphExtraction.Entity("Luna", "pet")),
                List.of(new GraphExtraction.Relationship("User", "Luna", "Owns")));
    }

    @Test
    void firstSightingCreatesNodesAndEdgeAtBaseStrength() {
        graph.upsert(lunaIsMyDog());

        assertThat(nodes.findByLabel("luna")).hasValueSatisfying(n -> {
            assertThat(n.getStrength()).isEqualTo(1.0);
            assertThat(n.getNodeType()).isEqualTo("pet");
        });
        // an edge endpoint is materialised without counting as a sighting
        assertThat(nodes.findByLabel("user")).hasValueSatisfying(n -> assertThat(n.getStrength()).isEqualTo(1.0));
        assertThat(edges.findBySourceLabelAndTargetLabelAndRelationship("user", "luna", "owns"))
                .hasValueSatisfying(e -> assertThat(e.getWeight()).isEqualTo(1.0));
    }

    @Test
    void repeatedSightingsReinforce() {
        graph.upsert(lunaIsMyDog());
        graph.upsert(lunaIsMyDog());
        graph.upsert(lunaIsMyDog());

        assertThat(nodes.findByLabel("luna").orElseThrow().getStrength()).isEqualTo(2.0);
        assertThat(nodes.findByLabel("user").orElseThrow().getStrength()).isEqualTo(1.0);
        assertThat(edges.findBySourceLabelAndTargetLabelAndRelationship("user", "luna", "owns")
                .orElseThrow().getWeight()).isEqualTo(3.0);
        assertThat(nodes.count()).isEqualTo(2);
        assertThat(edges.count()).isEqualTo(1);
    }

    @Test
    void recallActivatesReinforcedNodesAndTheirEdges() {
        graph.upsert(lunaIsMyDog());
        graph.upsert(lunaIsMyDog());
        graph.upsert(lunaIsMyDog());

        GraphRecall recall = graph.recall("Tell me about Luna");

        assertThat(recall.nodes()).extracting(NodeView::label).containsExactly("luna");
        assertThat(recall.edges()).extracting(EdgeView::render).containsExactly("user —[owns]→ luna");
        assertThat(recall.summary()).isEqualTo("Graph recall (Active Nodes: luna): user —[owns]→ luna");
    }

    @Test
    void singleSightingIsNotStrongEnoughToRecall() {
        graph.upsert(lunaIsMyDog());

        assertThat(graph.recall("luna").hasSummary()).isFalse();
    }

    @Test
    void shortOrBlankQueriesRecallNothing() {
        graph.upsert(lunaIsMyDog());
        graph.upsert(lunaIsMyDog());
        graph.upsert(lunaIsMyDog());

        assertThat(graph.recall("lu")).isEqualTo(GraphRecall.empty());
        assertThat(graph.recall("   ")).isEqualTo(GraphRecall.empty());
        assertThat(graph.recall(null)).isEqualTo(GraphRecall.empty());
    }

    @Test
    void nodeSeenOnceSurvivesFortyFourCyclesAndIsForgottenOnTheFortyFifth() {
        graph.upsert(new GraphExtraction(List.of(new GraphExtraction.Entity("kayak", "object")), List.of()));

        for (int i = 0; i < 44; i++) {
            graph.decayAndPrune();
        }
        assertThat(nodes.existsByLabel("kayak")).isTrue();

        PruneReport last = graph.decayAndPrune();
        assertThat(nodes.existsByLabel("kayak")).isFalse();
        assertThat(last.nodesForgotten()).isEqualTo(1);
    }

    @Test
    void edgesLeftDanglingByForgottenNodesAreRemoved() {
        graph.upsert(lunaIsMyDog());
        graph.upsert(lunaIsMyDog());
        graph.upsert(lunaIsMyDog());

        for (int i = 0; i < 45; i++) {
            graph.decayAndPrune();
        }

        // "user" (1.0) is gone while the edge weight (3.0 decayed) is still above threshold
        assertThat(nodes.existsByLabel("user")).isFalse();
        assertThat(nodes.existsByLabel("luna")).isTrue();
        assertThat(edges.count()).isZero();
    }

    @Test
    void statsListStrongestNodesFirst() {
        graph.upsert(lunaIsMyDog());
        graph.upsert(lunaIsMyDog());

        GraphStats stats = graph.stats();

        assertThat(stats.nodeCount()).isEqualTo(2);
        assertThat(stats.edgeCount()).isEqualTo(1);
        assertThat(stats.topNodes()).extracting(NodeView::label).containsExactly("luna", "user");
        assertThat(graph.snapshot().edges()).hasSize(1);
    }

    @Test
    void blankLabelsAreSkipped() {
        graph.upsert(new GraphExtraction(
                List.of(new GraphExtraction.Entity("  ", "x")),
                List.of(new GraphExtraction.Relationship("user", "", "likes"))));

        assertThat(nodes.count()).isZero();
        assertThat(edges.count()).isZero();
    }
}
