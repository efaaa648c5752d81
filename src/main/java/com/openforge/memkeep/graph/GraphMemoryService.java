package com.openforge.memkeep.graph;

import com.openforge.memkeep.domain.GraphEdge;
import com.openforge.memkeep.domain.GraphNode;
import com.openforge.memkeep.repository.GraphEdgeRepository;
import com.openforge.memkeep.repository.GraphNodeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Associative, decaying knowledge graph.
 *
 * Writes (upsert, decay) go through one lock and one transaction each, so a
 * decay pass never interleaves with an upsert.  Reads run unlocked.
 *
 * Edge endpoints are materialised as nodes on upsert, and a decay pass deletes
 * edges whose endpoint node was forgotten in the same pass.  Every stored edge
 * therefore references two existing nodes.
 */
@Slf4j
@Service
public class GraphMemoryService {

    private static final String DEFAULT_NODE_TYPE = "entity";

    private final GraphNodeRepository nodeRepository;
    private final GraphEdgeRepository edgeRepository;
    private final TransactionTemplate transactionTemplate;
    private final GraphProperties     properties;
    private final Clock               clock;

    private final Object writeLock = new Object();

    public GraphMemoryService(GraphNodeRepository nodeRepository,
                              GraphEdgeRepository edgeRepository,
                              PlatformTransactionManager transactionManager,
                              GraphProperties properties,
                              Clock clock) {
        this.nodeRepository      = nodeRepository;
        this.edgeRepository      = edgeRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties          = properties;
        this.clock               = clock;
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    /**
     * Reinforces every entity and relationship of the extraction.
     * Labels and relationships are lower-cased and trimmed; blank ones are skipped.
     */
    public void upsert(GraphExtraction extraction) {
        if (extraction == null || extraction.isEmpty()) {
            return;
        }
        synchronized (writeLock) {
            transactionTemplate.executeWithoutResult(status -> {
                LocalDateTime now = LocalDateTime.now(clock);
                int entities = 0;
                int relationships = 0;

                for (GraphExtraction.Entity entity : extraction.entities()) {
                    String label = normalize(entity.label());
                    if (label.isEmpty()) continue;
                    reinforceNode(label, entity.type(), now);
                    entities++;
                }

                for (GraphExtraction.Relationship rel : extraction.relationships()) {
                    String source   = normalize(rel.source());
                    String target   = normalize(rel.target());
                    String relation = normalize(rel.relationship());
                    if (source.isEmpty() || target.isEmpty() || relation.isEmpty()) continue;
                    ensureNode(source, now);
                    ensureNode(target, now);
                    reinforceEdge(source, target, relation, now);
                    relationships++;
                }

                log.info("[Graph] Perspective updated: {} entities, {} relationships.", entities, relationships);
            });
        }
    }

    /**
     * One synaptic pruning pass: multiply every strength and weight by the decay
     * factor, forget what fell below the threshold, then drop edges left dangling.
     */
    public PruneReport decayAndPrune() {
        synchronized (writeLock) {
            PruneReport report = transactionTemplate.execute(status -> {
                double factor    = properties.decayFactor();
                double threshold = properties.forgetThreshold();

                int nodesDecayed   = nodeRepository.decayAll(factor);
                int edgesDecayed   = edgeRepository.decayAll(factor);
                int nodesForgotten = nodeRepository.deleteWeakerThan(threshold);
                int edgesForgotten = edgeRepository.deleteWeakerThan(threshold);
                int dangling       = edgeRepository.deleteDangling();

                return new PruneReport(nodesDecayed, edgesDecayed, nodesForgotten, edgesForgotten + dangling);
            });
            log.info("[Graph] Synaptic pruning complete: {}", report);
            return report;
        }
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    public GraphRecall recall(String query) {
        return recall(query, properties.recallEdgeLimit());
    }

    /**
     * Nodes whose label contains a query term, then the strongest edges touching them.
     * Never throws on empty input; returns {@link GraphRecall#empty()} instead.
     */
    public GraphRecall recall(String query, int limit) {
        if (query == null || query.isBlank()) {
            return GraphRecall.empty();
        }
        List<String> terms = Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(t -> t.length() >= properties.minTermLength())
                .distinct()
                .toList();
        if (terms.isEmpty()) {
            return GraphRecall.empty();
        }

        Map<String, GraphNode> matched = new LinkedHashMap<>();
        for (String term : terms) {
            for (GraphNode node : nodeRepository.findByLabelContainingAndStrengthGreaterThanOrderByStrengthDesc(
                    term, properties.recallMinStrength())) {
                matched.putIfAbsent(node.getLabel(), node);
            }
        }
        if (matched.isEmpty()) {
            return GraphRecall.empty();
        }

        List<NodeView> nodes = matched.values().stream()
                .sorted(Comparator.comparingDouble(GraphNode::getStrength).reversed())
                .limit(properties.recallNodeLimit())
                .map(NodeView::of)
                .toList();
        List<String> labels = nodes.stream().map(NodeView::label).toList();

        List<EdgeView> edges = edgeRepository
                .findTouching(labels, properties.recallMinWeight(), PageRequest.of(0, Math.max(1, limit)))
                .stream()
                .map(EdgeView::of)
                .toList();

        String summary = edges.isEmpty()
                ? ""
                : "Graph recall (Active Nodes: %s): %s".formatted(
                        String.join(", ", labels),
                        edges.stream().map(EdgeView::render).collect(Collectors.joining("; ")));

        return new GraphRecall(nodes, edges, summary);
    }

    public GraphStats stats() {
        return new GraphStats(
                nodeRepository.count(),
                edgeRepository.count(),
                nodeRepository.findByOrderByStrengthDescIdAsc(PageRequest.of(0, properties.topNodeCount()))
                        .stream().map(NodeView::of).toList(),
                edgeRepository.findByOrderByObservedAtDescIdDesc(PageRequest.of(0, properties.recentEdgeCount()))
                        .stream().map(EdgeView::of).toList());
    }

    public GraphSnapshot snapshot() {
        List<NodeView> nodes = new ArrayList<>();
        nodeRepository.findAll().forEach(n -> nodes.add(NodeView.of(n)));
        List<EdgeView> edges = new ArrayList<>();
        edgeRepository.findAll().forEach(e -> edges.add(EdgeView.of(e)));
        return new GraphSnapshot(nodes, edges);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void reinforceNode(String label, String type, LocalDateTime now) {
        nodeRepository.findByLabel(label).ifPresentOrElse(
                node -> {
                    node.setStrength(node.getStrength() + properties.nodeIncrement());
                    node.setLastSeen(now);
                    nodeRepository.save(node);
                },
                () -> nodeRepository.save(GraphNode.builder()
                        .label(label)
                        .nodeType(type == null || type.isBlank() ? DEFAULT_NODE_TYPE : normalize(type))
                        .lastSeen(now)
                        .build()));
    }

    /** Insert-if-absent; an endpoint mention does not count as a sighting. */
    private void ensureNode(String label, LocalDateTime now) {
        if (!nodeRepository.existsByLabel(label)) {
            nodeRepository.save(GraphNode.builder().label(label).nodeType(DEFAULT_NODE_TYPE).lastSeen(now).build());
        }
    }

    private void reinforceEdge(String source, String target, String relation, LocalDateTime now) {
        edgeRepository.findBySourceLabelAndTargetLabelAndRelationship(source, target, relation).ifPresentOrElse(
                edge -> {
                    edge.setWeight(edge.getWeight() + properties.edgeIncrement());
                    edge.setObservedAt(now);
                    edgeRepository.save(edge);
                },
                () -> edgeRepository.save(GraphEdge.builder()
                        .sourceLabel(source)
                        .targetLabel(target)
                        .relationship(relation)
                        .observedAt(now)
                        .build()));
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
