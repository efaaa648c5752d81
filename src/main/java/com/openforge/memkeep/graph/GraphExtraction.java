package com.openforge.memkeep.graph;

import java.util.List;

/**
 * Entities and relationships pulled out of one piece of text, in the JSON
 * shape the extraction prompt asks for:
 *
 * <pre>
 * {"entities":[{"label":"luna","type":"pet"}],
 *  "relationships":[{"source":"user","target":"luna","relationship":"owns"}]}
 * </pre>
 */
public record GraphExtraction(List<Entity> entities, List<Relationship> relationships) {

    public GraphExtraction {
        entities = entities == null ? List.of() : List.copyOf(entities);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    public boolean isEmpty() {
        return entities.isEmpty() && relationships.isEmpty();
    }

    public record Entity(String label, String type) {}

    public record Relationship(String source, String target, String relationship) {}
}
