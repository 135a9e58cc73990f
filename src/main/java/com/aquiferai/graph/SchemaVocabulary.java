package com.aquiferai.graph;

import java.util.List;

/**
 * Entity kinds (node labels), relationship kinds and property keys the graph recognizes.
 * Lookups are case-sensitive, matching the store.
 */
public record SchemaVocabulary(
        List<String> entityKinds,
        List<String> relationshipKinds,
        List<String> propertyKeys
) {

    public SchemaVocabulary {
        entityKinds = entityKinds != null ? List.copyOf(entityKinds) : List.of();
        relationshipKinds = relationshipKinds != null ? List.copyOf(relationshipKinds) : List.of();
        propertyKeys = propertyKeys != null ? List.copyOf(propertyKeys) : List.of();
    }

    public boolean knowsEntityKind(String kind) {
        return entityKinds.contains(kind);
    }

    public boolean knowsRelationshipKind(String kind) {
        return relationshipKinds.contains(kind);
    }

    /**
     * Plain-text rendering used in generation and healing prompts.
     */
    public String describe() {
        return "Entity kinds (node labels): " + String.join(", ", entityKinds) + "\n"
                + "Relationship kinds: " + String.join(", ", relationshipKinds) + "\n"
                + "Property keys: " + String.join(", ", propertyKeys);
    }
}
