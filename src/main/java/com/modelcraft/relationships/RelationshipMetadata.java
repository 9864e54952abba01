package com.modelcraft.relationships;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A resolved relationship, ready for the runtime: its table and full field set (core fields,
 * generated foreign keys, additional fields).
 */
public record RelationshipMetadata(
    RelationshipDefinition definition,
    String tableName,
    Map<String, FieldDescriptor> fields
) {
    public RelationshipMetadata {
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    public String name() {
        return definition.name();
    }

    public RelationshipType type() {
        return definition.type();
    }

    public String sourceModel() {
        return definition.sourceModel();
    }
}
