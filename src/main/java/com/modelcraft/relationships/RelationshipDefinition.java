package com.modelcraft.relationships;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A relationship whose schema passed validation: type known, participants present.
 * Produced by {@link RelationshipResolver#validate}.
 *
 * @param modelA      first participant of OneToOne / ManyToMany, otherwise null
 * @param modelB      second participant of OneToOne / ManyToMany, otherwise null
 * @param modelOne    "one" side of OneToMany, otherwise null
 * @param modelMany   "many" side of OneToMany, otherwise null
 * @param sourceModel entity whose schema declared this relationship inline, null for standalone ones
 */
public record RelationshipDefinition(
    String name,
    RelationshipType type,
    String modelA,
    String modelB,
    String modelOne,
    String modelMany,
    Map<String, FieldDescriptor> additionalFields,
    List<String> constraints,
    CascadeAction cascadeAction,
    String sourceModel
) {
    public RelationshipDefinition {
        additionalFields = additionalFields != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(additionalFields))
            : Map.of();
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        cascadeAction = cascadeAction != null ? cascadeAction : CascadeAction.RESTRICT;
    }

    /** The two participant entity names, "one" side first for OneToMany. */
    public List<String> participants() {
        return type == RelationshipType.ONE_TO_MANY
            ? List.of(modelOne, modelMany)
            : List.of(modelA, modelB);
    }

    public RelationshipDefinition withSourceModel(String owner) {
        return new RelationshipDefinition(name, type, modelA, modelB, modelOne, modelMany,
            additionalFields, constraints, cascadeAction, owner);
    }

    /** Schema-data form; {@link RelationshipResolver#validate} reads it back. */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("type", type.value());
        if (type == RelationshipType.ONE_TO_MANY) {
            map.put("modelOne", modelOne);
            map.put("modelMany", modelMany);
        } else {
            map.put("modelA", modelA);
            map.put("modelB", modelB);
        }
        var fields = new ArrayList<Map<String, Object>>();
        additionalFields.values().forEach(f -> fields.add(f.toMap()));
        map.put("additionalFields", fields);
        map.put("constraints", constraints);
        map.put("cascadeAction", cascadeAction.value());
        if (sourceModel != null) {
            map.put("sourceModel", sourceModel);
        }
        return map;
    }
}
