package com.modelcraft.metadata;

import com.modelcraft.fields.FieldTypeDescriptor;
import com.modelcraft.relationships.RelationshipMetadata;
import com.modelcraft.validation.ValidationRuleDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one metadata load produced. Immutable; the engine hands out the same instance until
 * its cache is cleared.
 */
public record MetadataSnapshot(
    Map<String, EntityMetadata> entities,
    Map<String, RelationshipMetadata> relationships,
    Map<String, FieldTypeDescriptor> fieldTypes,
    Map<String, ValidationRuleDescriptor> validationRules
) {
    public MetadataSnapshot {
        entities = frozen(entities);
        relationships = frozen(relationships);
        fieldTypes = frozen(fieldTypes);
        validationRules = frozen(validationRules);
    }

    public MetadataSnapshot withoutEntity(String name) {
        var remainingEntities = new LinkedHashMap<>(entities);
        remainingEntities.remove(name);
        var remainingRelationships = new LinkedHashMap<>(relationships);
        remainingRelationships.remove(name);
        return new MetadataSnapshot(remainingEntities, remainingRelationships, fieldTypes, validationRules);
    }

    /** Cache blob form. Classes are stored by name. */
    Map<String, Object> toMap() {
        var entityMaps = new LinkedHashMap<String, Object>();
        entities.forEach((name, entity) -> entityMaps.put(name, entity.toMap()));

        var relationshipMaps = new LinkedHashMap<String, Object>();
        relationships.forEach((name, relationship) -> relationshipMaps.put(name, relationship.definition().toMap()));

        var fieldTypeMaps = new LinkedHashMap<String, Object>();
        fieldTypes.forEach((type, descriptor) -> {
            var map = new LinkedHashMap<String, Object>();
            map.put("class", descriptor.implementingClass().getName());
            map.put("description", descriptor.description());
            map.put("uiComponent", descriptor.uiComponent());
            map.put("operators", descriptor.operators());
            map.put("validationRules", descriptor.validationRuleNames());
            fieldTypeMaps.put(type, map);
        });

        var ruleMaps = new LinkedHashMap<String, Object>();
        validationRules.forEach((name, descriptor) -> {
            var map = new LinkedHashMap<String, Object>();
            map.put("class", descriptor.implementingClass().getName());
            map.put("description", descriptor.description());
            map.put("javascriptValidation", descriptor.clientSideExpression());
            map.put("applicableFieldTypes", descriptor.applicableFieldTypes());
            ruleMaps.put(name, map);
        });

        var blob = new LinkedHashMap<String, Object>();
        blob.put("entities", entityMaps);
        blob.put("relationships", relationshipMaps);
        blob.put("fieldTypes", fieldTypeMaps);
        blob.put("validationRules", ruleMaps);
        return blob;
    }

    private static <V> Map<String, V> frozen(Map<String, V> map) {
        return map != null ? Collections.unmodifiableMap(new LinkedHashMap<>(map)) : Map.of();
    }
}
