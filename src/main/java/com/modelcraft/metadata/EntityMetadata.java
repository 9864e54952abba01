package com.modelcraft.metadata;

import com.modelcraft.exception.SchemaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Describes a single entity: its table, its merged field set and the relationships it takes part in.
 */
public record EntityMetadata(
    String name,
    String table,
    String description,
    Map<String, FieldDescriptor> fields,

    // Relationships referenced by name, and definitions nested in the entity schema
    List<String> relationships,
    List<Map<String, Object>> inlineRelationships,

    // Listing / display
    ListingConfig listing,
    List<String> displayColumns
) {
    private static final Set<String> SEARCHABLE_TYPES = Set.of("Text", "BigText", "Email");

    public EntityMetadata {
        if (name == null || name.isBlank()) {
            throw new SchemaException("Entity metadata missing name");
        }
        table = table != null && !table.isBlank() ? table : name.toLowerCase(Locale.ROOT);
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
        inlineRelationships = inlineRelationships != null ? List.copyOf(inlineRelationships) : List.of();
        listing = listing != null ? listing : ListingConfig.DEFAULTS;
        displayColumns = displayColumns != null ? List.copyOf(displayColumns) : List.of();
    }

    /**
     * Parse an entity schema document. Only the declared fields are read; core fields are merged by
     * {@link #withCoreFields}.
     *
     * @param fallbackName used when the document carries no {@code name}
     */
    public static EntityMetadata fromMap(String fallbackName, Map<String, ?> raw) {
        var name = raw.get("name") != null ? String.valueOf(raw.get("name")) : fallbackName;
        var fields = new LinkedHashMap<String, FieldDescriptor>();
        var declared = raw.get("fields");
        if (declared != null && !(declared instanceof Map)) {
            throw new SchemaException("Entity '%s': 'fields' must be a map".formatted(name), Map.of("entity", name));
        }
        if (declared instanceof Map<?, ?> declaredFields) {
            SchemaMaps.stringKeyed(declaredFields).forEach((key, value) -> {
                if (!(value instanceof Map<?, ?> definition)) {
                    throw new SchemaException("Entity '%s': field '%s' must be a map".formatted(name, key),
                        Map.of("entity", name, "field", key));
                }
                var field = FieldDescriptor.fromMap(key, SchemaMaps.stringKeyed(definition));
                if (fields.containsKey(field.name())) {
                    throw new SchemaException("Entity '%s' declares field '%s' twice".formatted(name, field.name()),
                        Map.of("entity", name, "field", field.name()));
                }
                fields.put(field.name(), field);
            });
        }

        var relationshipNames = new ArrayList<String>();
        var inline = new ArrayList<Map<String, Object>>();
        if (raw.get("relationships") instanceof List<?> list) {
            for (var entry : list) {
                if (entry instanceof Map<?, ?> definition) {
                    var copy = SchemaMaps.stringKeyed(definition);
                    inline.add(copy);
                    if (copy.get("name") != null) {
                        relationshipNames.add(String.valueOf(copy.get("name")));
                    }
                } else if (entry != null) {
                    relationshipNames.add(String.valueOf(entry));
                }
            }
        }

        var listing = raw.get("listing") instanceof Map<?, ?> l
            ? ListingConfig.fromMap(name, SchemaMaps.stringKeyed(l))
            : ListingConfig.DEFAULTS;
        var displayColumns = SchemaMaps.strings(raw.get("displayColumns"));

        return new EntityMetadata(
            name,
            raw.get("table") != null ? String.valueOf(raw.get("table")) : null,
            raw.get("description") != null ? String.valueOf(raw.get("description")) : null,
            fields,
            relationshipNames,
            inline,
            listing,
            displayColumns);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("table", table);
        if (description != null) {
            map.put("description", description);
        }
        var fieldMaps = new LinkedHashMap<String, Object>();
        fields.forEach((key, field) -> fieldMaps.put(key, field.toMap()));
        map.put("fields", fieldMaps);

        var rels = new ArrayList<Object>();
        for (var relName : relationships) {
            rels.add(inlineRelationships.stream()
                .filter(r -> relName.equals(String.valueOf(r.get("name"))))
                .<Object>map(r -> r)
                .findFirst()
                .orElse(relName));
        }
        map.put("relationships", rels);
        map.put("listing", listing.toMap());
        map.put("displayColumns", displayColumns);
        return map;
    }

    /**
     * Core fields first, then the declared fields. A declared field replaces the core field of the
     * same name and keeps the core field's position.
     */
    public EntityMetadata withCoreFields(Map<String, FieldDescriptor> coreFields) {
        var merged = new LinkedHashMap<String, FieldDescriptor>(coreFields);
        merged.putAll(fields);
        return withFields(merged);
    }

    public EntityMetadata withFields(Map<String, FieldDescriptor> newFields) {
        return new EntityMetadata(name, table, description, newFields, relationships,
            inlineRelationships, listing, displayColumns);
    }

    public Optional<FieldDescriptor> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public List<String> dbFieldNames() {
        return fields.values().stream()
            .filter(FieldDescriptor::dbField)
            .map(FieldDescriptor::name)
            .toList();
    }

    /** Declared searchable fields, or every text-like DB field. */
    public List<String> searchableFields() {
        if (!listing.searchableFields().isEmpty()) {
            return listing.searchableFields();
        }
        return fields.values().stream()
            .filter(f -> f.dbField() && SEARCHABLE_TYPES.contains(f.type()))
            .map(FieldDescriptor::name)
            .toList();
    }

    /** Declared sortable fields, or every DB field. */
    public List<String> sortableFields() {
        return listing.sortableFields().isEmpty() ? dbFieldNames() : listing.sortableFields();
    }

    public List<ListingConfig.SortOrder> defaultSort() {
        if (!listing.defaultSort().isEmpty()) {
            return listing.defaultSort();
        }
        return hasField("created_at")
            ? List.of(new ListingConfig.SortOrder("created_at", "desc"))
            : List.of();
    }
}
