package com.modelcraft.relationships;

import com.modelcraft.exception.SchemaException;
import com.modelcraft.metadata.FieldDescriptor;
import com.modelcraft.metadata.SchemaMaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validates relationship schemas and derives their table name and foreign-key fields.
 *
 * <p>Naming, by type (participants lower-cased):
 * <pre>
 *   OneToOne(A, B)            rel_1_a_1_b        keys a_id, b_id
 *   OneToMany(One, Many)      rel_1_one_M_many   keys one_one_id, many_many_id
 *   ManyToMany(A, B)          rel_N_a_M_b        keys a_id, b_id
 * </pre>
 * Table names longer than {@value #MAX_TABLE_NAME_LENGTH} characters are cut to that length.
 */
public class RelationshipResolver {

    private static final Logger log = LoggerFactory.getLogger(RelationshipResolver.class);

    public static final int MAX_TABLE_NAME_LENGTH = 64;

    /**
     * @throws SchemaException naming the missing key or the unknown type / cascade action
     */
    public RelationshipDefinition validate(Map<String, ?> raw) {
        var name = requireKey(raw, "name", null);
        var typeValue = requireKey(raw, "type", name);
        var type = RelationshipType.fromValue(typeValue);

        String modelA = null;
        String modelB = null;
        String modelOne = null;
        String modelMany = null;
        if (type == RelationshipType.ONE_TO_MANY) {
            modelOne = requireKey(raw, "modelOne", name);
            modelMany = requireKey(raw, "modelMany", name);
        } else {
            modelA = requireKey(raw, "modelA", name);
            modelB = requireKey(raw, "modelB", name);
        }

        var cascade = raw.get("cascadeAction") != null
            ? CascadeAction.fromValue(String.valueOf(raw.get("cascadeAction")))
            : CascadeAction.RESTRICT;
        var constraints = raw.get("constraints") instanceof List<?> list
            ? list.stream().map(String::valueOf).toList()
            : List.<String>of();
        var sourceModel = raw.get("sourceModel") != null ? String.valueOf(raw.get("sourceModel")) : null;

        return new RelationshipDefinition(name, type, modelA, modelB, modelOne, modelMany,
            additionalFields(name, raw.get("additionalFields")), constraints, cascade, sourceModel);
    }

    public String tableName(RelationshipDefinition definition) {
        var table = switch (definition.type()) {
            case ONE_TO_ONE -> "rel_1_%s_1_%s".formatted(lower(definition.modelA()), lower(definition.modelB()));
            case ONE_TO_MANY -> "rel_1_%s_M_%s".formatted(lower(definition.modelOne()), lower(definition.modelMany()));
            case MANY_TO_MANY -> "rel_N_%s_M_%s".formatted(lower(definition.modelA()), lower(definition.modelB()));
        };
        if (table.length() > MAX_TABLE_NAME_LENGTH) {
            log.debug("Truncating relationship table name {} to {} characters", table, MAX_TABLE_NAME_LENGTH);
            return table.substring(0, MAX_TABLE_NAME_LENGTH);
        }
        return table;
    }

    /** The generated key fields, in participant order. */
    public Map<String, FieldDescriptor> foreignKeyFields(RelationshipDefinition definition) {
        var fields = new LinkedHashMap<String, FieldDescriptor>();
        switch (definition.type()) {
            case ONE_TO_ONE -> {
                // a record can take part in at most one pairing
                var rules = List.of("ForeignKeyExists", "Unique");
                addKey(fields, lower(definition.modelA()) + "_id", definition.modelA(), rules);
                addKey(fields, lower(definition.modelB()) + "_id", definition.modelB(), rules);
            }
            case ONE_TO_MANY -> {
                var rules = List.of("ForeignKeyExists");
                addKey(fields, "one_" + lower(definition.modelOne()) + "_id", definition.modelOne(), rules);
                addKey(fields, "many_" + lower(definition.modelMany()) + "_id", definition.modelMany(), rules);
            }
            case MANY_TO_MANY -> {
                var rules = List.of("ForeignKeyExists");
                addKey(fields, lower(definition.modelA()) + "_id", definition.modelA(), rules);
                addKey(fields, lower(definition.modelB()) + "_id", definition.modelB(), rules);
            }
        }
        return fields;
    }

    /**
     * Core fields, then generated keys, then additional fields. An additional field may replace a
     * core field but never a generated key.
     */
    public RelationshipMetadata resolve(RelationshipDefinition definition, Map<String, FieldDescriptor> coreFields) {
        var keys = foreignKeyFields(definition);
        var fields = new LinkedHashMap<String, FieldDescriptor>(coreFields);
        fields.putAll(keys);
        definition.additionalFields().forEach((fieldName, field) -> {
            if (keys.containsKey(fieldName)) {
                log.warn("Relationship '{}': additional field '{}' collides with a generated key and is ignored",
                    definition.name(), fieldName);
            } else {
                fields.put(fieldName, field);
            }
        });
        var tableName = tableName(definition);
        log.debug("Resolved relationship {} ({}) to table {} with {} fields",
            definition.name(), definition.type().value(), tableName, fields.size());
        return new RelationshipMetadata(definition, tableName, fields);
    }

    /**
     * Name of the generated key that holds {@code participantName}'s id. For OneToMany the
     * participant matching {@code modelOne} (ignoring case) gets the one-side key and anything else
     * the many-side key.
     */
    public String modelIdField(RelationshipMetadata metadata, String participantName) {
        var participant = lower(participantName);
        var definition = metadata.definition();
        return switch (definition.type()) {
            case ONE_TO_ONE, MANY_TO_MANY -> participant + "_id";
            case ONE_TO_MANY -> participant.equals(lower(definition.modelOne()))
                ? "one_" + participant + "_id"
                : "many_" + participant + "_id";
        };
    }

    private static void addKey(Map<String, FieldDescriptor> fields, String fieldName, String participant,
                               List<String> rules) {
        fields.put(fieldName, FieldDescriptor.builder(fieldName, "ID")
            .label(participant + " ID")
            .required(true)
            .validationRules(rules)
            .attribute(FieldDescriptor.RELATED_MODEL, participant)
            .attribute(FieldDescriptor.RELATED_FIELD_NAME, "id")
            .build());
    }

    private static Map<String, FieldDescriptor> additionalFields(String relationship, Object raw) {
        var fields = new LinkedHashMap<String, FieldDescriptor>();
        if (raw == null) {
            return fields;
        }
        var entries = new ArrayList<Map.Entry<String, Object>>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> entries.add(Map.entry(String.valueOf(k), v == null ? Map.of() : v)));
        } else if (raw instanceof List<?> list) {
            for (var item : list) {
                var key = item instanceof Map<?, ?> m && m.get("name") != null ? String.valueOf(m.get("name")) : "";
                entries.add(Map.entry(key, item == null ? Map.of() : item));
            }
        } else {
            throw new SchemaException("Relationship '%s': additionalFields must be a map or a list".formatted(relationship),
                Map.of("relationship", relationship));
        }
        for (var entry : entries) {
            if (!(entry.getValue() instanceof Map<?, ?> definition)) {
                throw new SchemaException("Relationship '%s': additional field '%s' must be a map"
                    .formatted(relationship, entry.getKey()), Map.of("relationship", relationship, "field", entry.getKey()));
            }
            var field = FieldDescriptor.fromMap(entry.getKey(), SchemaMaps.stringKeyed(definition));
            fields.put(field.name(), field);
        }
        return fields;
    }

    private static String requireKey(Map<String, ?> raw, String key, String relationship) {
        var value = raw.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            var where = relationship != null ? "Relationship '%s'".formatted(relationship) : "Relationship metadata";
            throw new SchemaException("%s is missing required key '%s'".formatted(where, key),
                relationship != null ? Map.of("relationship", relationship, "missingKey", key) : Map.of("missingKey", key));
        }
        return String.valueOf(value);
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
