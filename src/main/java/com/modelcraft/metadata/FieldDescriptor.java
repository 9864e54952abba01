package com.modelcraft.metadata;

import com.modelcraft.exception.SchemaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declarative description of one field: its type, constraints and supported operators.
 * Type-specific keys (relatedModel, options, maxLength, ...) live in {@link #attributes()}.
 */
public record FieldDescriptor(
    String name,
    String type,
    String label,
    String description,
    boolean required,
    boolean readOnly,
    boolean unique,
    boolean dbField,
    boolean nullable,
    List<String> validationRules,
    List<String> operators,
    Object defaultValue,
    Map<String, Object> attributes
) {
    public static final String RELATED_MODEL = "relatedModel";
    public static final String RELATED_FIELD_NAME = "relatedFieldName";
    public static final String OPTIONS = "options";
    public static final String OPTIONS_PROVIDER = "optionsProvider";

    /** Keys mapped onto record components; everything else goes to attributes. */
    private static final Set<String> KNOWN_KEYS = Set.of(
        "name", "type", "label", "description", "required", "readOnly", "unique",
        "isDBField", "nullable", "validationRules", "operators", "defaultValue");

    public FieldDescriptor {
        if (name == null || name.isBlank()) {
            throw new SchemaException("Field metadata missing name", Map.of("type", String.valueOf(type)));
        }
        if (type == null || type.isBlank()) {
            throw new SchemaException("Field '%s' is missing its type".formatted(name), Map.of("field", name));
        }
        label = label != null ? label : name;
        validationRules = validationRules != null ? List.copyOf(validationRules) : List.of();
        operators = operators != null ? List.copyOf(operators) : List.of();
        attributes = attributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Map.of();
    }

    public static Builder builder(String name, String type) {
        return new Builder(name, type);
    }

    /**
     * Parse one field definition from schema data.
     *
     * @param key  the key the definition was found under, used when it has no {@code name}
     * @param raw  the definition
     */
    public static FieldDescriptor fromMap(String key, Map<String, ?> raw) {
        if (raw == null) {
            throw new SchemaException("Field '%s' has no definition".formatted(key), Map.of("field", String.valueOf(key)));
        }
        var name = raw.get("name") != null ? String.valueOf(raw.get("name")) : key;
        var attributes = new LinkedHashMap<String, Object>();
        raw.forEach((k, v) -> {
            if (!KNOWN_KEYS.contains(k)) {
                attributes.put(k, v);
            }
        });
        return new FieldDescriptor(
            name,
            normalizeType(raw.get("type")),
            stringOrNull(raw.get("label")),
            stringOrNull(raw.get("description")),
            flag(raw, "required", false),
            flag(raw, "readOnly", false),
            flag(raw, "unique", false),
            flag(raw, "isDBField", true),
            flag(raw, "nullable", false),
            ruleNames(name, raw.get("validationRules")),
            stringList(name, "operators", raw.get("operators")),
            raw.get("defaultValue"),
            attributes);
    }

    /** Inverse of {@link #fromMap}: the schema-data form of this descriptor. */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("type", type);
        map.put("label", label);
        if (description != null) {
            map.put("description", description);
        }
        map.put("required", required);
        map.put("readOnly", readOnly);
        map.put("unique", unique);
        map.put("isDBField", dbField);
        map.put("nullable", nullable);
        map.put("validationRules", validationRules);
        if (!operators.isEmpty()) {
            map.put("operators", operators);
        }
        if (defaultValue != null) {
            map.put("defaultValue", defaultValue);
        }
        map.putAll(attributes);
        return map;
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    public String stringAttribute(String key) {
        return stringOrNull(attributes.get(key));
    }

    public String relatedModel() {
        return stringAttribute(RELATED_MODEL);
    }

    /** A copy with one attribute added or replaced. */
    public FieldDescriptor withAttribute(String key, Object value) {
        var copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new FieldDescriptor(name, type, label, description, required, readOnly, unique,
            dbField, nullable, validationRules, operators, defaultValue, copy);
    }

    /** "IDField" and "DateTimeField" style names are accepted and shortened to "ID", "DateTime". */
    static String normalizeType(Object type) {
        var value = stringOrNull(type);
        if (value != null && value.endsWith("Field") && value.length() > "Field".length()) {
            return value.substring(0, value.length() - "Field".length());
        }
        return value;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static boolean flag(Map<String, ?> raw, String key, boolean fallback) {
        var value = raw.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(String.valueOf(value));
    }

    /**
     * Rules come either as a list of names or, in older schemas, as a map of name to flag.
     */
    private static List<String> ruleNames(String field, Object value) {
        if (value instanceof Map<?, ?> map) {
            var names = new ArrayList<String>();
            map.forEach((k, v) -> {
                if (Boolean.TRUE.equals(v)) {
                    names.add(String.valueOf(k));
                }
            });
            return names;
        }
        return stringList(field, "validationRules", value);
    }

    private static List<String> stringList(String field, String key, Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new SchemaException("Field '%s': '%s' must be a list".formatted(field, key),
                Map.of("field", field, "key", key));
        }
        return list.stream().map(String::valueOf).toList();
    }

    public static final class Builder {
        private final String name;
        private final String type;
        private String label;
        private String description;
        private boolean required;
        private boolean readOnly;
        private boolean unique;
        private boolean dbField = true;
        private boolean nullable;
        private List<String> validationRules = List.of();
        private List<String> operators = List.of();
        private Object defaultValue;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(String name, String type) {
            this.name = name;
            this.type = type;
        }

        public Builder label(String label) { this.label = label; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder required(boolean required) { this.required = required; return this; }
        public Builder readOnly(boolean readOnly) { this.readOnly = readOnly; return this; }
        public Builder unique(boolean unique) { this.unique = unique; return this; }
        public Builder dbField(boolean dbField) { this.dbField = dbField; return this; }
        public Builder nullable(boolean nullable) { this.nullable = nullable; return this; }
        public Builder validationRules(List<String> rules) { this.validationRules = rules; return this; }
        public Builder operators(List<String> operators) { this.operators = operators; return this; }
        public Builder defaultValue(Object defaultValue) { this.defaultValue = defaultValue; return this; }
        public Builder attribute(String key, Object value) { this.attributes.put(key, value); return this; }

        public FieldDescriptor build() {
            return new FieldDescriptor(name, type, label, description, required, readOnly, unique,
                dbField, nullable, validationRules, operators, defaultValue, attributes);
        }
    }
}
