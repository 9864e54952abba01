package com.modelcraft.model;

import com.modelcraft.exception.SchemaException;
import com.modelcraft.fields.FieldBase;
import com.modelcraft.metadata.FieldDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Common runtime of entities and relationship rows: a set of live fields built on first access
 * from the descriptors, plus audit stamping.
 */
public abstract class ModelBase {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final ModelContext context;

    private final Map<String, FieldBase> liveFields = new LinkedHashMap<>();

    protected ModelBase(ModelContext context) {
        this.context = context;
    }

    /** Entity or relationship name. */
    public abstract String name();

    public abstract String tableName();

    /** Every field this record has, in order. */
    public abstract Map<String, FieldDescriptor> fieldDescriptors();

    public boolean hasField(String fieldName) {
        return fieldDescriptors().containsKey(fieldName);
    }

    /**
     * The live field, created on first access.
     *
     * @throws SchemaException when the record has no such field
     */
    public FieldBase field(String fieldName) {
        var field = liveFields.get(fieldName);
        if (field != null) {
            return field;
        }
        var descriptor = fieldDescriptors().get(fieldName);
        if (descriptor == null) {
            throw new SchemaException("Field '%s' not found on %s".formatted(fieldName, name()),
                Map.of("field", fieldName, "model", name(), "available", List.copyOf(fieldDescriptors().keySet())));
        }
        field = context.fieldFactory().create(descriptor, tableName());
        field.setRecordIdSource(() -> hasField("id") ? field("id").getValue() : null);
        liveFields.put(fieldName, field);
        return field;
    }

    /** Names of the fields instantiated so far. */
    public List<String> instantiatedFieldNames() {
        return List.copyOf(liveFields.keySet());
    }

    /** The field's value, or null with a warning when there is no such field. */
    public Object get(String fieldName) {
        if (!hasField(fieldName)) {
            log.warn("Field '{}' not found on {}", fieldName, name());
            return null;
        }
        return field(fieldName).getValue();
    }

    /**
     * Validate and set a value.
     *
     * @return false when validation rejected the value (the old value is kept)
     * @throws SchemaException when the record has no such field
     */
    public boolean set(String fieldName, Object value) {
        return field(fieldName).setValue(value);
    }

    /** Load a database row. Values are trusted; columns without a field are ignored. */
    public void populateFromRow(Map<String, ?> row) {
        row.forEach((column, value) -> {
            if (hasField(column)) {
                field(column).setValueFromTrustedSource(value);
            }
        });
    }

    /** Values of every field, including non-database ones. */
    public Map<String, Object> toMap() {
        var values = new LinkedHashMap<String, Object>();
        fieldDescriptors().keySet().forEach(name -> values.put(name, field(name).getValue()));
        return values;
    }

    /** Values of the database fields only, as the connector writes them. */
    public Map<String, Object> dbValues() {
        var values = new LinkedHashMap<String, Object>();
        fieldDescriptors().values().stream()
            .filter(FieldDescriptor::dbField)
            .forEach(descriptor -> values.put(descriptor.name(), field(descriptor.name()).getValue()));
        return values;
    }

    /** Discard every live field, so values fall back to the descriptors' defaults. */
    protected void resetFields() {
        liveFields.clear();
    }

    public boolean isDeleted() {
        return hasField("deleted_at") && get("deleted_at") != null;
    }

    protected String now() {
        return LocalDateTime.now(context.clock()).format(TIMESTAMP_FORMAT);
    }

    protected static String generateUuid() {
        return UUID.randomUUID().toString();
    }

    protected void ensureId() {
        if (hasField("id") && get("id") == null) {
            field("id").setValueFromTrustedSource(generateUuid());
        }
    }

    protected void stampCreated() {
        var timestamp = now();
        var user = context.currentUserId();
        setTrusted("created_at", timestamp);
        setTrusted("updated_at", timestamp);
        setTrusted("created_by", user);
        setTrusted("updated_by", user);
    }

    protected void stampUpdated() {
        setTrusted("updated_at", now());
        setTrusted("updated_by", context.currentUserId());
    }

    protected void stampDeleted() {
        setTrusted("deleted_at", now());
        setTrusted("deleted_by", context.currentUserId());
    }

    protected void clearDeleted() {
        setTrusted("deleted_at", null);
        setTrusted("deleted_by", null);
    }

    private void setTrusted(String fieldName, Object value) {
        if (hasField(fieldName)) {
            field(fieldName).setValueFromTrustedSource(value);
        }
    }

    @Override
    public String toString() {
        return "%s[%s id=%s]".formatted(getClass().getSimpleName(), name(), hasField("id") ? get("id") : null);
    }
}
