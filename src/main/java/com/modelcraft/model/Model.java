package com.modelcraft.model;

import com.modelcraft.exception.ModelcraftException;
import com.modelcraft.exception.NotFoundException;
import com.modelcraft.metadata.EntityMetadata;
import com.modelcraft.metadata.FieldDescriptor;
import com.modelcraft.relationships.CascadeAction;
import com.modelcraft.relationships.Relationship;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A record of a metadata-defined entity. Subclasses registered in {@link ModelClassRegistry} may
 * add behaviour and core fields; they need a {@code (ModelContext, EntityMetadata)} constructor.
 */
public class Model extends ModelBase {

    private final EntityMetadata metadata;
    private Map<String, Relationship> relationships;

    public Model(ModelContext context, EntityMetadata metadata) {
        super(context);
        this.metadata = metadata;
    }

    @Override
    public String name() {
        return metadata.name();
    }

    @Override
    public String tableName() {
        return metadata.table();
    }

    @Override
    public Map<String, FieldDescriptor> fieldDescriptors() {
        return metadata.fields();
    }

    public EntityMetadata metadata() {
        return metadata;
    }

    /** Relationships named in the metadata, built on first use. Ones that fail to build are skipped. */
    public Map<String, Relationship> relationships() {
        if (relationships == null) {
            var built = new LinkedHashMap<String, Relationship>();
            for (var relationshipName : metadata.relationships()) {
                try {
                    built.put(relationshipName, context.relationshipFactory().create(relationshipName));
                } catch (ModelcraftException e) {
                    log.error("Failed to load relationship '{}' for {}: {}", relationshipName, name(), e.getMessage());
                }
            }
            relationships = built;
        }
        return relationships;
    }

    /**
     * @throws NotFoundException when the entity has no such relationship
     */
    public Relationship relationship(String relationshipName) {
        var relationship = relationships().get(relationshipName);
        if (relationship == null) {
            throw new NotFoundException("Relationship", relationshipName, List.copyOf(relationships().keySet()));
        }
        return relationship;
    }

    public List<Map<String, Object>> related(String relationshipName) {
        return relationship(relationshipName).relatedRecords(this);
    }

    public boolean addRelation(String relationshipName, ModelBase other, Map<String, ?> additionalData) {
        return relationship(relationshipName).add(this, other, additionalData);
    }

    public boolean addRelation(String relationshipName, ModelBase other) {
        return addRelation(relationshipName, other, Map.of());
    }

    public boolean removeRelation(String relationshipName, ModelBase other) {
        return relationship(relationshipName).remove(this, other);
    }

    public boolean hasRelation(String relationshipName, ModelBase other) {
        return relationship(relationshipName).has(this, other);
    }

    /** Entity on the other side of the named relationship. */
    public String relatedModelName(String relationshipName) {
        return relationship(relationshipName).otherModelName(name());
    }

    /** Run every field's rules; failures are kept on the fields. */
    public boolean validate() {
        var valid = true;
        for (var fieldName : fieldDescriptors().keySet()) {
            valid &= field(fieldName).validate();
        }
        return valid;
    }

    public Map<String, List<String>> validationErrors() {
        var errors = new LinkedHashMap<String, List<String>>();
        for (var fieldName : instantiatedFieldNames()) {
            var fieldErrors = field(fieldName).validationErrors();
            if (!fieldErrors.isEmpty()) {
                errors.put(fieldName, fieldErrors);
            }
        }
        return errors;
    }

    public boolean create() {
        ensureId();
        stampCreated();
        if (!validate()) {
            log.warn("Not creating {} {}: {}", name(), get("id"), validationErrors());
            return false;
        }
        var created = context.databaseConnector().create(this);
        if (created) {
            log.info("Created {} {}", name(), get("id"));
        }
        return created;
    }

    public boolean update() {
        stampUpdated();
        if (!validate()) {
            log.warn("Not updating {} {}: {}", name(), get("id"), validationErrors());
            return false;
        }
        return context.databaseConnector().update(this);
    }

    /**
     * Apply each relationship's declared cascade action, then soft delete. Nothing is deleted
     * when a relationship reports failure.
     *
     * @throws com.modelcraft.exception.ConstraintException when a {@code restrict} relationship has active rows
     */
    public boolean delete() {
        for (var relationship : relationships().values()) {
            if (!cascade(relationship, relationship.cascadeAction())) {
                return false;
            }
        }
        return softDeleteRecord();
    }

    /**
     * Apply {@code action} to every relationship in place of the declared ones, then soft delete.
     *
     * @throws com.modelcraft.exception.ConstraintException when {@code restrict} finds active rows
     */
    public boolean delete(CascadeAction action) {
        for (var relationship : relationships().values()) {
            if (!cascade(relationship, action)) {
                return false;
            }
        }
        return softDeleteRecord();
    }

    private boolean cascade(Relationship relationship, CascadeAction action) {
        if (relationship.handleModelDeletion(this, action)) {
            return true;
        }
        log.warn("Cascade {} failed on relationship {} for {} {}",
            action.value(), relationship.name(), name(), get("id"));
        return false;
    }

    private boolean softDeleteRecord() {
        stampDeleted();
        var deleted = context.databaseConnector().softDelete(this);
        if (deleted) {
            log.info("Soft-deleted {} {}", name(), get("id"));
        }
        return deleted;
    }

    public boolean hardDelete() {
        return context.databaseConnector().hardDelete(this);
    }

    public boolean restore() {
        clearDeleted();
        stampUpdated();
        var restored = context.databaseConnector().update(this);
        if (restored) {
            log.info("Restored {} {}", name(), get("id"));
        }
        return restored;
    }
}
