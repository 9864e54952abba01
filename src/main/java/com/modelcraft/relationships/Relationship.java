package com.modelcraft.relationships;

import com.modelcraft.database.DatabaseConnector;
import com.modelcraft.exception.ConstraintException;
import com.modelcraft.exception.ModelcraftException;
import com.modelcraft.metadata.FieldDescriptor;
import com.modelcraft.model.ModelBase;
import com.modelcraft.model.ModelContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Live relationship: one row of the relationship table plus the operations that link, unlink and
 * cascade between two models. A single instance serves every call; each operation starts from a
 * clean set of field values.
 */
public class Relationship extends ModelBase {

    private final RelationshipMetadata metadata;

    public Relationship(ModelContext context, RelationshipMetadata metadata) {
        super(context);
        this.metadata = metadata;
    }

    @Override
    public String name() {
        return metadata.name();
    }

    @Override
    public String tableName() {
        return metadata.tableName();
    }

    @Override
    public Map<String, FieldDescriptor> fieldDescriptors() {
        return metadata.fields();
    }

    public RelationshipMetadata metadata() {
        return metadata;
    }

    public RelationshipType type() {
        return metadata.type();
    }

    /** What deleting a participant does to this relationship's rows unless the caller overrides it. */
    public CascadeAction cascadeAction() {
        return metadata.definition().cascadeAction();
    }

    /** Key column holding {@code model}'s id in this relationship's table. */
    public String modelIdField(ModelBase model) {
        return context.relationshipResolver().modelIdField(metadata, model.name());
    }

    /** The participant on the other side of {@code entityName}. */
    public String otherModelName(String entityName) {
        var definition = metadata.definition();
        if (definition.type() == RelationshipType.ONE_TO_MANY) {
            return definition.modelOne().equalsIgnoreCase(entityName) ? definition.modelMany() : definition.modelOne();
        }
        return definition.modelA().equalsIgnoreCase(entityName) ? definition.modelB() : definition.modelA();
    }

    /** Active rows linked to {@code model}; at most one for OneToOne. */
    public List<Map<String, Object>> relatedRecords(ModelBase model) {
        var criteria = activeCriteria(model);
        Map<String, Object> parameters = type() == RelationshipType.ONE_TO_ONE ? Map.of("limit", 1) : Map.of();
        var records = connectorCall("find related records of", () ->
            context.databaseConnector().find(this, criteria, List.of(), parameters));
        log.debug("{} {}: {} related records for {} {}",
            type().value(), name(), records.size(), model.name(), model.get("id"));
        return records;
    }

    public long activeRelatedCount(ModelBase model) {
        return connectorCall("count rows of", () -> context.databaseConnector().count(this, activeCriteria(model)));
    }

    /**
     * Page {@code page} (1-based) of the active rows linked to {@code model}.
     *
     * @throws IllegalArgumentException when {@code page} or {@code perPage} is below 1
     */
    public RelatedPage relatedPaginated(ModelBase model, int page, int perPage) {
        if (page < 1 || perPage < 1) {
            throw new IllegalArgumentException("page and perPage must be positive, got %d and %d".formatted(page, perPage));
        }
        var total = activeRelatedCount(model);
        var criteria = activeCriteria(model);
        Map<String, Object> parameters = Map.of("limit", perPage, "offset", (page - 1) * perPage);
        var records = connectorCall("page related records of", () ->
            context.databaseConnector().find(this, criteria, List.of(), parameters));
        log.debug("{} {}: page {} of related records for {} {} ({} of {})",
            type().value(), name(), page, model.name(), model.get("id"), records.size(), total);
        return RelatedPage.of(records, page, perPage, total);
    }

    /** Soft-deleted rows of {@code model}. */
    public List<Map<String, Object>> deletedRelationshipRecords(ModelBase model) {
        var criteria = new LinkedHashMap<String, Object>();
        criteria.put(modelIdField(model), model.get("id"));
        criteria.put("deleted_at", DatabaseConnector.NOT_NULL);
        return connectorCall("find deleted records of", () ->
            context.databaseConnector().find(this, criteria, List.of(), Map.of()));
    }

    public boolean has(ModelBase modelA, ModelBase modelB) {
        var criteria = pairCriteria(modelA, modelB);
        criteria.put("deleted_at", null);
        return !connectorCall("check", () ->
            context.databaseConnector().find(this, criteria, List.of(), Map.of("limit", 1))).isEmpty();
    }

    /**
     * Link two models. For OneToOne any existing link of either model is soft-deleted first.
     *
     * @param additionalData values for the relationship's additional fields; unknown keys are ignored
     * @return false when the pair is already linked or the connector refused the insert
     */
    public boolean add(ModelBase modelA, ModelBase modelB, Map<String, ?> additionalData) {
        if (has(modelA, modelB)) {
            log.warn("Relationship {} already links {} {} and {} {}",
                name(), modelA.name(), modelA.get("id"), modelB.name(), modelB.get("id"));
            return false;
        }
        if (type() == RelationshipType.ONE_TO_ONE) {
            softDeleteAll(modelA);
            softDeleteAll(modelB);
        }

        resetFields();
        field(modelIdField(modelA)).setValueFromTrustedSource(modelA.get("id"));
        field(modelIdField(modelB)).setValueFromTrustedSource(modelB.get("id"));
        ensureId();
        stampCreated();
        if (additionalData != null) {
            additionalData.forEach((fieldName, value) -> {
                if (hasField(fieldName)) {
                    set(fieldName, value);
                }
            });
        }

        var created = connectorCall("add", () -> context.databaseConnector().create(this));
        if (created) {
            log.info("Relationship {} added: {} {} <-> {} {}",
                name(), modelA.name(), modelA.get("id"), modelB.name(), modelB.get("id"));
        }
        return created;
    }

    public boolean add(ModelBase modelA, ModelBase modelB) {
        return add(modelA, modelB, Map.of());
    }

    /**
     * Soft-delete the active row linking the two models. The row is loaded into this instance,
     * stamped and written back.
     *
     * @return false when no active row links them
     */
    public boolean remove(ModelBase modelA, ModelBase modelB) {
        var criteria = pairCriteria(modelA, modelB);
        criteria.put("deleted_at", null);
        var rows = connectorCall("find", () ->
            context.databaseConnector().find(this, criteria, List.of(), Map.of("limit", 1)));
        if (rows.isEmpty()) {
            log.warn("Relationship {}: nothing to remove between {} {} and {} {}",
                name(), modelA.name(), modelA.get("id"), modelB.name(), modelB.get("id"));
            return false;
        }

        resetFields();
        populateFromRow(rows.get(0));
        stampDeleted();
        var updated = connectorCall("remove", () -> context.databaseConnector().update(this));
        if (updated) {
            log.info("Relationship {} removed: {} {} <-> {} {}",
                name(), modelA.name(), modelA.get("id"), modelB.name(), modelB.get("id"));
        }
        return updated;
    }

    /**
     * Change the additional fields of the active row linking the two models and stamp it updated.
     * Keys that are not additional fields are ignored.
     *
     * @return true when {@code additionalData} is empty, false when no active row links the models
     */
    public boolean updateRelation(ModelBase modelA, ModelBase modelB, Map<String, ?> additionalData) {
        if (additionalData == null || additionalData.isEmpty()) {
            return true;
        }
        var criteria = pairCriteria(modelA, modelB);
        criteria.put("deleted_at", null);
        var rows = connectorCall("find", () ->
            context.databaseConnector().find(this, criteria, List.of(), Map.of("limit", 1)));
        if (rows.isEmpty()) {
            log.warn("Relationship {}: nothing to update between {} {} and {} {}",
                name(), modelA.name(), modelA.get("id"), modelB.name(), modelB.get("id"));
            return false;
        }

        resetFields();
        populateFromRow(rows.get(0));
        var additionalFields = metadata.definition().additionalFields();
        additionalData.forEach((fieldName, value) -> {
            if (additionalFields.containsKey(fieldName)) {
                set(fieldName, value);
            } else {
                log.warn("Relationship {}: '{}' is not an additional field, ignored", name(), fieldName);
            }
        });
        stampUpdated();
        var updated = connectorCall("update", () -> context.databaseConnector().update(this));
        if (updated) {
            log.info("Relationship {} updated: {} {} <-> {} {}",
                name(), modelA.name(), modelA.get("id"), modelB.name(), modelB.get("id"));
        }
        return updated;
    }

    /**
     * Soft-delete every active row of {@code model}.
     *
     * @return whether any row was affected
     */
    public boolean softDeleteRelationship(ModelBase model) {
        var affected = softDeleteAll(model);
        log.info("Relationship {}: soft-deleted {} rows of {} {}", name(), affected, model.name(), model.get("id"));
        return affected > 0;
    }

    /**
     * Permanently delete every row of {@code model}, soft-deleted ones included.
     *
     * @return whether any row was deleted
     */
    public boolean removeAllRelations(ModelBase model) {
        var criteria = new LinkedHashMap<String, Object>();
        criteria.put(modelIdField(model), model.get("id"));
        var rows = connectorCall("find rows of", () ->
            context.databaseConnector().find(this, criteria, List.of(), Map.of()));
        var removed = 0;
        for (var row : rows) {
            resetFields();
            populateFromRow(row);
            if (connectorCall("remove rows of", () -> context.databaseConnector().hardDelete(this))) {
                removed++;
            }
        }
        resetFields();
        log.info("Relationship {}: removed {} rows of {} {}", name(), removed, model.name(), model.get("id"));
        return removed > 0;
    }

    /** Undo the soft deletion of the rows linking the two models. */
    public boolean restore(ModelBase modelA, ModelBase modelB) {
        var criteria = pairCriteria(modelA, modelB);
        int restored = connectorCall("restore", () -> context.databaseConnector().bulkRestoreByCriteria(this, criteria));
        log.info("Relationship {}: restored {} rows", name(), restored);
        return restored > 0;
    }

    /** Undo the soft deletion of every row of {@code model}. */
    public boolean restore(ModelBase model) {
        var criteria = new LinkedHashMap<String, Object>();
        criteria.put(modelIdField(model), model.get("id"));
        int restored = connectorCall("restore", () -> context.databaseConnector().bulkRestoreByCriteria(this, criteria));
        log.info("Relationship {}: restored {} rows of {} {}", name(), restored, model.name(), model.get("id"));
        return restored > 0;
    }

    /**
     * Apply {@code action} to this relationship's rows before {@code deletedModel} goes away.
     *
     * @throws ConstraintException for {@code restrict} while active rows exist
     */
    public boolean handleModelDeletion(ModelBase deletedModel, CascadeAction action) {
        return switch (action) {
            case RESTRICT -> {
                var active = activeRelatedCount(deletedModel);
                if (active > 0) {
                    log.warn("Cannot delete {} {}: {} active rows in relationship {}",
                        deletedModel.name(), deletedModel.get("id"), active, name());
                    throw new ConstraintException(
                        "Cannot delete %s with existing %s relationships".formatted(deletedModel.name(), type().value()),
                        Map.of("model", deletedModel.name(),
                            "id", String.valueOf(deletedModel.get("id")),
                            "relationship", name(),
                            "activeRelationships", active));
                }
                yield true;
            }
            case CASCADE, SOFT_DELETE -> {
                var affected = softDeleteAll(deletedModel);
                log.info("Relationship {}: {} soft-deleted {} rows of {} {}",
                    name(), action.value(), affected, deletedModel.name(), deletedModel.get("id"));
                yield true;
            }
        };
    }

    /**
     * @param action one of {@code restrict}, {@code cascade}, {@code softDelete}
     */
    public boolean handleModelDeletion(ModelBase deletedModel, String action) {
        return handleModelDeletion(deletedModel, CascadeAction.fromValue(action));
    }

    private int softDeleteAll(ModelBase model) {
        return connectorCall("soft-delete rows of", () -> context.databaseConnector().bulkSoftDeleteByFieldValue(
            this, modelIdField(model), model.get("id"), context.currentUserId()));
    }

    private Map<String, Object> activeCriteria(ModelBase model) {
        var criteria = new LinkedHashMap<String, Object>();
        criteria.put(modelIdField(model), model.get("id"));
        criteria.put("deleted_at", null);
        return criteria;
    }

    private Map<String, Object> pairCriteria(ModelBase modelA, ModelBase modelB) {
        var criteria = new LinkedHashMap<String, Object>();
        criteria.put(modelIdField(modelA), modelA.get("id"));
        criteria.put(modelIdField(modelB), modelB.get("id"));
        return criteria;
    }

    private <T> T connectorCall(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (ModelcraftException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to {} relationship {}: {}", action, name(), e.getMessage());
            throw new ModelcraftException("Failed to %s relationship %s: %s".formatted(action, name(), e.getMessage()),
                Map.of("relationship", name(), "table", tableName()), e);
        }
    }
}
