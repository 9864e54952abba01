package com.modelcraft.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates entity instances by name.
 */
public class ModelFactory {

    private static final Logger log = LoggerFactory.getLogger(ModelFactory.class);

    private final ModelContext context;

    public ModelFactory(ModelContext context) {
        this.context = context;
    }

    /**
     * An empty instance of the entity.
     *
     * @throws com.modelcraft.exception.NotFoundException when the entity is unknown
     */
    public Model newModel(String entityName) {
        var name = context.metadataEngine().resolveEntityIdentifier(entityName);
        var metadata = context.metadataEngine().entityMetadata(name);
        return context.modelClassRegistry().instantiate(name, context, metadata);
    }

    /** The active record with the given id, if any. */
    public Optional<Model> retrieve(String entityName, Object id) {
        var model = newModel(entityName);
        var criteria = new LinkedHashMap<String, Object>();
        criteria.put("id", id);
        criteria.put("deleted_at", null);
        var rows = context.databaseConnector().find(model, criteria, List.of(), Map.of("limit", 1));
        if (rows.isEmpty()) {
            log.debug("No active {} with id {}", entityName, id);
            return Optional.empty();
        }
        model.populateFromRow(rows.get(0));
        return Optional.of(model);
    }
}
