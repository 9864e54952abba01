package com.modelcraft.model;

import com.modelcraft.database.DatabaseConnector;
import com.modelcraft.exception.ConfigurationException;
import com.modelcraft.fields.FieldFactory;
import com.modelcraft.metadata.MetadataEngine;
import com.modelcraft.relationships.RelationshipFactory;
import com.modelcraft.relationships.RelationshipResolver;

import java.time.Clock;
import java.util.Objects;

/**
 * Everything a live model needs from the outside: metadata, field construction, persistence,
 * the current user and the clock. The connector may be absent until a model touches the database.
 */
public class ModelContext {

    private final MetadataEngine metadataEngine;
    private final FieldFactory fieldFactory;
    private final RelationshipResolver relationshipResolver;
    private final DatabaseConnector databaseConnector;
    private final CurrentUserProvider currentUserProvider;
    private final Clock clock;
    private final ModelClassRegistry modelClassRegistry;

    private RelationshipFactory relationshipFactory;
    private ModelFactory modelFactory;

    public ModelContext(MetadataEngine metadataEngine,
                        FieldFactory fieldFactory,
                        RelationshipResolver relationshipResolver,
                        DatabaseConnector databaseConnector,
                        CurrentUserProvider currentUserProvider,
                        Clock clock,
                        ModelClassRegistry modelClassRegistry) {
        this.metadataEngine = Objects.requireNonNull(metadataEngine, "metadataEngine");
        this.fieldFactory = Objects.requireNonNull(fieldFactory, "fieldFactory");
        this.relationshipResolver = Objects.requireNonNull(relationshipResolver, "relationshipResolver");
        this.databaseConnector = databaseConnector;
        this.currentUserProvider = currentUserProvider != null ? currentUserProvider : CurrentUserProvider.SYSTEM;
        this.clock = clock != null ? clock : Clock.systemDefaultZone();
        this.modelClassRegistry = modelClassRegistry != null ? modelClassRegistry : new ModelClassRegistry();
    }

    public MetadataEngine metadataEngine() {
        return metadataEngine;
    }

    public FieldFactory fieldFactory() {
        return fieldFactory;
    }

    public RelationshipResolver relationshipResolver() {
        return relationshipResolver;
    }

    /**
     * @throws ConfigurationException when the application wired no connector
     */
    public DatabaseConnector databaseConnector() {
        if (databaseConnector == null) {
            throw new ConfigurationException("No DatabaseConnector configured");
        }
        return databaseConnector;
    }

    public Clock clock() {
        return clock;
    }

    public ModelClassRegistry modelClassRegistry() {
        return modelClassRegistry;
    }

    public String currentUserId() {
        var id = currentUserProvider.currentUserId();
        return id != null && !id.isBlank() ? id : CurrentUserProvider.SYSTEM_USER;
    }

    public RelationshipFactory relationshipFactory() {
        if (relationshipFactory == null) {
            relationshipFactory = new RelationshipFactory(this);
        }
        return relationshipFactory;
    }

    public ModelFactory modelFactory() {
        if (modelFactory == null) {
            modelFactory = new ModelFactory(this);
        }
        return modelFactory;
    }
}
