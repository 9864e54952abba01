package com.modelcraft.relationships;

import com.modelcraft.model.ModelContext;

/**
 * Builds live relationships from the engine's resolved metadata.
 */
public class RelationshipFactory {

    private final ModelContext context;

    public RelationshipFactory(ModelContext context) {
        this.context = context;
    }

    /**
     * @throws com.modelcraft.exception.NotFoundException when the engine knows no such relationship
     */
    public Relationship create(String relationshipName) {
        return create(context.metadataEngine().relationshipMetadata(relationshipName));
    }

    public Relationship create(RelationshipMetadata metadata) {
        return new Relationship(context, metadata);
    }
}
