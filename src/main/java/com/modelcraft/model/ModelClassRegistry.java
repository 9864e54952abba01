package com.modelcraft.model;

import com.modelcraft.exception.ConfigurationException;
import com.modelcraft.metadata.EntityMetadata;
import org.springframework.beans.BeanInstantiationException;
import org.springframework.beans.BeanUtils;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Constructor;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps entity names to the {@link Model} subclass that represents them. Unregistered entities use
 * {@link Model} itself.
 */
public class ModelClassRegistry {

    private final Map<String, Constructor<? extends Model>> constructors = new HashMap<>();
    private final Map<String, Class<? extends Model>> classes = new HashMap<>();

    /**
     * @throws ConfigurationException when {@code type} lacks a public (ModelContext, EntityMetadata) constructor
     */
    public ModelClassRegistry register(String entityName, Class<? extends Model> type) {
        var constructor = ClassUtils.getConstructorIfAvailable(type, ModelContext.class, EntityMetadata.class);
        if (constructor == null) {
            throw new ConfigurationException("%s needs a public (ModelContext, EntityMetadata) constructor"
                .formatted(type.getName()), Map.of("entity", entityName, "class", type.getName()));
        }
        constructors.put(entityName, constructor);
        classes.put(entityName, type);
        return this;
    }

    public Class<? extends Model> classFor(String entityName) {
        return classes.getOrDefault(entityName, Model.class);
    }

    public Model instantiate(String entityName, ModelContext context, EntityMetadata metadata) {
        var constructor = constructors.get(entityName);
        if (constructor == null) {
            return new Model(context, metadata);
        }
        try {
            return BeanUtils.instantiateClass(constructor, context, metadata);
        } catch (BeanInstantiationException e) {
            throw new ConfigurationException("Cannot instantiate model class for " + entityName,
                Map.of("entity", entityName, "class", classes.get(entityName).getName()), e);
        }
    }
}
