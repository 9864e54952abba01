package com.modelcraft.fields;

import com.modelcraft.exception.ModelcraftException;
import com.modelcraft.exception.SchemaException;
import com.modelcraft.metadata.FieldDescriptor;
import com.modelcraft.validation.ValidationRuleFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanInstantiationException;
import org.springframework.beans.BeanUtils;
import org.springframework.util.ClassUtils;

import java.util.Map;

/**
 * Builds live fields from descriptors, with their validation rules attached.
 */
public class FieldFactory {

    private static final Logger log = LoggerFactory.getLogger(FieldFactory.class);

    private final FieldTypeCatalog catalog;
    private final ValidationRuleFactory ruleFactory;

    public FieldFactory(FieldTypeCatalog catalog, ValidationRuleFactory ruleFactory) {
        this.catalog = catalog;
        this.ruleFactory = ruleFactory;
    }

    /**
     * @param table table the field belongs to, used by database-backed rules
     * @throws SchemaException when the descriptor's type is not in the catalog
     */
    public FieldBase create(FieldDescriptor descriptor, String table) {
        var type = catalog.find(descriptor.type()).orElseThrow(() -> {
            log.warn("Unknown field type '{}' for field '{}'; available: {}",
                descriptor.type(), descriptor.name(), catalog.typeNames());
            return new SchemaException("Unknown field type: " + descriptor.type(),
                Map.of("field", descriptor.name(), "type", descriptor.type()));
        });

        var constructor = ClassUtils.getConstructorIfAvailable(type.implementingClass(), FieldDescriptor.class);
        if (constructor == null) {
            throw new SchemaException("Field type %s has no (FieldDescriptor) constructor".formatted(type.type()),
                Map.of("type", type.type(), "class", type.implementingClass().getName()));
        }
        FieldBase field;
        try {
            field = BeanUtils.instantiateClass(constructor, descriptor);
        } catch (BeanInstantiationException e) {
            throw new SchemaException("Cannot create field '%s' of type %s".formatted(descriptor.name(), type.type()),
                Map.of("field", descriptor.name(), "type", type.type()), e);
        }
        field.setTableName(table);

        for (var ruleName : descriptor.validationRules()) {
            try {
                field.addValidationRule(ruleFactory.create(ruleName));
            } catch (ModelcraftException e) {
                log.error("Failed to attach validation rule '{}' to field '{}': {}",
                    ruleName, descriptor.name(), e.getMessage());
            }
        }
        return field;
    }
}
