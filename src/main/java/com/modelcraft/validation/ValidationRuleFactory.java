package com.modelcraft.validation;

import com.modelcraft.database.DatabaseConnector;
import com.modelcraft.exception.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanInstantiationException;
import org.springframework.beans.BeanUtils;

import java.util.Map;

/**
 * Turns a rule name from field metadata into a fresh rule instance.
 */
public class ValidationRuleFactory {

    private static final Logger log = LoggerFactory.getLogger(ValidationRuleFactory.class);

    private final ValidationRuleCatalog catalog;
    private final DatabaseConnector connector;

    /**
     * @param connector given to {@link DatabaseAware} rules; may be null when no database is wired
     */
    public ValidationRuleFactory(ValidationRuleCatalog catalog, DatabaseConnector connector) {
        this.catalog = catalog;
        this.connector = connector;
    }

    /**
     * @throws SchemaException when no rule of that name was discovered, or it cannot be instantiated
     */
    public ValidationRule create(String ruleName) {
        var descriptor = catalog.find(ruleName).orElseThrow(() -> {
            log.warn("Unknown validation rule '{}'; available: {}", ruleName, catalog.names());
            return new SchemaException("Unknown validation rule: " + ruleName,
                Map.of("rule", String.valueOf(ruleName), "available", catalog.names()));
        });

        ValidationRule rule;
        try {
            rule = BeanUtils.instantiateClass(descriptor.implementingClass());
        } catch (BeanInstantiationException e) {
            log.error("Validation rule '{}' could not be instantiated", ruleName, e);
            throw new SchemaException("Cannot instantiate validation rule: " + ruleName,
                Map.of("rule", ruleName, "class", descriptor.implementingClass().getName()), e);
        }
        if (rule instanceof DatabaseAware aware && connector != null) {
            aware.setDatabaseConnector(connector);
        }
        return rule;
    }
}
