package com.modelcraft.validation.rules;

import com.modelcraft.database.DatabaseConnector;
import com.modelcraft.fields.FieldBase;
import com.modelcraft.validation.DatabaseAware;
import com.modelcraft.validation.ValidationRule;

import java.util.Map;

/**
 * No other row of the field's table may hold the same value. The record owning the field is
 * excluded once it has an id. Server-side only.
 */
public class UniqueValidation extends ValidationRule implements DatabaseAware {

    private DatabaseConnector connector;

    public UniqueValidation() {
        super("This value must be unique.");
    }

    @Override
    public void setDatabaseConnector(DatabaseConnector connector) {
        this.connector = connector;
    }

    @Override
    public String description() {
        return "Value must not already exist in the table";
    }

    @Override
    public boolean validate(Object value, FieldBase field) {
        if (isEmpty(value)) {
            return true;
        }
        if (connector == null || field == null || field.tableName().isEmpty()) {
            log.error("Unique validation needs a database connector and a field with a table");
            return false;
        }
        var criteria = Map.<String, Object>of(field.name(), value);
        var recordId = field.recordId();
        var taken = recordId != null
            ? connector.recordExistsExcludingId(field.tableName(), criteria, recordId)
            : connector.recordExists(field.tableName(), criteria);
        if (taken) {
            log.info("Unique validation failed for {}.{}: value already exists", field.tableName(), field.name());
            return false;
        }
        return true;
    }
}
