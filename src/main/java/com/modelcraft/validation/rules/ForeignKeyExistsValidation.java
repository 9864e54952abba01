package com.modelcraft.validation.rules;

import com.modelcraft.database.DatabaseConnector;
import com.modelcraft.fields.FieldBase;
import com.modelcraft.metadata.FieldDescriptor;
import com.modelcraft.validation.DatabaseAware;
import com.modelcraft.validation.ValidationRule;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The referenced record must exist in the related model's table (the lower-cased model name).
 * Fields without a {@code relatedModel} attribute are not checked.
 */
public class ForeignKeyExistsValidation extends ValidationRule implements DatabaseAware {

    private DatabaseConnector connector;

    public ForeignKeyExistsValidation() {
        super("The selected {fieldName} does not exist.");
    }

    @Override
    public void setDatabaseConnector(DatabaseConnector connector) {
        this.connector = connector;
    }

    @Override
    public String description() {
        return "Referenced record must exist in the related model";
    }

    @Override
    public boolean validate(Object value, FieldBase field) {
        if (isEmpty(value)) {
            return true;
        }
        var relatedModel = field != null ? field.descriptor().relatedModel() : null;
        if (relatedModel == null) {
            log.warn("ForeignKeyExists applied to field '{}' without a relatedModel",
                field != null ? field.name() : "unknown");
            return true;
        }
        if (connector == null) {
            log.error("ForeignKeyExists validation needs a database connector (field '{}')", field.name());
            return false;
        }
        var relatedField = field.descriptor().stringAttribute(FieldDescriptor.RELATED_FIELD_NAME);
        var exists = connector.recordExists(relatedModel.toLowerCase(Locale.ROOT),
            Map.of(relatedField != null ? relatedField : "id", value));
        if (!exists) {
            log.info("Foreign key validation failed for '{}': {} {} not found", field.name(), relatedModel, value);
        }
        return exists;
    }

    @Override
    public List<String> applicableFieldTypes() {
        return List.of("RelatedRecord", "ID");
    }
}
