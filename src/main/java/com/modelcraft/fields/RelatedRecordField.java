package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.List;

/**
 * Reference to a record of another entity.
 */
public class RelatedRecordField extends FieldBase {

    public RelatedRecordField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "RelatedRecordSelect";
    }

    @Override
    protected List<String> defaultOperators() {
        return List.of("equals", "notEquals", "in", "notIn", "isNull", "isNotNull");
    }

    public String relatedModel() {
        return descriptor().relatedModel();
    }

    public String relatedFieldName() {
        var name = descriptor().stringAttribute(FieldDescriptor.RELATED_FIELD_NAME);
        return name != null ? name : "id";
    }

    public String displayFieldName() {
        return descriptor().stringAttribute("displayFieldName");
    }
}
