package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.List;

/**
 * Primary and foreign key values. Kept as strings (UUIDs).
 */
public class IDField extends FieldBase {

    private static final List<String> OPERATORS = List.of("equals", "notEquals", "in", "notIn", "isNull", "isNotNull");

    public IDField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "HiddenInput";
    }

    @Override
    protected List<String> defaultOperators() {
        return OPERATORS;
    }

    @Override
    protected Object normalize(Object raw) {
        return raw == null ? null : String.valueOf(raw);
    }

    public boolean isPrimaryKey() {
        return Boolean.TRUE.equals(descriptor().attribute("isPrimaryKey"));
    }
}
