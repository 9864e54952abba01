package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.List;

public class TextField extends FieldBase {

    public static final int DEFAULT_MAX_LENGTH = 255;

    static final List<String> TEXT_OPERATORS = List.of(
        "equals", "notEquals", "contains", "startsWith", "endsWith", "in", "notIn", "isNull", "isNotNull");

    public TextField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "TextInput";
    }

    @Override
    protected List<String> defaultOperators() {
        return TEXT_OPERATORS;
    }

    public int maxLength() {
        return descriptor().attribute("maxLength") instanceof Number n ? n.intValue() : DEFAULT_MAX_LENGTH;
    }
}
