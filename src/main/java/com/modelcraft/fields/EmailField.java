package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.List;

public class EmailField extends FieldBase {

    public EmailField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "EmailInput";
    }

    @Override
    protected List<String> defaultOperators() {
        return TextField.TEXT_OPERATORS;
    }

    @Override
    protected Object normalize(Object raw) {
        return raw instanceof String s ? s.trim() : raw;
    }
}
