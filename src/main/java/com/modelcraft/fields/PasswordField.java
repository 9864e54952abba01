package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.List;

/**
 * Secret value. Only null checks may be filtered on.
 */
public class PasswordField extends FieldBase {

    public PasswordField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "PasswordInput";
    }

    @Override
    protected List<String> defaultOperators() {
        return List.of("isNull", "isNotNull");
    }

    @Override
    public String toString() {
        return "PasswordField[%s=****]".formatted(name());
    }
}
