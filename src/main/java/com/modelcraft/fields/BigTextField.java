package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.List;

/**
 * Multi-line text without a length limit.
 */
public class BigTextField extends FieldBase {

    private static final List<String> OPERATORS = List.of("contains", "startsWith", "endsWith", "isNull", "isNotNull");

    public BigTextField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "TextArea";
    }

    @Override
    protected List<String> defaultOperators() {
        return OPERATORS;
    }
}
