package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.List;

public class FloatField extends FieldBase {

    public FloatField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "NumberInput";
    }

    @Override
    protected List<String> defaultOperators() {
        return IntegerField.NUMERIC_OPERATORS;
    }

    @Override
    protected Object normalize(Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return raw;
            }
        }
        return raw;
    }
}
