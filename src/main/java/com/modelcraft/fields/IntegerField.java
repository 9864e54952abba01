package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.List;

/**
 * Whole numbers, held as {@link Long}. Numeric strings are parsed; anything else is kept as given
 * and left to the validation rules.
 */
public class IntegerField extends FieldBase {

    static final List<String> NUMERIC_OPERATORS = List.of(
        "equals", "notEquals", "greaterThan", "greaterThanOrEqual", "lessThan", "lessThanOrEqual",
        "between", "in", "notIn", "isNull", "isNotNull");

    public IntegerField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "NumberInput";
    }

    @Override
    protected List<String> defaultOperators() {
        return NUMERIC_OPERATORS;
    }

    @Override
    protected Object normalize(Object raw) {
        if (raw instanceof Number n) {
            return n.longValue();
        }
        if (raw instanceof String s && s.trim().matches("-?\\d+")) {
            return Long.parseLong(s.trim());
        }
        return raw;
    }
}
