package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.List;

/**
 * Calendar date, {@code yyyy-MM-dd}.
 */
public class DateField extends FieldBase {

    static final List<String> DATE_OPERATORS = List.of(
        "equals", "notEquals", "before", "after", "between", "isNull", "isNotNull");

    public DateField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "DatePicker";
    }

    @Override
    protected List<String> defaultOperators() {
        return DATE_OPERATORS;
    }
}
