package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.List;

/**
 * Timestamp, {@code yyyy-MM-dd HH:mm:ss}.
 */
public class DateTimeField extends FieldBase {

    public DateTimeField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "DateTimePicker";
    }

    @Override
    protected List<String> defaultOperators() {
        return DateField.DATE_OPERATORS;
    }
}
