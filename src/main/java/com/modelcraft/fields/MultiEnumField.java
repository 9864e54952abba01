package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.Arrays;
import java.util.List;

/**
 * Any number of choices from a fixed set. The value is a list of option keys.
 */
public class MultiEnumField extends EnumField {

    public MultiEnumField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "MultiSelect";
    }

    @Override
    protected List<String> defaultOperators() {
        return List.of("overlap", "containsAll", "containsNone", "isNull", "isNotNull");
    }

    @Override
    protected Object normalize(Object raw) {
        // comma separated form used by simple query strings
        if (raw instanceof String s) {
            return s.isBlank() ? List.of() : Arrays.stream(s.split(",")).map(String::trim).toList();
        }
        return raw;
    }
}
