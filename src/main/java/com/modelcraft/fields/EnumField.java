package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single choice from a fixed set of options.
 *
 * <p>Options come from the {@code options} attribute, either a map of value to label or a list of
 * values. Dynamic options ({@code optionsProvider}) are resolved into that attribute when the
 * metadata is loaded.
 */
public class EnumField extends FieldBase {

    public EnumField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "Select";
    }

    @Override
    protected List<String> defaultOperators() {
        return List.of("equals", "notEquals", "in", "notIn", "isNull", "isNotNull");
    }

    /** Value to label, in declaration order. Empty when none are declared. */
    public Map<String, String> options() {
        var raw = descriptor().attribute(FieldDescriptor.OPTIONS);
        var options = new LinkedHashMap<String, String>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> options.put(String.valueOf(k), String.valueOf(v)));
        } else if (raw instanceof List<?> list) {
            list.forEach(v -> options.put(String.valueOf(v), String.valueOf(v)));
        }
        return Collections.unmodifiableMap(options);
    }
}
