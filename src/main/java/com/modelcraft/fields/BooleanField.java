package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

import java.util.List;
import java.util.Locale;
import java.util.Set;

public class BooleanField extends FieldBase {

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no", "off");

    public BooleanField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "Checkbox";
    }

    @Override
    protected List<String> defaultOperators() {
        return List.of("equals", "notEquals", "isNull", "isNotNull");
    }

    @Override
    protected Object normalize(Object raw) {
        if (raw instanceof Number n) {
            return n.intValue() != 0;
        }
        if (raw instanceof String s) {
            var lower = s.trim().toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(lower)) {
                return true;
            }
            if (FALSE_VALUES.contains(lower)) {
                return false;
            }
        }
        return raw;
    }
}
