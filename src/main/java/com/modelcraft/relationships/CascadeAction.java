package com.modelcraft.relationships;

import com.modelcraft.exception.SchemaException;

import java.util.Arrays;
import java.util.Map;

/**
 * What happens to relationship rows when one of the related records is deleted.
 */
public enum CascadeAction {
    /** Refuse the deletion while active rows exist. */
    RESTRICT("restrict"),
    /** Soft-delete the relationship rows; the related records are left alone. */
    CASCADE("cascade"),
    SOFT_DELETE("softDelete");

    private final String value;

    CascadeAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @throws SchemaException naming the value when it is not a known action
     */
    public static CascadeAction fromValue(String value) {
        return Arrays.stream(values())
            .filter(a -> a.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new SchemaException("Unknown cascade action: " + value,
                Map.of("cascadeAction", String.valueOf(value))));
    }
}
