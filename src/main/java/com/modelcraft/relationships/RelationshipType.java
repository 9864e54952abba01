package com.modelcraft.relationships;

import com.modelcraft.exception.SchemaException;

import java.util.Arrays;
import java.util.Map;

public enum RelationshipType {
    ONE_TO_ONE("OneToOne"),
    ONE_TO_MANY("OneToMany"),
    MANY_TO_MANY("ManyToMany");

    private final String value;

    RelationshipType(String value) {
        this.value = value;
    }

    /** The name used in schema files. */
    public String value() {
        return value;
    }

    /**
     * @throws SchemaException naming the value when it is not one of the three types
     */
    public static RelationshipType fromValue(String value) {
        return Arrays.stream(values())
            .filter(t -> t.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new SchemaException("Unknown relationship type: " + value,
                Map.of("type", String.valueOf(value))));
    }
}
