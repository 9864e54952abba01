package com.modelcraft.exception;

import java.util.Map;

/**
 * Entity or relationship metadata failed structural validation.
 */
public class SchemaException extends ModelcraftException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Map<String, ?> context) {
        super(message, context);
    }

    public SchemaException(String message, Map<String, ?> context, Throwable cause) {
        super(message, context, cause);
    }
}
