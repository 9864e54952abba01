package com.modelcraft.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the framework's unchecked exceptions.
 * Carries a context map describing what was being processed when it failed.
 */
public class ModelcraftException extends RuntimeException {

    private final Map<String, Object> context;

    public ModelcraftException(String message) {
        this(message, Map.of(), null);
    }

    public ModelcraftException(String message, Throwable cause) {
        this(message, Map.of(), cause);
    }

    public ModelcraftException(String message, Map<String, ?> context) {
        this(message, context, null);
    }

    public ModelcraftException(String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        // values may be null, so no Map.copyOf
        this.context = context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
