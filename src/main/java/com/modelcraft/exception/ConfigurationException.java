package com.modelcraft.exception;

import java.util.Map;

/**
 * A required external source (core field template, schema directory) is
 * missing or malformed.
 */
public class ConfigurationException extends ModelcraftException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Map<String, ?> context) {
        super(message, context);
    }

    public ConfigurationException(String message, Map<String, ?> context, Throwable cause) {
        super(message, context, cause);
    }
}
