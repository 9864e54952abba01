package com.modelcraft.exception;

import java.util.Map;

/**
 * A {@code restrict} cascade policy blocked a deletion because dependent rows exist.
 */
public class ConstraintException extends ModelcraftException {

    public ConstraintException(String message, Map<String, ?> context) {
        super(message, context);
    }
}
