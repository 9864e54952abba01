package com.modelcraft.exception;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup against the warm metadata cache for a name it does not hold.
 */
public class NotFoundException extends ModelcraftException {

    private final String requestedName;
    private final List<String> availableNames;

    public NotFoundException(String kind, String requestedName, List<String> availableNames) {
        super("%s metadata not found for '%s'".formatted(kind, requestedName),
            context(kind, requestedName, availableNames));
        this.requestedName = requestedName;
        this.availableNames = List.copyOf(availableNames);
    }

    private static Map<String, Object> context(String kind, String requestedName, List<String> availableNames) {
        var context = new LinkedHashMap<String, Object>();
        context.put("kind", kind);
        context.put("requested", requestedName);
        context.put("available", List.copyOf(availableNames));
        return context;
    }

    public String getRequestedName() {
        return requestedName;
    }

    public List<String> getAvailableNames() {
        return availableNames;
    }
}
