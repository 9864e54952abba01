package com.modelcraft.metadata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed views of parsed JSON values.
 */
public final class SchemaMaps {

    private SchemaMaps() {
    }

    /** Copy of a JSON object with every key as a string, entry order kept. */
    public static Map<String, Object> stringKeyed(Map<?, ?> raw) {
        var copy = new LinkedHashMap<String, Object>();
        raw.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    /** Elements of a JSON array as strings; anything that is not an array yields an empty list. */
    public static List<String> strings(Object raw) {
        return raw instanceof List<?> list
            ? list.stream().filter(Objects::nonNull).map(String::valueOf).toList()
            : List.of();
    }
}
