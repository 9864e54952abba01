package com.modelcraft.metadata;

import com.modelcraft.exception.SchemaException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Searchable / sortable / default-sort / pagination settings of an entity.
 * Empty lists mean "derive from the fields" (see {@link EntityMetadata}).
 */
public record ListingConfig(
    List<String> searchableFields,
    List<String> sortableFields,
    List<SortOrder> defaultSort,
    int defaultPageSize,
    int maxPageSize
) {
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 1000;

    public static final ListingConfig DEFAULTS =
        new ListingConfig(List.of(), List.of(), List.of(), DEFAULT_PAGE_SIZE, MAX_PAGE_SIZE);

    public ListingConfig {
        searchableFields = searchableFields != null ? List.copyOf(searchableFields) : List.of();
        sortableFields = sortableFields != null ? List.copyOf(sortableFields) : List.of();
        defaultSort = defaultSort != null ? List.copyOf(defaultSort) : List.of();
        defaultPageSize = defaultPageSize > 0 ? defaultPageSize : DEFAULT_PAGE_SIZE;
        maxPageSize = maxPageSize > 0 ? maxPageSize : MAX_PAGE_SIZE;
        if (defaultPageSize > maxPageSize) {
            throw new SchemaException("defaultPageSize %d exceeds maxPageSize %d".formatted(defaultPageSize, maxPageSize));
        }
    }

    public record SortOrder(String field, String direction) {
        public SortOrder {
            direction = "desc".equalsIgnoreCase(direction) ? "desc" : "asc";
        }
    }

    static ListingConfig fromMap(String entity, Map<String, ?> raw) {
        if (raw.isEmpty()) {
            return DEFAULTS;
        }
        var sorts = new ArrayList<SortOrder>();
        var sortValue = raw.get("defaultSort");
        if (sortValue instanceof List<?> list) {
            for (var entry : list) {
                if (entry instanceof Map<?, ?> sort && sort.get("field") != null) {
                    var direction = sort.get("direction");
                    sorts.add(new SortOrder(String.valueOf(sort.get("field")),
                        direction == null ? null : String.valueOf(direction)));
                } else {
                    throw new SchemaException("Entity '%s': defaultSort entries need a 'field'".formatted(entity),
                        Map.of("entity", entity));
                }
            }
        }
        Map<?, ?> pagination = raw.get("pagination") instanceof Map<?, ?> p ? p : Map.of();
        return new ListingConfig(
            names(raw.get("searchableFields")),
            names(raw.get("sortableFields")),
            sorts,
            intValue(pagination.get("defaultPageSize")),
            intValue(pagination.get("maxPageSize")));
    }

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("searchableFields", searchableFields);
        map.put("sortableFields", sortableFields);
        map.put("defaultSort", defaultSort.stream()
            .map(s -> Map.of("field", s.field(), "direction", s.direction()))
            .toList());
        map.put("pagination", Map.of("defaultPageSize", defaultPageSize, "maxPageSize", maxPageSize));
        return map;
    }

    private static List<String> names(Object value) {
        return value instanceof List<?> list ? list.stream().map(String::valueOf).toList() : List.of();
    }

    private static int intValue(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }
}
