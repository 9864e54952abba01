package com.modelcraft.relationships;

import java.util.List;
import java.util.Map;

/**
 * One page of a model's active relationship rows.
 *
 * @param page       1-based page number
 * @param total      active rows across all pages
 * @param totalPages {@code ceil(total / perPage)}
 */
public record RelatedPage(
    List<Map<String, Object>> records,
    int page,
    int perPage,
    long total,
    long totalPages,
    boolean hasMore
) {
    public RelatedPage {
        records = List.copyOf(records);
    }

    static RelatedPage of(List<Map<String, Object>> records, int page, int perPage, long total) {
        var totalPages = (total + perPage - 1) / perPage;
        var hasMore = (long) page * perPage < total;
        return new RelatedPage(records, page, perPage, total, totalPages, hasMore);
    }
}
