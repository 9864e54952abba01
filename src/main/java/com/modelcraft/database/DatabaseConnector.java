package com.modelcraft.database;

import com.modelcraft.model.ModelBase;

import java.util.List;
import java.util.Map;

/**
 * Persistence boundary. Models and relationships hand themselves to the connector; it owns
 * SQL, connections and transactions.
 *
 * <p>In every {@code criteria} map a {@code null} value means "column IS NULL" and
 * {@link #NOT_NULL} means "column IS NOT NULL".
 */
public interface DatabaseConnector {

    String NOT_NULL = "__NOT_NULL__";

    /**
     * Rows of the model's table matching {@code criteria}.
     *
     * @param fields     columns to return, empty for all
     * @param parameters paging / ordering hints ({@code limit}, {@code offset}, {@code orderBy})
     */
    List<Map<String, Object>> find(ModelBase model, Map<String, Object> criteria,
                                   List<String> fields, Map<String, Object> parameters);

    boolean create(ModelBase model);

    boolean update(ModelBase model);

    boolean softDelete(ModelBase model);

    boolean hardDelete(ModelBase model);

    boolean recordExists(String table, Map<String, Object> criteria);

    /** As {@link #recordExists}, ignoring the row whose {@code id} equals {@code excludedId}. */
    boolean recordExistsExcludingId(String table, Map<String, Object> criteria, Object excludedId);

    long count(ModelBase model, Map<String, Object> criteria);

    /**
     * Stamp {@code deleted_at}/{@code deleted_by} on every active row whose {@code field} equals
     * {@code value}.
     *
     * @return number of rows affected
     */
    int bulkSoftDeleteByFieldValue(ModelBase model, String field, Object value, String userId);

    /** Clear the soft-delete markers of every row matching {@code criteria}. */
    int bulkRestoreByCriteria(ModelBase model, Map<String, Object> criteria);
}
