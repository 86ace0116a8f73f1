package com.questrail.arena.ingest.resolve;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage adapter for the persistent cache and card catalog.
 *
 * <p>Statements are parameterized with {@code ?} placeholders bound
 * positionally. Rows are returned as column-name to value maps. No storage
 * engine is assumed beyond this contract; implementations may throw
 * unchecked exceptions for storage failures.</p>
 */
public interface QueryAdapter
{
    Optional<Map<String, Object>> queryOne(String sql, Object... params);

    List<Map<String, Object>> queryAll(String sql, Object... params);

    void execute(String sql, Object... params);
}
