package com.di.poolguard.executor;

import java.util.List;
import java.util.Map;

/**
 * The database access the layer guards. Any exception thrown is treated as a failed attempt.
 */
public interface QueryExecutor {

    /** Rows as column-label to value maps, in result order. */
    List<Map<String, Object>> query(String sql, Object... args);

    /** Number of affected rows. */
    int update(String sql, Object... args);
}
