package com.di.poolguard.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;

/**
 * {@link QueryExecutor} over Spring's {@link JdbcTemplate}. Exceptions surface as Spring
 * {@code DataAccessException}s with the driver's {@code SQLException} as cause.
 */
@Slf4j
public class JdbcQueryExecutor implements QueryExecutor {

    private final JdbcTemplate jdbcTemplate;

    public JdbcQueryExecutor(DataSource dataSource) {
        this(new JdbcTemplate(dataSource));
    }

    public JdbcQueryExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Map<String, Object>> query(String sql, Object... args) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, args);
        log.debug("[POOL] Query returned {} rows", rows.size());
        return rows;
    }

    @Override
    public int update(String sql, Object... args) {
        return jdbcTemplate.update(sql, args);
    }
}
