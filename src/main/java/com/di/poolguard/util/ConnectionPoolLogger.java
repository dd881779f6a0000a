package com.di.poolguard.util;

import com.di.poolguard.config.ConnectionPoolConfig;
import com.di.poolguard.retry.RetryExecutor;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Startup and diagnostic log blocks for the guarded pool.
 * <p>Use at:
 * <ul>
 *   <li>Startup - {@link #logStartupSummary(ConnectionPoolConfig, String)} once the manager is built</li>
 *   <li>Pool creation and probes - {@link #logPoolStats(DataSource, String)}</li>
 * </ul>
 */
@Slf4j
public final class ConnectionPoolLogger {

    /** Separator line to segregate pool logs from the rest of the log output. */
    public static final String CONNECTION_LOG_SEPARATOR =
            "================================================================================";

    private ConnectionPoolLogger() {}

    public static void logDatasourceSectionStart(String title) {
        log.info(CONNECTION_LOG_SEPARATOR);
        log.info("[POOL] DATASOURCE / CONNECTION POOL  |  {}", title != null ? title : "");
        log.info(CONNECTION_LOG_SEPARATOR);
    }

    public static void logDatasourceSectionEnd() {
        log.info(CONNECTION_LOG_SEPARATOR);
    }

    /**
     * Logs pool statistics if the DataSource is a HikariCP pool that has been started.
     *
     * @param phase when this is being logged, e.g. "startup" or "probe"
     */
    public static void logPoolStats(DataSource dataSource, String phase) {
        if (dataSource == null) {
            return;
        }
        if (!(dataSource instanceof com.zaxxer.hikari.HikariDataSource hikari)) {
            log.debug("Pool stats not available (not HikariCP): phase={}", phase);
            return;
        }
        HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
        if (pool == null) {
            log.info("[POOL] {} | pool={} | maxSize={}, minIdle={} | not started yet",
                    phase, hikari.getPoolName(), hikari.getMaximumPoolSize(), hikari.getMinimumIdle());
            return;
        }
        log.info("[POOL] {} | pool={} | maxSize={}, minIdle={} | active={}, idle={}, total={}, waiting={}",
                phase, hikari.getPoolName(), hikari.getMaximumPoolSize(), hikari.getMinimumIdle(),
                pool.getActiveConnections(), pool.getIdleConnections(), pool.getTotalConnections(),
                pool.getThreadsAwaitingConnection());
    }

    /**
     * Logs the effective policy and where active connection counts come from.
     */
    public static void logStartupSummary(ConnectionPoolConfig config, String telemetrySource) {
        logDatasourceSectionStart("startup summary");
        log.info("[POOL] Pool | maxConnections={} | idleTimeout={} | connectionTimeout={} | telemetry={}",
                config.getMaxConnections(), config.getIdleTimeout(), config.getConnectionTimeout(), telemetrySource);
        log.info("[RETRY] Policy | maxRetries={} | baseDelay={} | worstCaseBackoff={}",
                config.getMaxRetries(), config.getRetryBaseDelay(), worstCaseBackoff(config));
        log.info("[BREAKER] Policy | enabled={} | threshold={} | cooldown={}",
                config.isCircuitBreakerEnabled(), config.getCircuitBreakerThreshold(),
                config.getCircuitBreakerCooldown());
        logDatasourceSectionEnd();
    }

    /** Masks passwords embedded in JDBC URLs. */
    public static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }

    // sum of all backoffs of one exhausted call: base * (2^maxRetries - 1)
    static Duration worstCaseBackoff(ConnectionPoolConfig config) {
        Duration total = Duration.ZERO;
        for (int i = 0; i < config.getMaxRetries(); i++) {
            total = total.plus(RetryExecutor.backoffDelay(config.getRetryBaseDelay(), i));
        }
        return total;
    }
}
