package com.di.poolguard.executor;

import com.di.poolguard.config.ConnectionPoolConfig;
import com.di.poolguard.config.ConnectionPoolConfigListener;
import com.di.poolguard.config.PoolGuardProperties;
import com.di.poolguard.util.ConnectionPoolLogger;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariConfigMXBean;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the HikariCP pool behind {@link JdbcQueryExecutor} from the active
 * {@link ConnectionPoolConfig} and keeps it in step when the config changes.
 *
 * <p>Mapping: {@code maxConnections} to maximumPoolSize, {@code idleTimeout} and
 * {@code connectionTimeout} one to one, minimumIdle = min(2, maxConnections).
 */
@Slf4j
public final class PooledDataSourceFactory {

    static final int MIN_IDLE = 2;

    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    private PooledDataSourceFactory() {}

    public static HikariDataSource create(PoolGuardProperties.Datasource datasource, ConnectionPoolConfig config) {
        HikariConfig hikariConfig = toHikariConfig(datasource, config);
        HikariDataSource dataSource = new HikariDataSource(hikariConfig);
        log.info("[POOL] Creating | url={} | pool={} | maxPoolSize={}, minIdle={} | idleTimeout={} | connectionTimeout={}",
                ConnectionPoolLogger.sanitizeUrl(datasource.getJdbcUrl()), hikariConfig.getPoolName(),
                hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle(),
                config.getIdleTimeout(), config.getConnectionTimeout());
        return dataSource;
    }

    static HikariConfig toHikariConfig(PoolGuardProperties.Datasource datasource, ConnectionPoolConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(datasource.getJdbcUrl());
        hikariConfig.setUsername(datasource.getUsername());
        hikariConfig.setPassword(datasource.getPassword());
        if (datasource.getDriverClassName() != null && !datasource.getDriverClassName().isBlank()) {
            hikariConfig.setDriverClassName(datasource.getDriverClassName());
        }
        hikariConfig.setMaximumPoolSize(config.getMaxConnections());
        hikariConfig.setMinimumIdle(minimumIdle(config));
        hikariConfig.setIdleTimeout(config.getIdleTimeout().toMillis());
        hikariConfig.setConnectionTimeout(config.getConnectionTimeout().toMillis());
        // start even when the database is down; failures then go through the breaker
        hikariConfig.setInitializationFailTimeout(-1);

        if (datasource.getJdbcUrl() != null && datasource.getJdbcUrl().contains("postgresql")) {
            hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
        }
        hikariConfig.setPoolName("poolguard-" + poolIdCounter.incrementAndGet() + "-"
                + shortPoolKey(datasource.getJdbcUrl(), datasource.getUsername()));
        return hikariConfig;
    }

    /**
     * Pushes pool size and timeouts of a new config to a running pool.
     */
    public static void applyConfig(HikariDataSource dataSource, ConnectionPoolConfig config) {
        HikariConfigMXBean bean = dataSource.getHikariConfigMXBean();
        int previousMax = bean.getMaximumPoolSize();
        // lower the floor first so minIdle never exceeds the new maximum
        bean.setMinimumIdle(Math.min(bean.getMinimumIdle(), config.getMaxConnections()));
        bean.setMaximumPoolSize(config.getMaxConnections());
        bean.setMinimumIdle(minimumIdle(config));
        bean.setIdleTimeout(config.getIdleTimeout().toMillis());
        bean.setConnectionTimeout(config.getConnectionTimeout().toMillis());
        log.info("[POOL] Resize | pool={} | maximumPoolSize: {} -> {} | minIdle={}",
                bean.getPoolName(), previousMax, config.getMaxConnections(), bean.getMinimumIdle());
    }

    public static ConnectionPoolConfigListener configListener(HikariDataSource dataSource) {
        return (previous, current) -> applyConfig(dataSource, current);
    }

    static int minimumIdle(ConnectionPoolConfig config) {
        return Math.min(MIN_IDLE, config.getMaxConnections());
    }

    /** Host, database and user from the JDBC URL, reduced to {@code [a-zA-Z0-9_]}. */
    static String shortPoolKey(String url, String username) {
        String user = username != null ? username : "unknown";
        if (url == null || url.isBlank()) {
            return user.replaceAll("[^a-zA-Z0-9_]", "_");
        }
        String part = ConnectionPoolLogger.sanitizeUrl(url);
        int slashSlash = part.indexOf("//");
        if (slashSlash >= 0) {
            part = part.substring(slashSlash + 2);
        } else {
            // e.g. jdbc:h2:mem:name
            int lastColon = part.lastIndexOf(':');
            part = lastColon >= 0 ? part.substring(lastColon + 1) : part;
        }
        int slashDb = part.indexOf('/');
        String hostPort = slashDb >= 0 ? part.substring(0, slashDb) : part;
        String db = slashDb >= 0 && slashDb < part.length() - 1 ? part.substring(slashDb + 1).split("[?;]")[0] : "";
        String host = hostPort.split("[:;]")[0];
        String safe = (host + "_" + db + "_" + user).replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        return safe.isEmpty() ? "pool" : safe;
    }
}
