package com.di.poolguard.config;

import com.di.poolguard.executor.JdbcQueryExecutor;
import com.di.poolguard.executor.PooledDataSourceFactory;
import com.di.poolguard.executor.QueryExecutor;
import com.di.poolguard.metrics.ConnectionTelemetry;
import com.di.poolguard.metrics.HikariConnectionTelemetry;
import com.di.poolguard.util.ConnectionPoolLogger;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * JDBC side of the layer, active only when {@code poolguard.datasource.jdbc-url} is set.
 * Without it the manager runs with in-flight telemetry and no probe.
 */
@Configuration
@ConditionalOnProperty(prefix = "poolguard.datasource", name = "jdbc-url")
public class DataSourceConfiguration {

    @Bean(destroyMethod = "close")
    public HikariDataSource poolGuardDataSource(PoolGuardProperties properties) {
        ConnectionPoolLogger.logDatasourceSectionStart("poolguard datasource");
        HikariDataSource dataSource = PooledDataSourceFactory.create(
                properties.getDatasource(), properties.toConnectionPoolConfig());
        ConnectionPoolLogger.logPoolStats(dataSource, "startup");
        ConnectionPoolLogger.logDatasourceSectionEnd();
        return dataSource;
    }

    @Bean
    public QueryExecutor queryExecutor(HikariDataSource poolGuardDataSource) {
        return new JdbcQueryExecutor(poolGuardDataSource);
    }

    @Bean
    public ConnectionTelemetry hikariConnectionTelemetry(HikariDataSource poolGuardDataSource) {
        return new HikariConnectionTelemetry(poolGuardDataSource);
    }

    /** Keeps the Hikari pool size in step with profile changes. */
    @Bean
    public ConnectionPoolConfigListener hikariResizeListener(HikariDataSource poolGuardDataSource) {
        return PooledDataSourceFactory.configListener(poolGuardDataSource);
    }
}
