package com.di.poolguard.config;

import com.di.poolguard.health.HealthThresholds;
import com.di.poolguard.manager.ConnectionPoolManager;
import com.di.poolguard.metrics.ConnectionTelemetry;
import com.di.poolguard.metrics.PoolMetricsRecorder;
import com.di.poolguard.util.ConnectionPoolLogger;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link ConnectionPoolManager} from {@link PoolGuardProperties}. Telemetry and
 * config listeners are picked up when {@link DataSourceConfiguration} contributes them.
 */
@Slf4j
@Configuration
public class PoolGuardConfiguration {

    @Bean
    public PoolMetricsRecorder poolMetricsRecorder(MeterRegistry meterRegistry) {
        return new PoolMetricsRecorder(meterRegistry);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ConnectionPoolManager connectionPoolManager(PoolGuardProperties properties,
                                                       PoolMetricsRecorder recorder,
                                                       ObjectProvider<ConnectionTelemetry> telemetry,
                                                       ObjectProvider<ConnectionPoolConfigListener> listeners) {
        ConnectionPoolConfig config = properties.toConnectionPoolConfig();
        PoolGuardProperties.Health health = properties.getHealth();

        ConnectionPoolManager manager = ConnectionPoolManager.builder()
                .config(config)
                .samplingInterval(properties.getSamplingInterval())
                .historyCapacity(properties.getHistoryCapacity())
                .statisticsWindow(properties.getStatisticsWindow())
                .errorRateWindow(properties.getErrorRateWindow())
                .healthThresholds(new HealthThresholds(
                        health.getWarningUtilization(), health.getCriticalUtilization(), health.getErrorRate()))
                .telemetry(telemetry.getIfAvailable())
                .recorder(recorder)
                .build();
        listeners.orderedStream().forEach(manager::addConfigListener);

        log.info("[CONFIG] Resolved pool config | profile={} | datasourceConfigured={}",
                properties.getProfile() == null || properties.getProfile().isBlank() ? "default" : properties.getProfile(),
                properties.getDatasource().isConfigured());
        ConnectionPoolLogger.logStartupSummary(config, manager.getTelemetrySource());
        return manager;
    }
}
