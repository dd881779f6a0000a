package com.di.poolguard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Single binding for all pool guard settings.
 *
 * <pre>
 * poolguard:
 *   profile: production          # development | production | blank = defaults
 *   overrides:
 *     max-connections: 30
 *     retry-base-delay: 500ms
 *   sampling-interval: 5s
 *   history-capacity: 100
 *   statistics-window: 50
 *   error-rate-window: 20
 *   health:
 *     warning-utilization: 0.8
 *     critical-utilization: 0.95
 *     error-rate: 0.05
 *   datasource:
 *     jdbc-url: jdbc:postgresql://localhost:5432/app
 *     username: app
 *     password: secret
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "poolguard")
public class PoolGuardProperties {

    /** Preset to start from. Blank = {@link ConnectionPoolConfig#defaults()}. */
    private String profile;

    /** Per-field overrides merged over the preset. Null fields keep the preset value. */
    @Valid
    private Overrides overrides = new Overrides();

    /** Period of the background metrics sampler. */
    @NotNull
    private Duration samplingInterval = Duration.ofSeconds(5);

    /** Number of samples kept in memory; oldest evicted first. */
    @Min(2)
    private int historyCapacity = 100;

    /** Number of most recent samples returned by the statistics endpoint and used for trends. */
    @Min(2)
    private int statisticsWindow = 50;

    /** Number of most recent attempt outcomes the error rate is computed over. */
    @Min(1)
    private int errorRateWindow = 20;

    @Valid
    private Health health = new Health();

    @Valid
    private Datasource datasource = new Datasource();

    /**
     * Resolves the effective config: profile preset (or defaults) with overrides applied.
     * Validation happens in {@link ConnectionPoolConfig}, so a bad value fails startup.
     */
    public ConnectionPoolConfig toConnectionPoolConfig() {
        ConnectionPoolConfig base = (profile == null || profile.isBlank())
                ? ConnectionPoolConfig.defaults()
                : ConnectionPoolConfig.forProfile(profile);
        return overrides.applyTo(base);
    }

    @Data
    public static class Overrides {
        private Integer maxConnections;
        private Duration idleTimeout;
        private Duration connectionTimeout;
        private Integer maxRetries;
        private Duration retryBaseDelay;
        private Boolean circuitBreakerEnabled;
        private Integer circuitBreakerThreshold;
        private Duration circuitBreakerCooldown;
        private Boolean monitoringEnabled;

        ConnectionPoolConfig applyTo(ConnectionPoolConfig base) {
            ConnectionPoolConfig.ConnectionPoolConfigBuilder b = base.toBuilder();
            if (maxConnections != null) b.maxConnections(maxConnections);
            if (idleTimeout != null) b.idleTimeout(idleTimeout);
            if (connectionTimeout != null) b.connectionTimeout(connectionTimeout);
            if (maxRetries != null) b.maxRetries(maxRetries);
            if (retryBaseDelay != null) b.retryBaseDelay(retryBaseDelay);
            if (circuitBreakerEnabled != null) b.circuitBreakerEnabled(circuitBreakerEnabled);
            if (circuitBreakerThreshold != null) b.circuitBreakerThreshold(circuitBreakerThreshold);
            if (circuitBreakerCooldown != null) b.circuitBreakerCooldown(circuitBreakerCooldown);
            if (monitoringEnabled != null) b.monitoringEnabled(monitoringEnabled);
            return b.build();
        }
    }

    @Data
    public static class Health {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double warningUtilization = 0.8;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double criticalUtilization = 0.95;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double errorRate = 0.05;
    }

    @Data
    public static class Datasource {
        /** Blank = no JDBC executor; active connections are then estimated from in-flight operations. */
        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName;
        /** Query run by the probe endpoint. */
        private String validationQuery = "SELECT 1";

        public boolean isConfigured() {
            return jdbcUrl != null && !jdbcUrl.isBlank();
        }
    }
}
