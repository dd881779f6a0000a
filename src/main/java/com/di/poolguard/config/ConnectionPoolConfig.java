package com.di.poolguard.config;

import com.di.poolguard.exception.PoolConfigException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable policy settings for one {@link com.di.poolguard.manager.ConnectionPoolManager}.
 *
 * <p>Start from {@link #defaults()} or {@link #forProfile(String)} and apply overrides
 * through {@link #toBuilder()}. Every instance is validated once in its constructor;
 * out-of-range values are rejected with {@link PoolConfigException}, never clamped.
 *
 * <p>{@code maxConnections} is the denominator for utilization in this layer; physical
 * pool size is enforced by the query executor. {@code idleTimeout} and
 * {@code connectionTimeout} are passed through to the executor and not enforced here.
 */
@Value
public class ConnectionPoolConfig {

    public static final int DEFAULT_MAX_CONNECTIONS = 10;
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_BASE_DELAY = Duration.ofSeconds(1);
    public static final int DEFAULT_BREAKER_THRESHOLD = 5;
    public static final Duration DEFAULT_BREAKER_COOLDOWN = Duration.ofMinutes(1);

    int maxConnections;
    Duration idleTimeout;
    Duration connectionTimeout;
    int maxRetries;
    Duration retryBaseDelay;
    boolean circuitBreakerEnabled;
    int circuitBreakerThreshold;
    Duration circuitBreakerCooldown;
    boolean monitoringEnabled;

    @Builder(toBuilder = true)
    private ConnectionPoolConfig(int maxConnections,
                                 Duration idleTimeout,
                                 Duration connectionTimeout,
                                 int maxRetries,
                                 Duration retryBaseDelay,
                                 boolean circuitBreakerEnabled,
                                 int circuitBreakerThreshold,
                                 Duration circuitBreakerCooldown,
                                 boolean monitoringEnabled) {
        requirePositive("maxConnections", maxConnections);
        requireNonNegative("idleTimeout", idleTimeout);
        requireNonNegative("connectionTimeout", connectionTimeout);
        if (maxRetries < 0) {
            throw new PoolConfigException("maxRetries must be >= 0, got " + maxRetries);
        }
        requireNonNegative("retryBaseDelay", retryBaseDelay);
        requirePositive("circuitBreakerThreshold", circuitBreakerThreshold);
        requireNonNegative("circuitBreakerCooldown", circuitBreakerCooldown);
        if (circuitBreakerCooldown.isZero()) {
            throw new PoolConfigException("circuitBreakerCooldown must be > 0");
        }

        this.maxConnections = maxConnections;
        this.idleTimeout = idleTimeout;
        this.connectionTimeout = connectionTimeout;
        this.maxRetries = maxRetries;
        this.retryBaseDelay = retryBaseDelay;
        this.circuitBreakerEnabled = circuitBreakerEnabled;
        this.circuitBreakerThreshold = circuitBreakerThreshold;
        this.circuitBreakerCooldown = circuitBreakerCooldown;
        this.monitoringEnabled = monitoringEnabled;
    }

    /** Settings used when neither a profile nor overrides are given. */
    public static ConnectionPoolConfig defaults() {
        return ConnectionPoolConfig.builder()
                .maxConnections(DEFAULT_MAX_CONNECTIONS)
                .idleTimeout(DEFAULT_IDLE_TIMEOUT)
                .connectionTimeout(DEFAULT_CONNECTION_TIMEOUT)
                .maxRetries(DEFAULT_MAX_RETRIES)
                .retryBaseDelay(DEFAULT_RETRY_BASE_DELAY)
                .circuitBreakerEnabled(true)
                .circuitBreakerThreshold(DEFAULT_BREAKER_THRESHOLD)
                .circuitBreakerCooldown(DEFAULT_BREAKER_COOLDOWN)
                .monitoringEnabled(true)
                .build();
    }

    /**
     * Preset for a named profile ({@code development} or {@code production}).
     *
     * @throws PoolConfigException for an unknown name
     */
    public static ConnectionPoolConfig forProfile(String profileName) {
        return ConnectionPoolProfile.fromName(profileName).config();
    }

    private static void requirePositive(String field, int value) {
        if (value <= 0) {
            throw new PoolConfigException(field + " must be > 0, got " + value);
        }
    }

    private static void requireNonNegative(String field, Duration value) {
        if (value == null) {
            throw new PoolConfigException(field + " must be set");
        }
        if (value.isNegative()) {
            throw new PoolConfigException(field + " must not be negative, got " + value);
        }
    }
}
