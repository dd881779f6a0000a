package com.di.poolguard.config;

import com.di.poolguard.exception.PoolConfigException;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Named presets. {@code development} keeps concurrency low with a tight breaker for fast
 * local feedback; {@code production} allows more concurrency, longer timeouts and a longer
 * cooldown.
 */
public enum ConnectionPoolProfile {

    DEVELOPMENT("development") {
        @Override
        public ConnectionPoolConfig config() {
            return ConnectionPoolConfig.defaults().toBuilder()
                    .maxConnections(5)
                    .idleTimeout(Duration.ofSeconds(30))
                    .connectionTimeout(Duration.ofSeconds(10))
                    .maxRetries(3)
                    .retryBaseDelay(Duration.ofSeconds(1))
                    .circuitBreakerEnabled(true)
                    .circuitBreakerThreshold(3)
                    .circuitBreakerCooldown(Duration.ofSeconds(30))
                    .build();
        }
    },

    PRODUCTION("production") {
        @Override
        public ConnectionPoolConfig config() {
            return ConnectionPoolConfig.defaults().toBuilder()
                    .maxConnections(20)
                    .idleTimeout(Duration.ofMinutes(1))
                    .connectionTimeout(Duration.ofSeconds(15))
                    .maxRetries(5)
                    .retryBaseDelay(Duration.ofSeconds(2))
                    .circuitBreakerEnabled(true)
                    .circuitBreakerThreshold(5)
                    .circuitBreakerCooldown(Duration.ofMinutes(5))
                    .build();
        }
    };

    private final String profileName;

    ConnectionPoolProfile(String profileName) {
        this.profileName = profileName;
    }

    public String getProfileName() {
        return profileName;
    }

    /** Fresh config for this preset. */
    public abstract ConnectionPoolConfig config();

    /**
     * Case-insensitive lookup.
     *
     * @throws PoolConfigException when the name matches no profile
     */
    public static ConnectionPoolProfile fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new PoolConfigException("Profile name must not be empty");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ConnectionPoolProfile profile : values()) {
            if (profile.profileName.equals(normalized)) {
                return profile;
            }
        }
        String known = Arrays.stream(values())
                .map(ConnectionPoolProfile::getProfileName)
                .collect(Collectors.joining(", "));
        throw new PoolConfigException("Unknown profile '" + name + "'; expected one of: " + known);
    }
}
