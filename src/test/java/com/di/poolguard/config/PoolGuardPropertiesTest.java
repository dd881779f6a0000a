package com.di.poolguard.config;

import com.di.poolguard.exception.PoolConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PoolGuardProperties Tests")
class PoolGuardPropertiesTest {

    @Test
    @DisplayName("Blank profile resolves to defaults")
    void testBlankProfileUsesDefaults() {
        PoolGuardProperties properties = new PoolGuardProperties();
        properties.setProfile("");

        assertEquals(ConnectionPoolConfig.defaults(), properties.toConnectionPoolConfig());
    }

    @Test
    @DisplayName("Overrides are applied on top of the selected profile")
    void testOverridesOnProfile() {
        PoolGuardProperties properties = new PoolGuardProperties();
        properties.setProfile("production");
        properties.getOverrides().setMaxConnections(30);
        properties.getOverrides().setRetryBaseDelay(Duration.ofMillis(500));

        ConnectionPoolConfig config = properties.toConnectionPoolConfig();

        assertEquals(30, config.getMaxConnections());
        assertEquals(Duration.ofMillis(500), config.getRetryBaseDelay());
        assertEquals(5, config.getMaxRetries());
        assertEquals(Duration.ofMinutes(5), config.getCircuitBreakerCooldown());
    }

    @Test
    @DisplayName("Invalid override fails resolution")
    void testInvalidOverride() {
        PoolGuardProperties properties = new PoolGuardProperties();
        properties.getOverrides().setMaxRetries(-2);

        assertThrows(PoolConfigException.class, properties::toConnectionPoolConfig);
    }

    @Test
    @DisplayName("Datasource is configured only with a JDBC URL")
    void testDatasourceConfigured() {
        PoolGuardProperties.Datasource datasource = new PoolGuardProperties.Datasource();
        assertFalse(datasource.isConfigured());
        datasource.setJdbcUrl("  ");
        assertFalse(datasource.isConfigured());
        datasource.setJdbcUrl("jdbc:h2:mem:test");
        assertTrue(datasource.isConfigured());
        assertEquals("SELECT 1", datasource.getValidationQuery());
    }
}
