package com.di.poolguard.manager;

import com.di.poolguard.breaker.CircuitBreakerSnapshot;
import com.di.poolguard.breaker.CircuitBreakerState;
import com.di.poolguard.config.ConnectionPoolConfig;
import com.di.poolguard.exception.CircuitOpenException;
import com.di.poolguard.exception.OperationAbortedException;
import com.di.poolguard.exception.OperationFailedException;
import com.di.poolguard.exception.PoolConfigException;
import com.di.poolguard.health.HealthEvaluator;
import com.di.poolguard.health.HealthLevel;
import com.di.poolguard.health.HealthStatus;
import com.di.poolguard.health.PerformanceReport;
import com.di.poolguard.metrics.PoolMetricsRecorder;
import com.di.poolguard.support.MutableClock;
import com.di.poolguard.support.RecordingSleeper;
import com.di.poolguard.trend.Trend;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConnectionPoolManager Tests")
class ConnectionPoolManagerTest {

    private final MutableClock clock = new MutableClock();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final AtomicInteger active = new AtomicInteger();
    private ConnectionPoolManager manager;

    private ConnectionPoolManager manager(ConnectionPoolConfig config) {
        manager = ConnectionPoolManager.builder()
                .config(config)
                .telemetry(active::get)
                .recorder(new PoolMetricsRecorder(registry))
                .clock(clock)
                .sleeper(new RecordingSleeper(clock))
                .build();
        return manager;
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.stop();
        }
    }

    private static Object refusedConnection() throws Exception {
        throw new java.sql.SQLException("connection refused", "08001");
    }

    // ============================================================================
    // Lifecycle
    // ============================================================================

    @Test
    @DisplayName("Start and stop are idempotent; restart after stop is refused")
    void testLifecycle() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults());

        manager.start();
        manager.start();
        assertTrue(manager.isRunning());
        assertTrue(manager.isMonitoring());

        manager.stop();
        manager.stop();
        assertFalse(manager.isRunning());
        assertFalse(manager.isMonitoring());
        assertThrows(IllegalStateException.class, manager::start);
        assertThrows(OperationAbortedException.class, () -> manager.execute("q", () -> 1));
    }

    @Test
    @DisplayName("Builder defaults to the default config")
    void testBuilderDefaults() {
        manager = ConnectionPoolManager.builder().build();

        assertEquals(ConnectionPoolConfig.defaults(), manager.getConfig());
        assertEquals("in-flight", manager.getTelemetrySource());
    }

    // ============================================================================
    // Health & statistics
    // ============================================================================

    @Test
    @DisplayName("Health reflects current utilization without appending to history")
    void testHealthUsesFreshSnapshot() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults().toBuilder().maxConnections(100).build());
        active.set(97);

        HealthStatus health = manager.health();

        assertEquals(HealthLevel.CRITICAL, health.status());
        assertTrue(health.recommendations().contains(HealthEvaluator.REC_INCREASE_CAPACITY));
        assertEquals(97, health.metrics().activeConnections());
        assertTrue(manager.statistics().historical().isEmpty());
    }

    @Test
    @DisplayName("Open breaker makes health critical")
    void testHealthWithOpenBreaker() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults().toBuilder()
                .maxRetries(0).circuitBreakerThreshold(1).build());

        assertThrows(OperationFailedException.class, () -> manager.execute("q", ConnectionPoolManagerTest::refusedConnection));

        HealthStatus health = manager.health();
        assertEquals(HealthLevel.CRITICAL, health.status());
        assertEquals(CircuitBreakerState.OPEN, health.circuitBreakerState());
        assertEquals(1.0, health.errorRate(), 1e-9);
    }

    @Test
    @DisplayName("Statistics expose recent samples with trends")
    void testStatistics() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults());
        for (int i = 0; i < 4; i++) {
            active.set(i < 2 ? 1 : 8);
            manager.sampleNow();
        }

        PoolStatistics stats = manager.statistics();

        assertEquals(4, stats.historical().size());
        assertEquals(Trend.INCREASING, stats.trends().utilization());
        assertEquals(8, stats.current().activeConnections());
        assertNotNull(stats.telemetrySource());
    }

    @Test
    @DisplayName("Statistics are limited to the configured window")
    void testStatisticsWindow() {
        manager = ConnectionPoolManager.builder()
                .statisticsWindow(3)
                .historyCapacity(10)
                .clock(clock)
                .build();
        for (int i = 0; i < 8; i++) {
            manager.sampleNow();
        }
        assertEquals(3, manager.statistics().historical().size());
    }

    @Test
    @DisplayName("Performance combines health and optimization advice")
    void testPerformance() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults());
        active.set(1);

        PerformanceReport report = manager.performance();

        assertEquals(HealthLevel.HEALTHY, report.health().status());
        assertFalse(report.recommendations().isEmpty());
    }

    // ============================================================================
    // Administration
    // ============================================================================

    @Test
    @DisplayName("Profile switch replaces config, keeps history and notifies listeners")
    void testConfigureProfile() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults());
        manager.sampleNow();
        List<ConnectionPoolConfig> seen = new ArrayList<>();
        manager.addConfigListener((previous, current) -> seen.add(current));

        ConnectionPoolConfig applied = manager.configureProfile("production");

        assertEquals(20, applied.getMaxConnections());
        assertSame(applied, manager.getConfig());
        assertEquals(List.of(applied), seen);
        assertEquals(1, manager.statistics().historical().size());
        assertEquals(20, manager.health().metrics().totalConnections());
    }

    @Test
    @DisplayName("Unknown profile is rejected and the config is unchanged")
    void testConfigureUnknownProfile() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults());

        assertThrows(PoolConfigException.class, () -> manager.configureProfile("staging"));
        assertEquals(ConnectionPoolConfig.defaults(), manager.getConfig());
    }

    @Test
    @DisplayName("Explicit config replaces the active one and null is rejected")
    void testConfigureExplicit() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults());
        ConnectionPoolConfig custom = ConnectionPoolConfig.defaults().toBuilder().maxConnections(7).build();

        assertSame(custom, manager.configure(custom));
        assertEquals(7, manager.health().metrics().totalConnections());
        assertThrows(IllegalArgumentException.class, () -> manager.configure(null));
        assertSame(custom, manager.getConfig());
    }

    @Test
    @DisplayName("New threshold applies to the existing breaker state")
    void testProfileSwitchKeepsBreakerState() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults().toBuilder().maxRetries(0).build());
        for (int i = 0; i < 3; i++) {
            assertThrows(OperationFailedException.class, () -> manager.execute("q", ConnectionPoolManagerTest::refusedConnection));
        }
        assertEquals(CircuitBreakerState.CLOSED, manager.circuitBreaker().state());

        manager.configureProfile("development");
        assertEquals(3, manager.circuitBreaker().consecutiveFailures());

        assertThrows(OperationFailedException.class, () -> manager.execute("q", ConnectionPoolManagerTest::refusedConnection));
        assertEquals(CircuitBreakerState.OPEN, manager.circuitBreaker().state());
    }

    @Test
    @DisplayName("Reset reopens the gate after the breaker tripped")
    void testResetCircuitBreaker() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults().toBuilder()
                .maxRetries(0).circuitBreakerThreshold(1).build());
        assertThrows(OperationFailedException.class, () -> manager.execute("q", ConnectionPoolManagerTest::refusedConnection));
        assertThrows(CircuitOpenException.class, () -> manager.execute("q", () -> 1));

        CircuitBreakerSnapshot snapshot = manager.resetCircuitBreaker();

        assertEquals(CircuitBreakerState.CLOSED, snapshot.state());
        assertEquals(0, snapshot.consecutiveFailures());
        int result = manager.execute("q", () -> 1);
        assertEquals(1, result);
    }

    @Test
    @DisplayName("Disabling an open breaker closes it and health stops reporting it")
    void testDisableOpenBreaker() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults().toBuilder()
                .maxRetries(0).circuitBreakerThreshold(1).build());
        assertThrows(OperationFailedException.class, () -> manager.execute("q", ConnectionPoolManagerTest::refusedConnection));
        assertEquals(CircuitBreakerState.OPEN, manager.circuitBreaker().state());

        manager.configure(manager.getConfig().toBuilder().circuitBreakerEnabled(false).build());
        for (int i = 0; i < 50; i++) {
            manager.execute("q", () -> 1);
        }

        CircuitBreakerSnapshot snapshot = manager.circuitBreaker();
        assertEquals(CircuitBreakerState.CLOSED, snapshot.state());
        assertFalse(snapshot.enabled());
        HealthStatus health = manager.health();
        assertEquals(HealthLevel.HEALTHY, health.status());
        assertEquals(CircuitBreakerState.CLOSED, health.circuitBreakerState());
        assertFalse(health.recommendations().contains(HealthEvaluator.REC_CHECK_CONNECTIVITY));
    }

    @Test
    @DisplayName("Config swaps switch background sampling on and off")
    void testMonitoringToggle() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults());
        manager.start();

        manager.configure(manager.getConfig().toBuilder().monitoringEnabled(false).build());
        assertFalse(manager.isMonitoring());

        manager.configure(manager.getConfig().toBuilder().monitoringEnabled(true).build());
        assertTrue(manager.isMonitoring());
    }

    @Test
    @DisplayName("Concurrent config swaps leave sampling consistent with the final config")
    void testConcurrentSwapsKeepMonitoringConsistent() throws Exception {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults());
        manager.start();
        ConnectionPoolConfig on = ConnectionPoolConfig.defaults();
        ConnectionPoolConfig off = on.toBuilder().monitoringEnabled(false).build();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            boolean enable = t % 2 == 0;
            futures.add(pool.submit(() -> {
                go.await();
                for (int i = 0; i < 25; i++) {
                    manager.configure(enable ? on : off);
                }
                return null;
            }));
        }
        go.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(manager.getConfig().isMonitoringEnabled(), manager.isMonitoring());
    }

    @Test
    @DisplayName("Retries back off exponentially through the manager")
    void testRetriesThroughManager() {
        RecordingSleeper sleeper = new RecordingSleeper();
        manager = ConnectionPoolManager.builder()
                .config(ConnectionPoolConfig.defaults().toBuilder().maxRetries(2)
                        .retryBaseDelay(Duration.ofMillis(100)).build())
                .sleeper(sleeper)
                .build();
        AtomicInteger calls = new AtomicInteger();

        String result = manager.execute("select", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("transient");
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeper.getSleeps());
        assertEquals(CircuitBreakerState.CLOSED, manager.circuitBreaker().state());
    }

    @Test
    @DisplayName("Gauges follow the latest sample and breaker counter")
    void testGauges() {
        ConnectionPoolManager manager = manager(ConnectionPoolConfig.defaults().toBuilder().maxRetries(0).build());
        active.set(5);
        manager.sampleNow();
        assertThrows(OperationFailedException.class, () -> manager.execute("q", ConnectionPoolManagerTest::refusedConnection));

        assertEquals(0.5, registry.get(PoolMetricsRecorder.POOL_UTILIZATION).gauge().value(), 1e-9);
        assertEquals(5.0, registry.get(PoolMetricsRecorder.POOL_ACTIVE).gauge().value(), 1e-9);
        assertEquals(1.0, registry.get(PoolMetricsRecorder.BREAKER_CONSECUTIVE_FAILURES).gauge().value(), 1e-9);
    }
}
