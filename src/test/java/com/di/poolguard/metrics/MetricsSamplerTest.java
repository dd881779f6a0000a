package com.di.poolguard.metrics;

import com.di.poolguard.config.ConnectionPoolConfig;
import com.di.poolguard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsSampler Tests")
class MetricsSamplerTest {

    private final AtomicInteger active = new AtomicInteger();
    private final MutableClock clock = new MutableClock();
    private MetricsSampler sampler;

    private MetricsSampler sampler(int maxConnections, int historyCapacity, int errorRateWindow) {
        ConnectionPoolConfig config = ConnectionPoolConfig.defaults().toBuilder().maxConnections(maxConnections).build();
        sampler = new MetricsSampler(() -> config, new ReentrantLock(), clock, active::get,
                historyCapacity, errorRateWindow);
        return sampler;
    }

    @AfterEach
    void tearDown() {
        if (sampler != null) {
            sampler.stop();
        }
    }

    @Test
    @DisplayName("Sample reads telemetry and appends to history")
    void testSampleAppends() {
        MetricsSampler sampler = sampler(10, 100, 20);
        active.set(4);

        PoolMetrics m = sampler.sample();

        assertEquals(4, m.activeConnections());
        assertEquals(6, m.idleConnections());
        assertEquals(0.4, m.utilization(), 1e-9);
        assertEquals(clock.instant(), m.timestamp());
        assertEquals(1, sampler.history().size());
    }

    @Test
    @DisplayName("Current does not touch the history")
    void testCurrentDoesNotAppend() {
        MetricsSampler sampler = sampler(10, 100, 20);

        sampler.current();

        assertTrue(sampler.history().isEmpty());
        assertTrue(sampler.latest().isEmpty());
    }

    @Test
    @DisplayName("History is bounded by its capacity")
    void testHistoryBounded() {
        MetricsSampler sampler = sampler(10, 5, 20);
        for (int i = 0; i < 12; i++) {
            sampler.sample();
        }
        assertEquals(5, sampler.history().size());
    }

    @Test
    @DisplayName("Outcomes drive average latency and cumulative errors")
    void testRecordOutcome() {
        MetricsSampler sampler = sampler(10, 100, 20);

        sampler.recordOutcome(100.0, true);
        sampler.recordOutcome(300.0, false);
        sampler.recordOutcome(200.0, false);

        PoolMetrics m = sampler.current();
        assertEquals(200.0, m.avgConnectionTimeMs(), 1e-9);
        assertEquals(2, m.cumulativeErrors());
        assertEquals(2, sampler.getCumulativeErrors());
    }

    @Test
    @DisplayName("Error rate covers only the most recent window")
    void testRecentErrorRate() {
        MetricsSampler sampler = sampler(10, 100, 4);
        assertEquals(0.0, sampler.recentErrorRate());

        sampler.recordOutcome(1.0, false);
        sampler.recordOutcome(1.0, false);
        assertEquals(1.0, sampler.recentErrorRate(), 1e-9);

        for (int i = 0; i < 3; i++) {
            sampler.recordOutcome(1.0, true);
        }
        assertEquals(0.25, sampler.recentErrorRate(), 1e-9);
        assertEquals(2, sampler.getCumulativeErrors());
    }

    @Test
    @DisplayName("Latency average rolls over the last 100 attempts")
    void testLatencyWindow() {
        MetricsSampler sampler = sampler(10, 100, 20);
        for (int i = 0; i < MetricsSampler.LATENCY_WINDOW; i++) {
            sampler.recordOutcome(1000.0, true);
        }
        for (int i = 0; i < MetricsSampler.LATENCY_WINDOW; i++) {
            sampler.recordOutcome(10.0, true);
        }
        assertEquals(10.0, sampler.current().avgConnectionTimeMs(), 1e-9);
    }

    @Test
    @DisplayName("Timer samples in the background and stops cleanly")
    void testTimerLifecycle() throws InterruptedException {
        MetricsSampler sampler = sampler(10, 100, 20);

        sampler.start(Duration.ofMillis(20));
        assertTrue(sampler.isRunning());
        long deadline = System.currentTimeMillis() + 5_000;
        while (sampler.history().size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        sampler.stop();
        sampler.stop();

        assertFalse(sampler.isRunning());
        assertTrue(sampler.history().size() >= 2);
        int size = sampler.history().size();
        Thread.sleep(100);
        assertEquals(size, sampler.history().size());
    }

    @Test
    @DisplayName("Rejects a non-positive sampling interval")
    void testInvalidInterval() {
        MetricsSampler sampler = sampler(10, 100, 20);
        assertThrows(IllegalArgumentException.class, () -> sampler.start(Duration.ZERO));
        assertFalse(sampler.isRunning());
    }
}
