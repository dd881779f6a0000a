package com.di.poolguard.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsHistory Tests")
class MetricsHistoryTest {

    private static PoolMetrics sample(int active) {
        return PoolMetrics.of(Instant.EPOCH.plusSeconds(active), active, 10, 0, 0.0);
    }

    @Test
    @DisplayName("Evicts the oldest sample when full")
    void testFifoEviction() {
        MetricsHistory history = new MetricsHistory(3);
        for (int i = 1; i <= 5; i++) {
            history.append(sample(i));
        }

        List<PoolMetrics> snapshot = history.snapshot();
        assertEquals(3, snapshot.size());
        assertEquals(3, snapshot.get(0).activeConnections());
        assertEquals(5, snapshot.get(2).activeConnections());
        assertEquals(5, history.latest().orElseThrow().activeConnections());
    }

    @Test
    @DisplayName("Recent returns the newest samples, oldest first")
    void testRecent() {
        MetricsHistory history = new MetricsHistory();
        for (int i = 1; i <= 6; i++) {
            history.append(sample(i));
        }

        List<PoolMetrics> recent = history.recent(2);
        assertEquals(List.of(5, 6), recent.stream().map(PoolMetrics::activeConnections).toList());
        assertEquals(6, history.recent(50).size());
        assertTrue(history.recent(0).isEmpty());
    }

    @Test
    @DisplayName("Snapshots are read-only copies")
    void testSnapshotIsCopy() {
        MetricsHistory history = new MetricsHistory(5);
        history.append(sample(1));
        List<PoolMetrics> snapshot = history.snapshot();

        history.append(sample(2));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(sample(3)));
    }

    @Test
    @DisplayName("Rejects a non-positive capacity")
    void testCapacityValidation() {
        assertThrows(IllegalArgumentException.class, () -> new MetricsHistory(0));
    }

    @Test
    @DisplayName("Samples keep active + idle == total and clamp active")
    void testPoolMetricsInvariant() {
        for (int active = -2; active <= 12; active++) {
            PoolMetrics m = PoolMetrics.of(Instant.EPOCH, active, 10, 0, 0.0);
            assertEquals(m.totalConnections(), m.activeConnections() + m.idleConnections());
            assertEquals((double) m.activeConnections() / m.totalConnections(), m.utilization(), 1e-9);
            assertTrue(m.utilization() >= 0.0 && m.utilization() <= 1.0);
        }
    }
}
