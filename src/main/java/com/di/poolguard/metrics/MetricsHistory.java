package com.di.poolguard.metrics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity FIFO of {@link PoolMetrics}; appending to a full buffer evicts the oldest sample.
 *
 * <p>Not thread-safe: the owning {@link MetricsSampler} guards it with the manager lock.
 * Readers only ever get copies.
 */
public class MetricsHistory {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<PoolMetrics> samples;

    public MetricsHistory() {
        this(DEFAULT_CAPACITY);
    }

    public MetricsHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
    }

    public void append(PoolMetrics sample) {
        if (sample == null) return;
        if (samples.size() == capacity) {
            samples.removeFirst();
        }
        samples.addLast(sample);
    }

    /** All retained samples, oldest first. */
    public List<PoolMetrics> snapshot() {
        return List.copyOf(samples);
    }

    /** The most recent {@code limit} samples, oldest first. */
    public List<PoolMetrics> recent(int limit) {
        if (limit <= 0) return List.of();
        int skip = Math.max(0, samples.size() - limit);
        List<PoolMetrics> out = new ArrayList<>(Math.min(limit, samples.size()));
        int i = 0;
        for (PoolMetrics m : samples) {
            if (i++ >= skip) out.add(m);
        }
        return List.copyOf(out);
    }

    public Optional<PoolMetrics> latest() {
        return Optional.ofNullable(samples.peekLast());
    }

    public int size() {
        return samples.size();
    }

    public int capacity() {
        return capacity;
    }
}
