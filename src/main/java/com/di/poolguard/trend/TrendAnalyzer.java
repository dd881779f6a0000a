package com.di.poolguard.trend;

import com.di.poolguard.metrics.PoolMetrics;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Compares the average of the older half of a history window with the newer half.
 *
 * <p>The window is split by index at {@code size / 2}. A relative change above
 * {@link #RELATIVE_CHANGE_THRESHOLD} is a trend in that direction; anything smaller is stable.
 * Errors are compared as per-sample increments of the cumulative counter, so a counter that
 * keeps growing at a steady pace reads as stable rather than increasing.
 */
public class TrendAnalyzer {

    /** 5% relative change between the two halves. */
    public static final double RELATIVE_CHANGE_THRESHOLD = 0.05;

    public TrendReport analyze(List<PoolMetrics> history) {
        if (history == null || history.size() < 2) {
            return TrendReport.STABLE;
        }
        double[] errorDeltas = errorDeltas(history);
        return new TrendReport(
                trend(history, PoolMetrics::utilization),
                trend(errorDeltas),
                trend(history, PoolMetrics::avgConnectionTimeMs));
    }

    static Trend compare(double older, double newer) {
        if (older == 0.0) {
            return newer > 0.0 ? Trend.INCREASING : Trend.STABLE;
        }
        double change = (newer - older) / older;
        if (change > RELATIVE_CHANGE_THRESHOLD) {
            return Trend.INCREASING;
        }
        if (change < -RELATIVE_CHANGE_THRESHOLD) {
            return Trend.DECREASING;
        }
        return Trend.STABLE;
    }

    private static Trend trend(List<PoolMetrics> history, ToDoubleFunction<PoolMetrics> field) {
        double[] values = history.stream().mapToDouble(field).toArray();
        return trend(values);
    }

    private static Trend trend(double[] values) {
        if (values.length < 2) {
            return Trend.STABLE;
        }
        int mid = values.length / 2;
        return compare(average(values, 0, mid), average(values, mid, values.length));
    }

    // one increment per consecutive pair; the oldest sample has no predecessor in the window
    static double[] errorDeltas(List<PoolMetrics> history) {
        double[] deltas = new double[history.size() - 1];
        for (int i = 1; i < history.size(); i++) {
            long delta = history.get(i).cumulativeErrors() - history.get(i - 1).cumulativeErrors();
            deltas[i - 1] = Math.max(0, delta);
        }
        return deltas;
    }

    private static double average(double[] values, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }
}
