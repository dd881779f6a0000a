package com.di.poolguard.trend;

/**
 * Direction of utilization, error count and average connection time across a history window.
 */
public record TrendReport(Trend utilization, Trend errors, Trend performance) {

    public static final TrendReport STABLE = new TrendReport(Trend.STABLE, Trend.STABLE, Trend.STABLE);
}
