package com.di.poolguard.health;

/**
 * Cut-offs used by {@link HealthEvaluator}.
 *
 * @param warningUtilization  utilization above this is at least a warning
 * @param criticalUtilization utilization above this is critical
 * @param errorRate           recent error rate above this is at least a warning
 */
public record HealthThresholds(double warningUtilization, double criticalUtilization, double errorRate) {

    public static final HealthThresholds DEFAULTS = new HealthThresholds(0.8, 0.95, 0.05);

    public HealthThresholds {
        if (warningUtilization < 0 || criticalUtilization > 1 || warningUtilization > criticalUtilization) {
            throw new IllegalArgumentException("utilization thresholds must satisfy 0 <= warning <= critical <= 1, got "
                    + warningUtilization + " / " + criticalUtilization);
        }
        if (errorRate < 0 || errorRate > 1) {
            throw new IllegalArgumentException("errorRate threshold must be within [0, 1], got " + errorRate);
        }
    }
}
