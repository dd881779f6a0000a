package com.di.poolguard.health;

import com.di.poolguard.breaker.CircuitBreakerState;
import com.di.poolguard.metrics.PoolMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives a {@link HealthStatus} from the latest sample, the recent error rate and the
 * breaker state. Pure: no state is kept between calls.
 *
 * <p>Rules (defaults in {@link HealthThresholds#DEFAULTS}):
 * <ul>
 *   <li>utilization &gt; critical: critical</li>
 *   <li>warning &lt; utilization &lt;= critical: warning</li>
 *   <li>error rate &gt; threshold: warning, or critical when utilization is also above the warning line</li>
 *   <li>breaker open: critical regardless of the rest</li>
 * </ul>
 * The most severe finding wins the status and message; recommendations of every matched
 * rule are concatenated without duplicates.
 */
@Slf4j
public class HealthEvaluator {

    public static final String REC_INCREASE_CAPACITY = "Immediately increase max connections";
    public static final String REC_RESULT_CACHING = "Implement query result caching";
    public static final String REC_AUDIT_SLOW_QUERIES = "Review and optimize slow queries";
    public static final String REC_CAPACITY_REVIEW =
            "Review pool capacity: consider increasing max connections or optimizing query patterns";
    public static final String REC_CHECK_DATABASE = "Check database server health";
    public static final String REC_CONNECTION_TIMEOUT = "Increase connection timeout values";
    public static final String REC_RETRY_POLICY = "Review retry count and backoff delay for the current error pattern";
    public static final String REC_CHECK_CONNECTIVITY = "Check database connectivity";
    public static final String REC_REVIEW_DEPLOYMENTS = "Review recent deployment changes";
    public static final String REC_BREAKER_COOLDOWN = "Consider increasing the circuit breaker cooldown";

    static final String MSG_HEALTHY = "Connection pool is healthy";
    static final String MSG_HIGH_UTILIZATION = "High connection pool utilization detected";
    static final String MSG_CRITICAL_UTILIZATION = "Critical connection pool utilization";
    static final String MSG_HIGH_ERROR_RATE = "High connection error rate detected";
    static final String MSG_ERRORS_UNDER_LOAD = "High error rate under heavy pool utilization";
    static final String MSG_BREAKER_OPEN = "Circuit breaker is open - connection pool is failing";

    private final HealthThresholds thresholds;

    public HealthEvaluator() {
        this(HealthThresholds.DEFAULTS);
    }

    public HealthEvaluator(HealthThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public HealthStatus evaluate(PoolMetrics metrics, double errorRate, CircuitBreakerState breakerState) {
        List<Finding> findings = new ArrayList<>();
        Set<String> recommendations = new LinkedHashSet<>();
        double utilization = metrics.utilization();

        if (utilization > thresholds.criticalUtilization()) {
            findings.add(new Finding(HealthLevel.CRITICAL, 2, MSG_CRITICAL_UTILIZATION));
            recommendations.add(REC_INCREASE_CAPACITY);
            recommendations.add(REC_RESULT_CACHING);
            recommendations.add(REC_AUDIT_SLOW_QUERIES);
        } else if (utilization > thresholds.warningUtilization()) {
            findings.add(new Finding(HealthLevel.WARNING, 1, MSG_HIGH_UTILIZATION));
            recommendations.add(REC_CAPACITY_REVIEW);
        }

        if (errorRate > thresholds.errorRate()) {
            if (utilization > thresholds.warningUtilization()) {
                findings.add(new Finding(HealthLevel.CRITICAL, 3, MSG_ERRORS_UNDER_LOAD));
            } else {
                findings.add(new Finding(HealthLevel.WARNING, 2, MSG_HIGH_ERROR_RATE));
            }
            recommendations.add(REC_CHECK_DATABASE);
            recommendations.add(REC_CONNECTION_TIMEOUT);
            recommendations.add(REC_RETRY_POLICY);
        }

        if (breakerState == CircuitBreakerState.OPEN) {
            findings.add(new Finding(HealthLevel.CRITICAL, 4, MSG_BREAKER_OPEN));
            recommendations.add(REC_CHECK_CONNECTIVITY);
            recommendations.add(REC_REVIEW_DEPLOYMENTS);
            recommendations.add(REC_BREAKER_COOLDOWN);
        }

        Finding worst = findings.stream()
                .max(Comparator.comparing(Finding::level).thenComparingInt(Finding::priority))
                .orElse(new Finding(HealthLevel.HEALTHY, 0, MSG_HEALTHY));

        if (worst.level() != HealthLevel.HEALTHY) {
            log.debug("[HEALTH] status={} | utilization={} | errorRate={} | breaker={}",
                    worst.level().getLabel(), utilization, errorRate, breakerState);
        }
        return new HealthStatus(worst.level(), worst.message(), metrics,
                new ArrayList<>(recommendations), breakerState, errorRate);
    }

    private record Finding(HealthLevel level, int priority, String message) {}
}
