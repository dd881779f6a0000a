package com.di.poolguard.controller;

import com.di.poolguard.breaker.CircuitBreakerSnapshot;
import com.di.poolguard.config.ConnectionPoolConfig;
import com.di.poolguard.config.PoolGuardProperties;
import com.di.poolguard.exception.ErrorResponse;
import com.di.poolguard.executor.QueryExecutor;
import com.di.poolguard.health.HealthStatus;
import com.di.poolguard.health.PerformanceReport;
import com.di.poolguard.manager.ConnectionPoolManager;
import com.di.poolguard.manager.PoolStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API over the connection pool manager.
 * <ul>
 *   <li>GET /api/pool/health - health status with recommendations</li>
 *   <li>GET /api/pool/stats - current snapshot, recent history and trends</li>
 *   <li>GET /api/pool/performance - health plus optimization advice</li>
 *   <li>GET /api/pool/config - active config</li>
 *   <li>POST /api/pool/admin/reset-breaker - force the breaker closed</li>
 *   <li>POST /api/pool/admin/profile/{name} - switch to a named profile</li>
 *   <li>POST /api/pool/probe - run the validation query through breaker and retries</li>
 * </ul>
 * Failures are mapped by {@code GlobalExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api/pool")
public class PoolController {

    static final String PROBE_OPERATION = "probe";

    private final ConnectionPoolManager manager;
    private final PoolGuardProperties properties;
    private final Optional<QueryExecutor> queryExecutor;

    public PoolController(ConnectionPoolManager manager, PoolGuardProperties properties,
                          Optional<QueryExecutor> queryExecutor) {
        this.manager = manager;
        this.properties = properties;
        this.queryExecutor = queryExecutor;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        return ResponseEntity.ok(manager.health());
    }

    @GetMapping("/stats")
    public ResponseEntity<PoolStatistics> stats() {
        return ResponseEntity.ok(manager.statistics());
    }

    @GetMapping("/performance")
    public ResponseEntity<PerformanceReport> performance() {
        return ResponseEntity.ok(manager.performance());
    }

    @GetMapping("/config")
    public ResponseEntity<ConnectionPoolConfig> config() {
        return ResponseEntity.ok(manager.getConfig());
    }

    @PostMapping("/admin/reset-breaker")
    public ResponseEntity<CircuitBreakerSnapshot> resetBreaker() {
        log.info("[BREAKER] Reset requested via API");
        return ResponseEntity.ok(manager.resetCircuitBreaker());
    }

    @PostMapping("/admin/profile/{name}")
    public ResponseEntity<ConnectionPoolConfig> switchProfile(@PathVariable("name") String name) {
        log.info("[CONFIG] Profile switch requested via API | profile={}", name);
        return ResponseEntity.ok(manager.configureProfile(name));
    }

    /**
     * 404 when no data source is configured; 503 when the breaker is open; 502 when every attempt failed.
     */
    @PostMapping("/probe")
    public ResponseEntity<?> probe() {
        if (queryExecutor.isEmpty()) {
            ErrorResponse body = new ErrorResponse();
            body.setTimestamp(Instant.now().toString());
            body.setStatus(HttpStatus.NOT_FOUND.value());
            body.setError(HttpStatus.NOT_FOUND.getReasonPhrase());
            body.setMessage("No data source configured; set poolguard.datasource.jdbc-url to enable the probe");
            body.setPath("/api/pool/probe");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
        QueryExecutor executor = queryExecutor.get();
        String sql = properties.getDatasource().getValidationQuery();
        long start = System.nanoTime();
        List<Map<String, Object>> rows = manager.execute(PROBE_OPERATION, () -> executor.query(sql));
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        return ResponseEntity.ok(new ProbeResult(sql, rows.size(), durationMs, manager.circuitBreaker().state()));
    }
}
