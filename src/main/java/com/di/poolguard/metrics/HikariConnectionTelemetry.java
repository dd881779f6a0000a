package com.di.poolguard.metrics;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;

/**
 * Reads the real active-connection count from a HikariCP pool.
 * Reports 0 until the pool has been started (the MX bean is created lazily by Hikari).
 */
public class HikariConnectionTelemetry implements ConnectionTelemetry {

    private final HikariDataSource dataSource;

    public HikariConnectionTelemetry(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public int activeConnections() {
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        if (pool == null) {
            return 0;
        }
        return pool.getActiveConnections();
    }

    @Override
    public String source() {
        return "hikari";
    }
}
