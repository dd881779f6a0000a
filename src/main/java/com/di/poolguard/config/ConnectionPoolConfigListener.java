package com.di.poolguard.config;

/**
 * Notified after the manager swapped its active {@link ConnectionPoolConfig},
 * e.g. to push the new pool size down to the physical pool.
 */
@FunctionalInterface
public interface ConnectionPoolConfigListener {

    void onConfigChanged(ConnectionPoolConfig previous, ConnectionPoolConfig current);
}
