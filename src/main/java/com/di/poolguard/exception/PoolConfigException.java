package com.di.poolguard.exception;

/**
 * Thrown when a {@link com.di.poolguard.config.ConnectionPoolConfig} is built with
 * out-of-range values or an unknown profile name is requested.
 *
 * <p>Raised at construction time only; a config that was built successfully is never
 * re-validated on the call path.
 */
public class PoolConfigException extends PoolAccessException {

    public PoolConfigException(String message) {
        super(message);
    }
}
