package com.di.poolguard.exception;

/**
 * Base type for every failure surfaced by the connection access layer.
 *
 * <p>Subclasses let callers tell "the database is erroring" apart from
 * "load is being shed on purpose" without inspecting messages.
 */
public abstract class PoolAccessException extends RuntimeException {

    protected PoolAccessException(String message) {
        super(message);
    }

    protected PoolAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
