package com.di.poolguard.retry;

/**
 * A single query-executing unit of work. Any thrown exception counts as a failed attempt.
 */
@FunctionalInterface
public interface PoolOperation<T> {

    T execute() throws Exception;
}
