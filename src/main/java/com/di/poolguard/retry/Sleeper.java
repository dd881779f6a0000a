package com.di.poolguard.retry;

import java.time.Duration;

/**
 * Blocking wait between retry attempts. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration delay) throws InterruptedException;
}
