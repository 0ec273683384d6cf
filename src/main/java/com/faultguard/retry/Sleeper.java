package com.faultguard.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking suspension used by {@link RetryExecutor#run}. Replaced in tests to avoid real sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = delay -> TimeUnit.NANOSECONDS.sleep(delay.toNanos());

    void sleep(Duration delay) throws InterruptedException;
}
