package com.ewas.alerting.task;

import java.time.Duration;

/**
 * Waits out a backoff delay between attempts.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration delay) throws InterruptedException;

    BackoffSleeper THREAD_SLEEP = delay -> {
        if (!delay.isZero() && !delay.isNegative()) {
            Thread.sleep(delay.toMillis());
        }
    };
}
