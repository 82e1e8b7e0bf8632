package com.ewas.alerting.task;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Retry budget of one kind of task: delay before retry n (0-based) is base * 2^n, capped at maxDelay.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    private int maxRetries;
    private Duration baseDelay = Duration.ofSeconds(60);
    private Duration maxDelay = Duration.ofHours(1);

    public RetryPolicy(int maxRetries, Duration baseDelay) {
        this(maxRetries, baseDelay, Duration.ofHours(1));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO);
    }

    /**
     * First attempt plus retries; never negative.
     */
    public int maxAttempts() {
        return Math.max(0, maxRetries) + 1;
    }

    public Duration backoffFor(int retryIndex) {
        if (baseDelay == null || baseDelay.isZero() || baseDelay.isNegative()) {
            return Duration.ZERO;
        }
        long factor = 1L << Math.min(Math.max(retryIndex, 0), 30);
        long millis;
        try {
            millis = Math.multiplyExact(baseDelay.toMillis(), factor);
        } catch (ArithmeticException overflow) {
            millis = Long.MAX_VALUE;
        }
        Duration delay = Duration.ofMillis(millis);
        return maxDelay != null && delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
