package com.ewas.alerting.task;

import com.ewas.alerting.exception.DetectorConfigurationException;
import com.ewas.alerting.exception.DetectorUnavailableException;
import com.ewas.alerting.exception.RetryExhaustedException;
import com.ewas.alerting.exception.TransientTaskException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retry handler with exponential backoff.
 *
 * Attempt count and backoff durations are tracked as data in a {@link RetryOutcome};
 * the supervised operation itself knows nothing about retries.
 */
@Component
@Slf4j
public class RetryHandler {

    private final BackoffSleeper sleeper;

    public RetryHandler() {
        this(BackoffSleeper.THREAD_SLEEP);
    }

    public RetryHandler(BackoffSleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Run the operation until it succeeds, fails with a non-retryable error, or the budget is spent.
     */
    public <T> RetryOutcome<T> supervise(Supplier<T> operation, String operationName, RetryPolicy policy) {
        RetryOutcome.RetryOutcomeBuilder<T> outcome = RetryOutcome.<T>builder().operationName(operationName);
        int maxAttempts = policy.maxAttempts();
        int attempt = 0;
        Exception lastException = null;

        while (attempt < maxAttempts) {
            try {
                T value = operation.get();
                return outcome.success(true).value(value).attempts(attempt + 1).build();
            } catch (Exception e) {
                lastException = e;
                attempt++;

                if (!isRetryable(e)) {
                    log.error("[RETRY] Operation '{}' failed with non-retryable error on attempt {}: {}",
                        operationName, attempt, e.getMessage());
                    return outcome.success(false).lastFailure(e).attempts(attempt).terminal(true).build();
                }

                if (attempt >= maxAttempts) {
                    log.error("[RETRY] Operation '{}' failed after {} attempts", operationName, maxAttempts);
                    break;
                }

                Duration delay = policy.backoffFor(attempt - 1);
                outcome.backoff(delay);
                log.warn("[RETRY] Operation '{}' failed (attempt {}/{}). Retrying in {}ms. Error: {}",
                    operationName, attempt, maxAttempts, delay.toMillis(), e.getMessage());

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return outcome.success(false)
                        .lastFailure(new TransientTaskException("Retry interrupted", ie))
                        .attempts(attempt)
                        .terminal(true)
                        .build();
                }
            }
        }

        return outcome.success(false).lastFailure(lastException).attempts(attempt).build();
    }

    /**
     * Execute operation with retry logic, throwing once the budget is exhausted.
     */
    public <T> T executeWithRetry(Supplier<T> operation, String operationName, RetryPolicy policy) {
        RetryOutcome<T> outcome = supervise(operation, operationName, policy);
        if (outcome.isSuccess()) {
            return outcome.getValue();
        }
        if (outcome.isTerminal() && outcome.getLastFailure() instanceof RuntimeException runtime) {
            throw runtime;
        }
        throw new RetryExhaustedException(operationName, outcome.getAttempts(), outcome.getLastFailure());
    }

    /**
     * Check if exception is retryable.
     */
    public boolean isRetryable(Throwable e) {
        if (e instanceof DetectorConfigurationException
            || e instanceof DetectorUnavailableException
            || e instanceof IllegalArgumentException
            || e instanceof IllegalStateException) {
            return false;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TransientTaskException
                || t instanceof java.io.IOException
                || t instanceof ResourceAccessException
                || t instanceof HttpServerErrorException
                || t instanceof DataAccessResourceFailureException
                || t instanceof TransientDataAccessException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }

        String message = e.getMessage();
        if (message != null) {
            String lower = message.toLowerCase();
            return lower.contains("timeout")
                || lower.contains("timed out")
                || lower.contains("connection refused")
                || lower.contains("temporarily unavailable");
        }
        return false;
    }
}
