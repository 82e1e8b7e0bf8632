package com.ewas.alerting.exception;

/**
 * Raised once a retryable operation has used its whole attempt budget.
 */
public class RetryExhaustedException extends RuntimeException {

    private final String operationName;
    private final int attempts;

    public RetryExhaustedException(String operationName, int attempts, Throwable lastFailure) {
        super(String.format("Operation '%s' failed after %d attempts: %s",
            operationName, attempts, lastFailure == null ? "no attempt made" : lastFailure.getMessage()), lastFailure);
        this.operationName = operationName;
        this.attempts = attempts;
    }

    public String getOperationName() {
        return operationName;
    }

    public int getAttempts() {
        return attempts;
    }
}
