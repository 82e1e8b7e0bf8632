package com.ewas.alerting.exception;

/**
 * Failure expected to clear on retry (store or external API unavailable).
 */
public class TransientTaskException extends RuntimeException {

    public TransientTaskException(String message) {
        super(message);
    }

    public TransientTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
