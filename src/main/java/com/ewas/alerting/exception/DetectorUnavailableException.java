package com.ewas.alerting.exception;

/**
 * Detector is unknown or inactive. Terminal, no retry.
 */
public class DetectorUnavailableException extends RuntimeException {

    public DetectorUnavailableException(String message) {
        super(message);
    }
}
