package com.ewas.alerting.exception;

import java.util.List;

/**
 * Invalid detector configuration. Fatal at construction time and never retried.
 */
public class DetectorConfigurationException extends RuntimeException {

    private final List<String> violations;

    public DetectorConfigurationException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public DetectorConfigurationException(String detectorName, List<String> violations) {
        super(String.format("Invalid configuration for detector '%s': %s", detectorName, String.join("; ", violations)));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
