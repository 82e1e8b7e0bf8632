package com.ewas.alerting.publish;

/**
 * Result of publishing to one system. {@code error} is null on success.
 */
public record SystemOutcome(String system, String externalId, String status, String error) {

    public static SystemOutcome published(String system, String externalId, String status) {
        return new SystemOutcome(system, externalId, status, null);
    }

    public static SystemOutcome failed(String system, String error) {
        return new SystemOutcome(system, null, "failed", error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
