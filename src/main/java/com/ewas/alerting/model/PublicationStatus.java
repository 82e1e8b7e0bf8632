package com.ewas.alerting.model;

/**
 * Publication state of one detection in one external system.
 *
 * PENDING → PUBLISHED → UPDATED → CANCELLED; FAILED may be retried back to PUBLISHED.
 */
public enum PublicationStatus {
    PENDING,
    PUBLISHED,
    FAILED,
    UPDATED,
    CANCELLED;

    /**
     * Live in the external system, i.e. an external id is recorded and not cancelled.
     */
    public boolean isLive() {
        return this == PUBLISHED || this == UPDATED;
    }
}
