package com.ewas.alerting.model;

/**
 * Lifecycle status of a detection.
 *
 * <pre>
 *   PENDING ──► PROCESSED   (alert generated)
 *      │
 *      └──────► DISMISSED   (duplicate, or alert generation declined)
 * </pre>
 *
 * Non-pending statuses are terminal.
 */
public enum DetectionStatus {

    PENDING,

    PROCESSED,

    DISMISSED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
