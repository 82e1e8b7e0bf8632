package com.ewas.alerting.publish;

/**
 * Health of one external system as seen by the last check.
 */
public record SystemHealth(boolean healthy, String status, String error) {

    public static SystemHealth up() {
        return new SystemHealth(true, "OK", null);
    }

    public static SystemHealth down() {
        return new SystemHealth(false, "DOWN", null);
    }

    public static SystemHealth error(String error) {
        return new SystemHealth(false, "ERROR", error);
    }
}
