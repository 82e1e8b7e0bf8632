package com.ewas.alerting.detector.zscore;

/**
 * Ordinal anomaly severity derived from |z| against four ascending thresholds.
 */
public enum AlertLevel {
    NO_ALERT(0, "No Alert", 7),
    LOW(1, "Low", 3),
    MEDIUM(2, "Medium", 5),
    HIGH(3, "High", 7),
    CRITICAL(4, "Critical", 10);

    private final int level;
    private final String displayName;
    private final int validityDays;

    AlertLevel(int level, String displayName, int validityDays) {
        this.level = level;
        this.displayName = displayName;
        this.validityDays = validityDays;
    }

    public int level() {
        return level;
    }

    public String displayName() {
        return displayName;
    }

    public int validityDays() {
        return validityDays;
    }

    /**
     * Alert severity 1-5.
     */
    public int severity() {
        return level + 1;
    }

    /**
     * @param thresholds four ascending thresholds for LOW, MEDIUM, HIGH, CRITICAL
     */
    public static AlertLevel of(double zscoreAbs, double[] thresholds) {
        AlertLevel result = NO_ALERT;
        for (int i = 0; i < thresholds.length && i < 4; i++) {
            if (zscoreAbs >= thresholds[i]) {
                result = values()[i + 1];
            }
        }
        return result;
    }

    public static AlertLevel fromLevel(int level) {
        for (AlertLevel value : values()) {
            if (value.level == level) {
                return value;
            }
        }
        return NO_ALERT;
    }
}
