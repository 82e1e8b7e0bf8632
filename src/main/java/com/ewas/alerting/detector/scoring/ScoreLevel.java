package com.ewas.alerting.detector.scoring;

/**
 * Alert level of a scored reading, highest first.
 */
public enum ScoreLevel {
    CRITICAL("critical", 25.0),
    HIGH("high", 15.0),
    MEDIUM("medium", 8.0),
    LOW("low", 4.0),
    NONE("none", 0.0);

    private final String code;
    private final double defaultThreshold;

    ScoreLevel(String code, double defaultThreshold) {
        this.code = code;
        this.defaultThreshold = defaultThreshold;
    }

    public String code() {
        return code;
    }

    double defaultThreshold() {
        return defaultThreshold;
    }

    public String displayName() {
        return Character.toUpperCase(code.charAt(0)) + code.substring(1);
    }

    public static ScoreLevel of(double score, ScoringSettings settings) {
        for (ScoreLevel level : values()) {
            if (level != NONE && score >= settings.threshold(level)) {
                return level;
            }
        }
        return NONE;
    }

    public static ScoreLevel fromCode(String code) {
        for (ScoreLevel level : values()) {
            if (level.code.equals(code)) {
                return level;
            }
        }
        return NONE;
    }
}
