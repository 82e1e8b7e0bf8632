package com.ewas.alerting.detector.threshold;

import java.util.Arrays;
import java.util.List;

/**
 * Comparison of a reading value against a threshold.
 */
public enum ComparisonOperator {
    GT("gt", "greater than"),
    LT("lt", "less than"),
    GTE("gte", "greater than or equal to"),
    LTE("lte", "less than or equal to"),
    EQ("eq", "equal to"),
    NE("ne", "not equal to");

    private final String code;
    private final String displayName;

    ComparisonOperator(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GT -> value > threshold;
            case LT -> value < threshold;
            case GTE -> value >= threshold;
            case LTE -> value <= threshold;
            case EQ -> value == threshold;
            case NE -> value != threshold;
        };
    }

    /**
     * Equality operators carry no notion of distance from the threshold.
     */
    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    public static ComparisonOperator fromCode(String code) {
        for (ComparisonOperator operator : values()) {
            if (operator.code.equals(code)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + code + ", expected one of " + codes());
    }

    public static List<String> codes() {
        return Arrays.stream(values()).map(ComparisonOperator::code).toList();
    }
}
