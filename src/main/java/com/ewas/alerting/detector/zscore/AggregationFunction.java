package com.ewas.alerting.detector.zscore;

import java.util.List;

/**
 * Aggregation of the readings that fall into one frequency bucket.
 */
public enum AggregationFunction {
    MEAN("mean"),
    SUM("sum"),
    MAX("max"),
    MIN("min"),
    STD("std"),
    COUNT("count");

    private final String code;

    AggregationFunction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Aggregate a non-empty bucket. STD is the sample deviation and yields 0 for a single value.
     */
    public double apply(List<Double> values) {
        return switch (this) {
            case MEAN -> values.stream().mapToDouble(Double::doubleValue).sum() / values.size();
            case SUM -> values.stream().mapToDouble(Double::doubleValue).sum();
            case MAX -> values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            case MIN -> values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
            case STD -> {
                double sd = RollingBaseline.sampleStd(values);
                yield Double.isNaN(sd) ? 0.0 : sd;
            }
            case COUNT -> values.size();
        };
    }

    public static AggregationFunction fromCode(String code) {
        for (AggregationFunction function : values()) {
            if (function.code.equals(code)) {
                return function;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation function: " + code);
    }
}
