package com.ewas.alerting.detector.zscore;

import java.util.ArrayList;
import java.util.List;

/**
 * Trailing rolling statistics over the previous {@code windowSize} observations, current excluded.
 *
 * <ul>
 *   <li>mean of no prior observation falls back to the current value</li>
 *   <li>std is the sample deviation, undefined below two observations; undefined or below
 *       {@code minStd} it is clamped to {@code minStd}</li>
 * </ul>
 */
public class RollingBaseline {

    private final int windowSize;
    private final double minStd;

    public RollingBaseline(int windowSize, double minStd) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive: " + windowSize);
        }
        this.windowSize = windowSize;
        this.minStd = minStd;
    }

    public List<BaselineStatistics> compute(double[] values) {
        List<BaselineStatistics> result = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - windowSize);
            int periods = i - from;

            double mean;
            double std;
            if (periods == 0) {
                mean = values[i];
                std = minStd;
            } else {
                double sum = 0.0;
                for (int j = from; j < i; j++) {
                    sum += values[j];
                }
                mean = sum / periods;
                std = sampleStd(values, from, i, mean);
                if (Double.isNaN(std) || std < minStd) {
                    std = minStd;
                }
            }
            result.add(new BaselineStatistics(mean, std, periods));
        }
        return result;
    }

    static double sampleStd(List<Double> values) {
        double[] array = values.stream().mapToDouble(Double::doubleValue).toArray();
        if (array.length == 0) {
            return Double.NaN;
        }
        double mean = 0.0;
        for (double v : array) {
            mean += v;
        }
        mean /= array.length;
        return sampleStd(array, 0, array.length, mean);
    }

    private static double sampleStd(double[] values, int from, int to, double mean) {
        int n = to - from;
        if (n < 2) {
            return Double.NaN;
        }
        double squares = 0.0;
        for (int j = from; j < to; j++) {
            double d = values[j] - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / (n - 1));
    }
}
