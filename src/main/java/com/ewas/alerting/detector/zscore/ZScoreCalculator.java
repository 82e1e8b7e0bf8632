package com.ewas.alerting.detector.zscore;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores each bucket of a series against its trailing baseline.
 *
 * Statistics and z-scores are rounded to 5 decimals; levels are assigned on the
 * unrounded |z|, direction and percent deviation use the rounded values.
 */
public class ZScoreCalculator {

    private final RollingBaseline baseline;
    private final double[] thresholds;
    private final int minBaselinePeriods;

    public ZScoreCalculator(ZScoreSettings settings) {
        this.baseline = new RollingBaseline(settings.getWindowSize(), settings.getMinStd());
        this.thresholds = settings.thresholds();
        this.minBaselinePeriods = settings.getMinBaselinePeriods();
    }

    public List<ZScoreObservation> score(List<SeriesPoint> series) {
        double[] values = series.stream().mapToDouble(SeriesPoint::value).toArray();
        List<BaselineStatistics> stats = baseline.compute(values);

        List<ZScoreObservation> observations = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            SeriesPoint point = series.get(i);
            BaselineStatistics stat = stats.get(i);

            double z = (point.value() - stat.mean()) / stat.std();
            boolean sufficient = stat.periods() >= minBaselinePeriods;
            AlertLevel level = sufficient ? AlertLevel.of(Math.abs(z), thresholds) : AlertLevel.NO_ALERT;

            double mean = round(stat.mean(), 5);
            double percent = round((point.value() - mean) / Math.max(mean, 0.01) * 100.0, 2);

            observations.add(ZScoreObservation.builder()
                .point(point)
                .baselineMean(mean)
                .baselineStd(round(stat.std(), 5))
                .baselinePeriods(stat.periods())
                .zscore(round(z, 5))
                .zscoreAbs(round(Math.abs(z), 5))
                .alertLevel(level)
                .sufficientBaseline(sufficient)
                .percentDeviation(percent)
                .build());
        }
        return observations;
    }

    /**
     * Half-to-even rounding at the given number of decimals.
     */
    static double round(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double scale = Math.pow(10, decimals);
        return Math.rint(value * scale) / scale;
    }
}
