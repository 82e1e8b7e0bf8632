package com.ewas.alerting.detector.zscore;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Bucketing frequency of a series. Buckets are labelled by their closing day:
 * the day itself, the Sunday ending the week, or the last day of the (quarter) month.
 */
public enum ResampleFrequency {
    DAILY("1D"),
    WEEKLY("1W"),
    MONTHLY("1M"),
    QUARTERLY("3M");

    private final String code;

    ResampleFrequency(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Label of the bucket containing {@code date}.
     *
     * @param origin earliest date of the whole data set; 3-month buckets are counted from its month end
     */
    public LocalDate bucketOf(LocalDate date, LocalDate origin) {
        return switch (this) {
            case DAILY -> date;
            case WEEKLY -> date.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
            case MONTHLY -> monthEnd(date);
            case QUARTERLY -> {
                LocalDate first = monthEnd(origin);
                long months = ChronoUnit.MONTHS.between(first.withDayOfMonth(1), date.withDayOfMonth(1));
                long steps = months <= 0 ? 0 : (months + 2) / 3;
                yield monthEnd(first.withDayOfMonth(1).plusMonths(steps * 3));
            }
        };
    }

    private static LocalDate monthEnd(LocalDate date) {
        return date.with(TemporalAdjusters.lastDayOfMonth());
    }

    public static ResampleFrequency fromCode(String code) {
        for (ResampleFrequency frequency : values()) {
            if (frequency.code.equals(code)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unknown frequency: " + code);
    }
}
