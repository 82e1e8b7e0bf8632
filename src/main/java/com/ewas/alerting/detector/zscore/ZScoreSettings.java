package com.ewas.alerting.detector.zscore;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ZScoreSettings {

    private String variableCode;

    @JsonProperty("zscore_threshold_1")
    private double zscoreThreshold1 = 1.5;
    @JsonProperty("zscore_threshold_2")
    private double zscoreThreshold2 = 2.0;
    @JsonProperty("zscore_threshold_3")
    private double zscoreThreshold3 = 2.5;
    @JsonProperty("zscore_threshold_4")
    private double zscoreThreshold4 = 3.0;

    private int windowSize = 30;
    private int minBaselinePeriods = 7;
    private String freq = "1D";
    private double minStd = 0.1;
    private Integer adminLevel = 2;
    private String aggregationFunc = "mean";
    private int minAlertLevel = 1;

    /**
     * Variable whose text explains the cause of an anomaly at the same location and date.
     */
    private String causeVariableCode = "iom_dtm_displacement";
    private String defaultCategory = CauseCategoryMapper.CONFLICT;

    public double[] thresholds() {
        return new double[] {zscoreThreshold1, zscoreThreshold2, zscoreThreshold3, zscoreThreshold4};
    }

    public ResampleFrequency frequency() {
        return ResampleFrequency.fromCode(freq);
    }

    public AggregationFunction aggregation() {
        return AggregationFunction.fromCode(aggregationFunc);
    }
}
