package com.ewas.alerting.detector.surge;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ConflictSurgeSettings {

    private String variableCode = "acled_events";

    /**
     * Recent total over historical average that counts as a surge.
     */
    private double thresholdMultiplier = 2.0;

    private int minEvents = 5;

    /**
     * Period length used for the baseline when the run window is shorter than a day.
     */
    private int analysisPeriodDays = 7;

    private int lookbackPeriodDays = 30;
    private Integer adminLevel = 2;
}
