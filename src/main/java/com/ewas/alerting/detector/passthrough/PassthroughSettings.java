package com.ewas.alerting.detector.passthrough;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class PassthroughSettings {

    private String variableCode;
    private Integer adminLevel;
    private List<Filter> filters = new ArrayList<>();

    /**
     * Readings of variable {@code variableName} pass only when their value equals {@code value} as text.
     */
    @Data
    @NoArgsConstructor
    public static class Filter {
        private String variableName;
        private Object value;
    }
}
