package com.ewas.alerting.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reading - one indicator value for a location over a period. Read-only to the pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Document(collection = "readings")
@CompoundIndex(name = "variable_start_idx", def = "{'variableCode': 1, 'startDate': 1}")
public class Reading {

    @Id
    private String id;

    private String variableCode;
    private String variableName;

    /**
     * Name of the data source the variable belongs to.
     */
    private String sourceName;

    private String locationId;
    private String locationName;
    private Integer adminLevel;

    private Instant startDate;
    private Instant endDate;

    /**
     * Numeric value, null when the reading carries only text.
     */
    private Double value;

    private String text;

    @Builder.Default
    private Map<String, Object> rawPayload = new LinkedHashMap<>();

    public LocationRef toLocationRef() {
        return locationId == null ? null : new LocationRef(locationId, locationName, adminLevel);
    }

    /**
     * Event time of the reading: start date, falling back to end date.
     */
    public Instant effectiveDate() {
        return startDate != null ? startDate : endDate;
    }
}
