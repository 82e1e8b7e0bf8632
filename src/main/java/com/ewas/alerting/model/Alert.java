package com.ewas.alerting.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Alert generated from an accepted detection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "alerts")
public class Alert {

    @Id
    private String id;

    @Indexed(unique = true)
    private String detectionId;

    private String title;
    private String text;
    private String category;
    private LocalDate eventDate;

    @Builder.Default
    private List<String> locationIds = new ArrayList<>();

    /**
     * 1 (lowest) to 5 (critical).
     */
    private int severity;

    private String dataSource;
    private Instant validFrom;
    private Instant validUntil;
    private Instant createdAt;
}
