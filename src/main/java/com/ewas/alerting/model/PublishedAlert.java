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
 * PublishedAlert - tracks one detection published to one external system in one language.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Document(collection = "published_alerts")
@CompoundIndex(name = "detection_system_language_uq",
    def = "{'detectionId': 1, 'externalSystem': 1, 'language': 1}", unique = true)
public class PublishedAlert {

    @Id
    private String id;

    private String detectionId;
    private String templateId;
    private String externalSystem;

    @Builder.Default
    private String language = "en";

    private String externalId;

    @Builder.Default
    private PublicationStatus status = PublicationStatus.PENDING;

    private int retryCount;
    private String lastError;

    @Builder.Default
    private Map<String, Object> publicationMetadata = new LinkedHashMap<>();

    private Instant publishedAt;
    private Instant lastUpdated;
    private Instant cancelledAt;
    private String cancellationReason;

    private Instant createdAt;

    public boolean hasExternalId() {
        return externalId != null && !externalId.isBlank();
    }

    public void markPublished(String newExternalId, Map<String, Object> response) {
        requireNot(PublicationStatus.CANCELLED, "published");
        this.externalId = newExternalId;
        this.status = PublicationStatus.PUBLISHED;
        this.publishedAt = Instant.now();
        this.lastError = null;
        if (response != null) {
            this.publicationMetadata = new LinkedHashMap<>(response);
        }
    }

    public void markFailed(String error) {
        requireNot(PublicationStatus.CANCELLED, "failed");
        this.status = PublicationStatus.FAILED;
        this.lastError = error;
        this.retryCount++;
    }

    public void markUpdated(Map<String, Object> response) {
        requireNot(PublicationStatus.CANCELLED, "updated");
        this.status = PublicationStatus.UPDATED;
        this.lastUpdated = Instant.now();
        this.lastError = null;
        if (response != null) {
            this.publicationMetadata.putAll(response);
        }
    }

    public void markCancelled(String reason) {
        this.status = PublicationStatus.CANCELLED;
        this.cancelledAt = Instant.now();
        this.cancellationReason = reason;
    }

    private void requireNot(PublicationStatus forbidden, String target) {
        if (status == forbidden) {
            throw new IllegalStateException(String.format(
                "Published alert %s is %s and cannot be marked %s", id, status, target));
        }
    }
}
