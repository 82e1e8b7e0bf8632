package com.ewas.alerting.publish;

import com.ewas.alerting.config.AlertFrameworkProperties;
import com.ewas.alerting.model.AlertTemplate;
import com.ewas.alerting.model.Detection;
import com.ewas.alerting.model.PublicationStatus;
import com.ewas.alerting.model.PublishedAlert;
import com.ewas.alerting.store.AlertTemplateStore;
import com.ewas.alerting.store.DetectionStore;
import com.ewas.alerting.store.PublishedAlertStore;
import com.ewas.alerting.task.RetryHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Publishes detections to external alert systems and keeps one {@link PublishedAlert}
 * per (detection, system, language) in step with what the system holds.
 *
 * Each method is a single pass; retries are applied by the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PublicationService {

    private final DetectionStore detectionStore;
    private final AlertTemplateStore templateStore;
    private final PublishedAlertStore publishedAlertStore;
    private final AlertApiClientRegistry clientRegistry;
    private final AlertPayloadFormatter payloadFormatter;
    private final RetryHandler retryHandler;
    private final AlertFrameworkProperties properties;
    private final Clock clock;

    /**
     * Publish a detection to the target systems, or to every configured system when none are named.
     * Systems already holding a live copy are not contacted again.
     *
     * @throws IllegalArgumentException when the detection or template does not exist
     */
    public PublishResult publish(String detectionId, String templateId, List<String> targetSystems, String language) {
        Instant start = clock.instant();
        Detection detection = detectionStore.findById(detectionId)
            .orElseThrow(() -> new IllegalArgumentException("Detection not found: " + detectionId));
        AlertTemplate template = templateStore.findById(templateId)
            .orElseThrow(() -> new IllegalArgumentException("Alert template not found: " + templateId));

        List<String> systems = targetSystems == null || targetSystems.isEmpty()
            ? clientRegistry.systemNames() : targetSystems;
        PublishResult.PublishResultBuilder result = PublishResult.builder()
            .detectionId(detectionId)
            .templateId(templateId)
            .startTime(start);
        if (systems.isEmpty()) {
            log.warn("[PUBLISH] No alert systems configured, nothing to publish for detection {}", detectionId);
            return result.success(false).errorMessage("No alert systems configured").endTime(clock.instant()).build();
        }

        Map<String, Object> payload = payloadFormatter.format(detection, template, language);
        boolean anyPublished = false;
        boolean retryable = false;

        for (String system : systems) {
            Optional<PublishedAlert> existing = publishedAlertStore.find(detectionId, system, language);
            if (existing.isPresent() && existing.get().getStatus() == PublicationStatus.CANCELLED) {
                result.failed(SystemOutcome.failed(system, "Alert was cancelled in " + system));
                continue;
            }
            // A recorded external id means the external alert exists, even after a failed update
            if (existing.isPresent() && (existing.get().getStatus().isLive() || existing.get().hasExternalId())) {
                result.published(SystemOutcome.published(system, existing.get().getExternalId(), "already_published"));
                anyPublished = true;
                continue;
            }

            PublishedAlert record = existing.orElseGet(() -> PublishedAlert.builder()
                .detectionId(detectionId)
                .templateId(templateId)
                .externalSystem(system)
                .language(language)
                .build());

            Optional<AlertApiClient> client = clientRegistry.find(system);
            if (client.isEmpty()) {
                String error = "API client " + system + " not configured";
                record.markFailed(error);
                saveQuietly(record);
                result.failed(SystemOutcome.failed(system, error));
                continue;
            }

            try {
                Map<String, Object> response = client.get().publishAlert(payload);
                Object externalId = response.get("id");
                record.markPublished(externalId == null ? "" : externalId.toString(), response);
                publishedAlertStore.save(record);
                result.published(SystemOutcome.published(system, record.getExternalId(), "published"));
                anyPublished = true;
                log.info("[PUBLISH] Detection {} published to {}: externalId={}", detectionId, system, record.getExternalId());
            } catch (RuntimeException e) {
                record.markFailed(e.getMessage());
                saveQuietly(record);
                result.failed(SystemOutcome.failed(system, e.getMessage()));
                retryable |= retryHandler.isRetryable(e);
                log.error("[PUBLISH] Failed to publish detection {} to {}: {}", detectionId, system, e.getMessage());
            }
        }

        PublishResult built = result.success(anyPublished).retryable(retryable).endTime(clock.instant()).build();
        log.info("[PUBLISH] Publication of detection {} completed: published={}, failed={}",
            detectionId, built.getPublishedAlerts().size(), built.getFailedSystems().size());
        return built;
    }

    /**
     * Push the current rendering of a published alert to its system.
     *
     * @throws IllegalStateException when no external id is recorded, the alert was cancelled
     *                               or the system is no longer configured
     */
    public PublicationUpdateResult update(String publishedAlertId) {
        Instant start = clock.instant();
        PublishedAlert record = requireExternal(publishedAlertId);
        if (record.getStatus() == PublicationStatus.CANCELLED) {
            throw new IllegalStateException("Published alert " + publishedAlertId + " is cancelled");
        }
        Detection detection = detectionStore.findById(record.getDetectionId())
            .orElseThrow(() -> new IllegalArgumentException("Detection not found: " + record.getDetectionId()));
        AlertTemplate template = templateStore.findById(record.getTemplateId())
            .orElseThrow(() -> new IllegalArgumentException("Alert template not found: " + record.getTemplateId()));
        AlertApiClient client = requireClient(record);

        try {
            Map<String, Object> response = client.updateAlert(record.getExternalId(),
                payloadFormatter.format(detection, template, record.getLanguage()));
            record.markUpdated(response);
            publishedAlertStore.save(record);
        } catch (RuntimeException e) {
            record.markFailed(e.getMessage());
            saveQuietly(record);
            throw e;
        }

        log.info("[PUBLISH] Published alert {} updated in {}", publishedAlertId, record.getExternalSystem());
        return PublicationUpdateResult.builder()
            .publishedAlertId(publishedAlertId)
            .startTime(start)
            .endTime(clock.instant())
            .success(true)
            .build();
    }

    /**
     * @throws IllegalStateException when no external id is recorded or the system is no longer configured
     */
    public PublicationUpdateResult cancel(String publishedAlertId, String reason) {
        Instant start = clock.instant();
        PublishedAlert record = requireExternal(publishedAlertId);
        AlertApiClient client = requireClient(record);

        try {
            client.cancelAlert(record.getExternalId(), reason);
        } catch (RuntimeException e) {
            record.setLastError(e.getMessage());
            saveQuietly(record);
            throw e;
        }
        record.markCancelled(reason);
        publishedAlertStore.save(record);

        log.info("[PUBLISH] Published alert {} cancelled in {}: {}", publishedAlertId, record.getExternalSystem(), reason);
        return PublicationUpdateResult.builder()
            .publishedAlertId(publishedAlertId)
            .startTime(start)
            .endTime(clock.instant())
            .success(true)
            .build();
    }

    /**
     * Health of every configured system, then the external status of every alert published
     * within the monitor lookback, stored under {@code last_status_check}.
     */
    public MonitorSummary monitor() {
        Instant start = clock.instant();
        Map<String, SystemHealth> health = clientRegistry.checkHealth();

        int checked = 0;
        int updated = 0;
        int errors = 0;
        List<PublishedAlert> recent = publishedAlertStore.findLiveSince(start.minus(properties.getMonitor().getLookback()));
        for (PublishedAlert record : recent) {
            if (!record.hasExternalId()) {
                continue;
            }
            try {
                Optional<AlertApiClient> client = clientRegistry.find(record.getExternalSystem());
                if (client.isPresent()) {
                    Map<String, Object> status = client.get().getAlertStatus(record.getExternalId());
                    Map<String, Object> metadata = record.getPublicationMetadata() == null
                        ? new LinkedHashMap<>() : new LinkedHashMap<>(record.getPublicationMetadata());
                    metadata.put("last_status_check", status);
                    record.setPublicationMetadata(metadata);
                    publishedAlertStore.save(record);
                    updated++;
                }
                checked++;
            } catch (RuntimeException e) {
                errors++;
                log.error("[MONITOR] Failed to check status of published alert {}: {}", record.getId(), e.getMessage());
            }
        }

        log.info("[MONITOR] Alert monitoring completed: checked={}, statusUpdates={}, errors={}, systems={}",
            checked, updated, errors, health.size());
        return MonitorSummary.builder()
            .startTime(start)
            .endTime(clock.instant())
            .checkedAlerts(checked)
            .statusUpdates(updated)
            .errors(errors)
            .apiHealth(health)
            .build();
    }

    private PublishedAlert requireExternal(String publishedAlertId) {
        PublishedAlert record = publishedAlertStore.findById(publishedAlertId)
            .orElseThrow(() -> new IllegalArgumentException("Published alert not found: " + publishedAlertId));
        if (!record.hasExternalId()) {
            throw new IllegalStateException("Published alert " + publishedAlertId + " has no external ID");
        }
        return record;
    }

    private AlertApiClient requireClient(PublishedAlert record) {
        return clientRegistry.find(record.getExternalSystem())
            .orElseThrow(() -> new IllegalStateException("API client " + record.getExternalSystem() + " not configured"));
    }

    private void saveQuietly(PublishedAlert record) {
        try {
            publishedAlertStore.save(record);
        } catch (RuntimeException e) {
            log.error("[PUBLISH] Failed to record publication state for detection {} in {}: {}",
                record.getDetectionId(), record.getExternalSystem(), e.getMessage());
        }
    }
}
