package com.ewas.alerting.config;

import com.ewas.alerting.detector.DetectorRegistry;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.store.DetectorConfigStore;
import com.ewas.alerting.task.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fails startup on invalid pipeline properties; reports stored detectors whose configuration
 * no longer validates so operators can fix them before the next run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfigurationValidator {

    private final AlertFrameworkProperties properties;
    private final DetectorRegistry detectorRegistry;
    private final DetectorConfigStore detectorConfigStore;

    @Value("${spring.profiles.active:default}")
    private String activeProfile;

    @Value("${spring.data.mongodb.uri:}")
    private String mongoUri;

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        if ("test".equals(activeProfile)) {
            log.info("[CONFIG] Skipping configuration validation in test mode");
            return;
        }

        List<String> errors = validateProperties();
        if (!errors.isEmpty()) {
            log.error("[CONFIG] Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed. Please fix the errors above.");
        }

        int invalid = validateStoredDetectors();
        log.info("[CONFIG] Configuration validation passed ({} stored detector(s) with invalid configuration)", invalid);
        logConfigurationSummary();
    }

    List<String> validateProperties() {
        List<String> errors = new ArrayList<>();
        AlertFrameworkProperties.Worker worker = properties.getWorker();
        if (worker.isEnabled() && worker.getPoolSize() < 1) {
            errors.add("alert-framework.worker.pool-size must be at least 1");
        }
        if (worker.getQueueCapacity() < 0) {
            errors.add("alert-framework.worker.queue-capacity must not be negative");
        }

        AlertFrameworkProperties.Deduplication dedup = properties.getDeduplication();
        if (dedup.getMinLocationOverlap() < 0.0 || dedup.getMinLocationOverlap() > 1.0) {
            errors.add("alert-framework.deduplication.min-location-overlap must be within [0, 1]");
        }
        if (dedup.getTemporalWindow().isNegative() || dedup.getGeographicWindow().isNegative()) {
            errors.add("alert-framework.deduplication windows must not be negative");
        }

        if (properties.getProcessing().getMaxPendingPerPass() < 1) {
            errors.add("alert-framework.processing.max-pending-per-pass must be at least 1");
        }
        if (!isPositive(properties.getProcessing().getDefaultValidity())) {
            errors.add("alert-framework.processing.default-validity must be positive");
        }
        AlertFrameworkProperties.ModelCacheSettings models = properties.getModelCache();
        if (!isPositive(models.getConnectTimeout()) || !isPositive(models.getReadTimeout())) {
            errors.add("alert-framework.model-cache timeouts must be positive");
        }
        if (!isPositive(properties.getTrigger().getWindow())) {
            errors.add("alert-framework.trigger.window must be positive");
        }

        AlertFrameworkProperties.Retry retry = properties.getRetry();
        checkRetry(errors, "run", retry.getRun());
        checkRetry(errors, "publish", retry.getPublish());
        checkRetry(errors, "update", retry.getUpdate());
        checkRetry(errors, "cancel", retry.getCancel());

        properties.getSystems().forEach((name, system) -> {
            if (isNullOrEmpty(system.getBaseUrl())) {
                errors.add("alert-framework.systems." + name + ".base-url is not configured");
                return;
            }
            try {
                String scheme = URI.create(system.getBaseUrl().trim()).getScheme();
                if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                    errors.add("alert-framework.systems." + name + ".base-url must be http(s): " + system.getBaseUrl());
                }
            } catch (IllegalArgumentException e) {
                errors.add("alert-framework.systems." + name + ".base-url is malformed: " + e.getMessage());
            }
            if (!isPositive(system.getTimeout())) {
                errors.add("alert-framework.systems." + name + ".timeout must be positive");
            }
        });

        if (isNullOrEmpty(mongoUri)) {
            log.warn("[CONFIG] spring.data.mongodb.uri is not configured, using the driver default");
        }
        return errors;
    }

    /**
     * @return number of stored detectors that fail validation
     */
    int validateStoredDetectors() {
        List<DetectorConfig> detectors;
        try {
            detectors = detectorConfigStore.findAll();
        } catch (RuntimeException e) {
            log.warn("[CONFIG] Could not load stored detectors for validation: {}", e.getMessage());
            return 0;
        }

        int invalid = 0;
        for (DetectorConfig config : detectors) {
            List<String> violations = detectorRegistry.validate(config);
            if (!violations.isEmpty()) {
                invalid++;
                log.warn("[CONFIG] Detector {} ({}) has invalid configuration: {}",
                    config.getName(), config.getType(), String.join("; ", violations));
            }
        }
        return invalid;
    }

    private void checkRetry(List<String> errors, String name, RetryPolicy policy) {
        if (policy.getMaxRetries() < 0) {
            errors.add("alert-framework.retry." + name + ".max-retries must not be negative");
        }
        if (policy.getBaseDelay() == null || policy.getBaseDelay().isNegative()) {
            errors.add("alert-framework.retry." + name + ".base-delay must not be negative");
        }
    }

    private void logConfigurationSummary() {
        AlertFrameworkProperties.Worker worker = properties.getWorker();
        log.info("[CONFIG] Configuration Summary:");
        log.info("  Workers: enabled={}, poolSize={}, queueCapacity={}", worker.isEnabled(), worker.getPoolSize(), worker.getQueueCapacity());
        log.info("  Detector variants: {}", detectorRegistry.keys());
        log.info("  Alert systems: {}", properties.getSystems().keySet());
        log.info("  Scheduler: enabled={}, intervalMs={}", properties.getScheduler().isEnabled(), properties.getScheduler().getIntervalMs());
        log.info("  MongoDB URI: {}", maskUri(mongoUri));
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }

    private boolean isNullOrEmpty(String str) {
        return str == null || str.trim().isEmpty();
    }

    private String maskUri(String uri) {
        if (isNullOrEmpty(uri)) {
            return "not configured";
        }
        return uri.replaceAll(":[^:@/]+@", ":****@");
    }
}
