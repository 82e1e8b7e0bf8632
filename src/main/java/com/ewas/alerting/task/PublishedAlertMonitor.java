package com.ewas.alerting.task;

import com.ewas.alerting.config.AlertFrameworkProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic health and status sync of published alerts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PublishedAlertMonitor {

    private final AlertTaskOrchestrator orchestrator;
    private final AlertFrameworkProperties properties;

    @Scheduled(fixedDelayString = "${alert-framework.monitor.interval-ms:900000}",
               initialDelayString = "${alert-framework.monitor.interval-ms:900000}")
    public void scheduledMonitor() {
        if (!properties.getMonitor().isEnabled()) {
            return;
        }
        try {
            orchestrator.monitorPublishedAlerts();
        } catch (RuntimeException e) {
            log.error("[MONITOR] Alert monitoring failed: {}", e.getMessage(), e);
        }
    }
}
