package com.ewas.alerting.task;

import com.ewas.alerting.config.AlertFrameworkProperties;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.store.DetectorConfigStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs every active detector over the default window. Off unless
 * {@code alert-framework.scheduler.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetectorScheduler {

    private final DetectorConfigStore detectorConfigStore;
    private final AlertTaskOrchestrator orchestrator;
    private final AlertFrameworkProperties properties;

    @Scheduled(fixedDelayString = "${alert-framework.scheduler.interval-ms:3600000}",
               initialDelayString = "${alert-framework.scheduler.interval-ms:3600000}")
    public void scheduledRun() {
        if (!properties.getScheduler().isEnabled()) {
            return;
        }
        runAllActive();
    }

    /**
     * @return number of detectors submitted
     */
    public int runAllActive() {
        List<DetectorConfig> active;
        try {
            active = detectorConfigStore.findActive();
        } catch (RuntimeException e) {
            log.error("[SCHEDULER] Could not load active detectors: {}", e.getMessage());
            return 0;
        }
        for (DetectorConfig config : active) {
            TaskSubmission<RunResult> submission = orchestrator.runDetector(config.getId(), null, null);
            log.info("[SCHEDULER] Submitted {} as task {} ({})", config.getName(), submission.taskId(), submission.mode());
        }
        return active.size();
    }
}
