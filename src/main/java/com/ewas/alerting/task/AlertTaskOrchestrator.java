package com.ewas.alerting.task;

import com.ewas.alerting.alert.PendingDetectionProcessor;
import com.ewas.alerting.alert.ProcessingSummary;
import com.ewas.alerting.config.AlertFrameworkProperties;
import com.ewas.alerting.exception.TransientTaskException;
import com.ewas.alerting.publish.MonitorSummary;
import com.ewas.alerting.publish.PublicationService;
import com.ewas.alerting.publish.PublicationUpdateResult;
import com.ewas.alerting.publish.PublishResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Entry point for every pipeline task.
 *
 * Each task is dispatched (worker pool or caller thread) and supervised by the
 * {@link RetryHandler} with its configured budget. Failures never escape a task:
 * they are folded into the returned result with {@code success=false}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertTaskOrchestrator {

    private final DetectorRunService detectorRunService;
    private final PendingDetectionProcessor pendingDetectionProcessor;
    private final PublicationService publicationService;
    private final RetryHandler retryHandler;
    private final TaskDispatcher dispatcher;
    private final AlertFrameworkProperties properties;
    private final Clock clock;

    // ==================== DETECTOR RUNS ====================

    /**
     * @param start ISO-8601 window start, optional
     * @param end   ISO-8601 window end, optional
     */
    public TaskSubmission<RunResult> runDetector(String detectorId, String start, String end) {
        return dispatcher.submit("run_detector", taskId -> executeRun(taskId, detectorId, start, end));
    }

    RunResult executeRun(String taskId, String detectorId, String start, String end) {
        Instant startedAt = clock.instant();
        Instant windowStart;
        Instant windowEnd;
        try {
            windowStart = TimeInputs.parse(start);
            windowEnd = TimeInputs.parse(end);
        } catch (IllegalArgumentException e) {
            log.error("[DETECTOR-RUN] Rejected run of {}: {}", detectorId, e.getMessage());
            return failedRun(taskId, detectorId, startedAt, null, null, 0, e.getMessage());
        }

        RetryOutcome<RunResult> outcome = retryHandler.supervise(
            () -> detectorRunService.run(detectorId, windowStart, windowEnd),
            "run_detector:" + detectorId,
            properties.getRetry().getRun());

        if (outcome.isSuccess()) {
            return outcome.getValue().toBuilder().taskId(taskId).attempts(outcome.getAttempts()).build();
        }
        log.error("[DETECTOR-RUN] Run of {} failed after {} attempt(s): {}",
            detectorId, outcome.getAttempts(), outcome.errorMessage());
        return failedRun(taskId, detectorId, startedAt, windowStart, windowEnd, outcome.getAttempts(), outcome.errorMessage());
    }

    private RunResult failedRun(String taskId, String detectorId, Instant startedAt,
                                Instant windowStart, Instant windowEnd, int attempts, String error) {
        return RunResult.builder()
            .detectorId(detectorId)
            .taskId(taskId)
            .startTime(startedAt)
            .endTime(clock.instant())
            .windowStart(windowStart)
            .windowEnd(windowEnd)
            .success(false)
            .attempts(attempts)
            .errorMessage(error)
            .build();
    }

    // ==================== ALERT GENERATION ====================

    public TaskSubmission<ProcessingSummary> processPendingDetections(int maxDetections) {
        return dispatcher.submit("process_pending_detections",
            taskId -> pendingDetectionProcessor.processPendingDetections(maxDetections));
    }

    public TaskSubmission<ProcessingSummary> processPendingDetections() {
        return processPendingDetections(properties.getProcessing().getMaxPendingPerPass());
    }

    // ==================== PUBLICATION ====================

    /**
     * @param targetSystems systems to publish to, null or empty for all configured
     */
    public TaskSubmission<PublishResult> publishAlert(String detectionId, String templateId,
                                                     List<String> targetSystems, String language) {
        return dispatcher.submit("publish_alert",
            taskId -> executePublish(taskId, detectionId, templateId, targetSystems, language == null ? "en" : language));
    }

    PublishResult executePublish(String taskId, String detectionId, String templateId,
                                 List<String> targetSystems, String language) {
        Instant startedAt = clock.instant();
        AtomicReference<PublishResult> last = new AtomicReference<>();

        // Systems that already hold a live copy are skipped on each retry
        RetryOutcome<PublishResult> outcome = retryHandler.supervise(() -> {
            PublishResult pass = publicationService.publish(detectionId, templateId, targetSystems, language);
            last.set(pass);
            if (!pass.getFailedSystems().isEmpty() && pass.isRetryable()) {
                throw new TransientTaskException(pass.getFailedSystems().size() + " system(s) failed for detection " + detectionId);
            }
            return pass;
        }, "publish_alert:" + detectionId, properties.getRetry().getPublish());

        PublishResult result = outcome.isSuccess() ? outcome.getValue() : last.get();
        if (result == null) {
            log.error("[PUBLISH] Publication of detection {} failed: {}", detectionId, outcome.errorMessage());
            return PublishResult.builder()
                .detectionId(detectionId)
                .templateId(templateId)
                .taskId(taskId)
                .startTime(startedAt)
                .endTime(clock.instant())
                .success(false)
                .attempts(outcome.getAttempts())
                .errorMessage(outcome.errorMessage())
                .build();
        }
        return result.toBuilder()
            .taskId(taskId)
            .startTime(startedAt)
            .attempts(outcome.getAttempts())
            .errorMessage(result.isSuccess() ? result.getErrorMessage() : firstNonNull(result.getErrorMessage(), outcome.errorMessage()))
            .build();
    }

    public TaskSubmission<PublicationUpdateResult> updatePublishedAlert(String publishedAlertId) {
        return dispatcher.submit("update_published_alert", taskId -> supervisePublication(taskId, publishedAlertId,
            "update_published_alert:" + publishedAlertId,
            properties.getRetry().getUpdate(),
            () -> publicationService.update(publishedAlertId)));
    }

    public TaskSubmission<PublicationUpdateResult> cancelPublishedAlert(String publishedAlertId, String reason) {
        String cancelReason = reason == null || reason.isBlank() ? "Alert cancelled" : reason;
        return dispatcher.submit("cancel_published_alert", taskId -> supervisePublication(taskId, publishedAlertId,
            "cancel_published_alert:" + publishedAlertId,
            properties.getRetry().getCancel(),
            () -> publicationService.cancel(publishedAlertId, cancelReason)));
    }

    private PublicationUpdateResult supervisePublication(String taskId, String publishedAlertId, String operation,
                                                         RetryPolicy policy,
                                                         Supplier<PublicationUpdateResult> call) {
        Instant startedAt = clock.instant();
        RetryOutcome<PublicationUpdateResult> outcome = retryHandler.supervise(call, operation, policy);
        if (outcome.isSuccess()) {
            return outcome.getValue().toBuilder().taskId(taskId).attempts(outcome.getAttempts()).build();
        }
        log.error("[PUBLISH] {} failed after {} attempt(s): {}", operation, outcome.getAttempts(), outcome.errorMessage());
        return PublicationUpdateResult.builder()
            .publishedAlertId(publishedAlertId)
            .taskId(taskId)
            .startTime(startedAt)
            .endTime(clock.instant())
            .success(false)
            .attempts(outcome.getAttempts())
            .errorMessage(outcome.errorMessage())
            .build();
    }

    // ==================== MONITORING ====================

    public MonitorSummary monitorPublishedAlerts() {
        return publicationService.monitor();
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
