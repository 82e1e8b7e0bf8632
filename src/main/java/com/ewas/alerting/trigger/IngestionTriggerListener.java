package com.ewas.alerting.trigger;

import com.ewas.alerting.config.AlertFrameworkProperties;
import com.ewas.alerting.detector.schema.ConfigurationSchema;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.store.DetectorConfigStore;
import com.ewas.alerting.task.AlertTaskOrchestrator;
import com.ewas.alerting.task.RunResult;
import com.ewas.alerting.task.TaskSubmission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Runs active detectors over the recent window when ingestion reports new data.
 *
 * A processed source triggers detectors listing it in {@code monitored_sources}, test detectors
 * whose {@code test_source_name} matches, and every detector with {@code auto_trigger_on_data}.
 * An updated variable triggers detectors listing it in {@code monitored_variables}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionTriggerListener {

    static final String TEST_SOURCE_NAME = "test_source_name";

    private final DetectorConfigStore detectorConfigStore;
    private final AlertTaskOrchestrator orchestrator;
    private final AlertFrameworkProperties properties;
    private final Clock clock;

    @EventListener
    public void onSourceProcessed(SourceProcessedEvent event) {
        runForSource(event);
    }

    @EventListener
    public void onVariableDataUpdated(VariableDataUpdatedEvent event) {
        runForVariable(event);
    }

    /**
     * @return ids of the detectors submitted
     */
    public List<String> runForSource(SourceProcessedEvent event) {
        log.info("[TRIGGER] Source '{}' processed ({} variables), checking detectors",
            event.sourceName(), event.variablesProcessed());
        List<String> triggered = trigger("source " + event.sourceName(), config -> watchesSource(config, event.sourceName()));
        log.info("[TRIGGER] Triggered {} detectors for source '{}': {}", triggered.size(), event.sourceName(), triggered);
        return triggered;
    }

    public List<String> runForVariable(VariableDataUpdatedEvent event) {
        log.debug("[TRIGGER] Variable '{}' from source '{}' updated", event.variableCode(), event.sourceName());
        List<String> triggered = trigger("variable " + event.variableCode(),
            config -> listed(config.getConfiguration(), ConfigurationSchema.MONITORED_VARIABLES, event.variableCode()));
        if (!triggered.isEmpty()) {
            log.info("[TRIGGER] Triggered {} detectors for variable '{}': {}", triggered.size(), event.variableCode(), triggered);
        }
        return triggered;
    }

    private List<String> trigger(String cause, Predicate<DetectorConfig> matches) {
        if (!properties.getTrigger().isEnabled()) {
            return List.of();
        }
        List<DetectorConfig> active;
        try {
            active = detectorConfigStore.findActive();
        } catch (RuntimeException e) {
            log.error("[TRIGGER] Could not load active detectors for {}: {}", cause, e.getMessage());
            return List.of();
        }

        Instant end = clock.instant();
        Instant start = end.minus(properties.getTrigger().getWindow());
        List<String> triggered = new ArrayList<>();
        for (DetectorConfig config : active) {
            if (!matches.test(config)) {
                continue;
            }
            try {
                TaskSubmission<RunResult> submission = orchestrator.runDetector(config.getId(), start.toString(), end.toString());
                log.info("[TRIGGER] Submitted {} for {} as task {} ({})",
                    config.getName(), cause, submission.taskId(), submission.mode());
                triggered.add(config.getId());
            } catch (RuntimeException e) {
                log.error("[TRIGGER] Failed to trigger detector '{}' for {}: {}", config.getName(), cause, e.getMessage());
            }
        }
        return triggered;
    }

    static boolean watchesSource(DetectorConfig config, String sourceName) {
        Map<String, Object> configuration = config.getConfiguration();
        return listed(configuration, ConfigurationSchema.MONITORED_SOURCES, sourceName)
            || (configuration != null && sourceName.equals(configuration.get(TEST_SOURCE_NAME)))
            || config.isFlagEnabled(ConfigurationSchema.AUTO_TRIGGER_ON_DATA);
    }

    private static boolean listed(Map<String, Object> configuration, String key, String value) {
        Object list = configuration == null ? null : configuration.get(key);
        return list instanceof Collection<?> values && values.contains(value);
    }
}
