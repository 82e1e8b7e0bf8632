package com.ewas.alerting.task;

import com.ewas.alerting.config.AlertFrameworkProperties;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.store.DetectorConfigStore;
import com.ewas.alerting.support.InMemoryDetectorConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@DisplayName("DetectorScheduler and PublishedAlertMonitor")
class DetectorSchedulerTest {

    @Mock
    private AlertTaskOrchestrator orchestrator;

    private InMemoryDetectorConfigStore detectors;
    private AlertFrameworkProperties properties;
    private DetectorScheduler scheduler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        detectors = new InMemoryDetectorConfigStore();
        properties = new AlertFrameworkProperties();
        scheduler = new DetectorScheduler(detectors, orchestrator, properties);
        when(orchestrator.runDetector(any(), isNull(), isNull())).thenReturn(
            new TaskSubmission<RunResult>("task-1", "run_detector", ExecutionMode.SYNC, new CompletableFuture<>()));

        detectors.save(DetectorConfig.builder().id("d1").name("Rain").type("threshold").build());
        detectors.save(DetectorConfig.builder().id("d2").name("Paused").type("threshold").active(false).build());
    }

    // ========== Scheduled runs ==========

    @Test
    @DisplayName("Only active detectors are submitted, over the default window")
    void testRunAllActive() {
        assertEquals(1, scheduler.runAllActive());

        verify(orchestrator).runDetector("d1", null, null);
        verify(orchestrator, never()).runDetector(eq("d2"), any(), any());
    }

    @Test
    @DisplayName("Disabled scheduler does nothing")
    void testDisabled() {
        scheduler.scheduledRun();

        verifyNoInteractions(orchestrator);

        properties.getScheduler().setEnabled(true);
        scheduler.scheduledRun();
        verify(orchestrator).runDetector("d1", null, null);
    }

    @Test
    @DisplayName("Store failure submits nothing")
    void testStoreFailure() {
        DetectorConfigStore failing = mock(DetectorConfigStore.class);
        when(failing.findActive()).thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertEquals(0, new DetectorScheduler(failing, orchestrator, properties).runAllActive());
        verifyNoInteractions(orchestrator);
    }

    // ========== Monitor ==========

    @Test
    @DisplayName("Monitor failures are logged, never thrown")
    void testMonitor() {
        PublishedAlertMonitor monitor = new PublishedAlertMonitor(orchestrator, properties);
        when(orchestrator.monitorPublishedAlerts()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(monitor::scheduledMonitor);
        verify(orchestrator).monitorPublishedAlerts();

        properties.getMonitor().setEnabled(false);
        monitor.scheduledMonitor();
        verify(orchestrator, times(1)).monitorPublishedAlerts();
    }
}
