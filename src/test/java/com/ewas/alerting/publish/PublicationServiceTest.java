package com.ewas.alerting.publish;

import com.ewas.alerting.config.AlertFrameworkProperties;
import com.ewas.alerting.model.AlertTemplate;
import com.ewas.alerting.model.Detection;
import com.ewas.alerting.model.PublicationStatus;
import com.ewas.alerting.model.PublishedAlert;
import com.ewas.alerting.support.FakeAlertApiClient;
import com.ewas.alerting.support.InMemoryAlertTemplateStore;
import com.ewas.alerting.support.InMemoryDetectionStore;
import com.ewas.alerting.support.InMemoryLocationStore;
import com.ewas.alerting.support.InMemoryPublishedAlertStore;
import com.ewas.alerting.task.RetryHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PublicationService")
class PublicationServiceTest {

    private static final Instant NOW = Instant.parse("2024-04-10T06:00:00Z");

    private InMemoryDetectionStore detections;
    private InMemoryAlertTemplateStore templates;
    private InMemoryPublishedAlertStore published;
    private FakeAlertApiClient reliefweb;
    private FakeAlertApiClient gdacs;
    private AlertFrameworkProperties properties;
    private PublicationService service;
    private Detection detection;

    @BeforeEach
    void setUp() {
        detections = new InMemoryDetectionStore();
        templates = new InMemoryAlertTemplateStore();
        published = new InMemoryPublishedAlertStore();
        reliefweb = new FakeAlertApiClient("reliefweb");
        gdacs = new FakeAlertApiClient("gdacs");
        properties = new AlertFrameworkProperties();

        Map<String, AlertApiClient> clients = new LinkedHashMap<>();
        clients.put("reliefweb", reliefweb);
        clients.put("gdacs", gdacs);
        service = newService(new AlertApiClientRegistry(clients));

        detection = detections.save(Detection.builder()
            .detectorId("detector-1")
            .detectorName("Rainfall watch")
            .detectorType("threshold")
            .eventTimestamp(Instant.parse("2024-04-05T00:00:00Z"))
            .category("Natural disasters")
            .confidenceScore(0.92)
            .locationIds(new LinkedHashSet<>(List.of("SD-02")))
            .build());
        templates.add(AlertTemplate.builder()
            .id("tpl-1")
            .name("flood")
            .category("Natural disasters")
            .title("{category} in {location}")
            .text("Heavy rain on {event_date}")
            .build());
    }

    private PublicationService newService(AlertApiClientRegistry registry) {
        return new PublicationService(detections, templates, published, registry,
            new AlertPayloadFormatter(new InMemoryLocationStore().add("SD-02", "Kassala", 1, "SD")),
            new RetryHandler(delay -> { }), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ========== Publish ==========

    @Test
    @DisplayName("Publishes to every configured system and records the external ids")
    void testPublishAll() {
        PublishResult result = service.publish(detection.getId(), "tpl-1", null, "en");

        assertTrue(result.isSuccess());
        assertEquals(2, result.getPublishedAlerts().size());
        assertTrue(result.getFailedSystems().isEmpty());

        PublishedAlert record = published.find(detection.getId(), "reliefweb", "en").orElseThrow();
        assertEquals("reliefweb-1", record.getExternalId());
        assertEquals(PublicationStatus.PUBLISHED, record.getStatus());
        assertEquals("Natural disasters in SD-02", reliefweb.published().get(0).get("title"));
        assertEquals("critical", reliefweb.published().get(0).get("severity"));
    }

    @Test
    @DisplayName("Systems already holding a live copy are not contacted again")
    void testSkipLive() {
        service.publish(detection.getId(), "tpl-1", null, "en");

        PublishResult again = service.publish(detection.getId(), "tpl-1", null, "en");

        assertTrue(again.isSuccess());
        assertEquals("already_published", again.getPublishedAlerts().get(0).status());
        assertEquals(1, reliefweb.published().size());
        assertEquals(2, published.all().size());
    }

    @Test
    @DisplayName("Each language is a separate publication")
    void testLanguages() {
        service.publish(detection.getId(), "tpl-1", List.of("reliefweb"), "en");
        service.publish(detection.getId(), "tpl-1", List.of("reliefweb"), "fr");

        assertEquals(2, reliefweb.published().size());
        assertEquals("fr", reliefweb.published().get(1).get("language"));
    }

    @Test
    @DisplayName("A failing system is recorded and the others still publish")
    void testPartialFailure() {
        gdacs.failWith(new ResourceAccessException("Connection refused"));

        PublishResult result = service.publish(detection.getId(), "tpl-1", null, "en");

        assertTrue(result.isSuccess());
        assertTrue(result.isRetryable());
        assertEquals("gdacs", result.getFailedSystems().get(0).system());
        PublishedAlert failed = published.find(detection.getId(), "gdacs", "en").orElseThrow();
        assertEquals(PublicationStatus.FAILED, failed.getStatus());
        assertEquals(1, failed.getRetryCount());
        assertEquals("Connection refused", failed.getLastError());

        gdacs.failWith(null);
        PublishResult retried = service.publish(detection.getId(), "tpl-1", null, "en");

        assertTrue(retried.getFailedSystems().isEmpty());
        assertEquals(PublicationStatus.PUBLISHED, failed.getStatus());
        assertEquals(1, reliefweb.published().size());
    }

    @Test
    @DisplayName("Client errors and unknown systems are not retryable")
    void testNotRetryable() {
        reliefweb.failWith(new HttpClientErrorException(HttpStatus.UNPROCESSABLE_ENTITY));

        PublishResult result = service.publish(detection.getId(), "tpl-1", List.of("reliefweb", "hewsweb"), "en");

        assertFalse(result.isSuccess());
        assertFalse(result.isRetryable());
        assertEquals(2, result.getFailedSystems().size());
        assertEquals("API client hewsweb not configured", result.getFailedSystems().get(1).error());
    }

    @Test
    @DisplayName("Cancelled publications are never republished")
    void testCancelledNotRepublished() {
        service.publish(detection.getId(), "tpl-1", List.of("reliefweb"), "en");
        PublishedAlert record = published.find(detection.getId(), "reliefweb", "en").orElseThrow();
        service.cancel(record.getId(), "false alarm");

        PublishResult result = service.publish(detection.getId(), "tpl-1", List.of("reliefweb"), "en");

        assertFalse(result.isSuccess());
        assertEquals(1, reliefweb.published().size());
    }

    @Test
    @DisplayName("Missing detection or template is an argument error")
    void testMissingInputs() {
        assertThrows(IllegalArgumentException.class, () -> service.publish("det-404", "tpl-1", null, "en"));
        assertThrows(IllegalArgumentException.class, () -> service.publish(detection.getId(), "tpl-404", null, "en"));
    }

    @Test
    @DisplayName("No configured systems is a failed publication")
    void testNoSystems() {
        PublishResult result = newService(new AlertApiClientRegistry(Map.of()))
            .publish(detection.getId(), "tpl-1", null, "en");

        assertFalse(result.isSuccess());
        assertEquals("No alert systems configured", result.getErrorMessage());
    }

    // ========== Update and cancel ==========

    @Test
    @DisplayName("Update pushes the current rendering to the system")
    void testUpdate() {
        service.publish(detection.getId(), "tpl-1", List.of("gdacs"), "en");
        PublishedAlert record = published.find(detection.getId(), "gdacs", "en").orElseThrow();

        PublicationUpdateResult result = service.update(record.getId());

        assertTrue(result.isSuccess());
        assertEquals(List.of("gdacs-1"), gdacs.updated());
        assertEquals(PublicationStatus.UPDATED, record.getStatus());
        assertEquals("updated", record.getPublicationMetadata().get("status"));
    }

    @Test
    @DisplayName("Update and cancel need an external id")
    void testNeedsExternalId() {
        PublishedAlert pending = published.save(PublishedAlert.builder()
            .detectionId(detection.getId()).templateId("tpl-1").externalSystem("gdacs").build());

        assertThrows(IllegalStateException.class, () -> service.update(pending.getId()));
        assertThrows(IllegalStateException.class, () -> service.cancel(pending.getId(), "x"));
        assertThrows(IllegalArgumentException.class, () -> service.update("pub-404"));
    }

    @Test
    @DisplayName("A failed update is recorded and rethrown")
    void testUpdateFailure() {
        service.publish(detection.getId(), "tpl-1", List.of("gdacs"), "en");
        PublishedAlert record = published.find(detection.getId(), "gdacs", "en").orElseThrow();
        gdacs.failWith(new ResourceAccessException("Read timed out"));

        assertThrows(ResourceAccessException.class, () -> service.update(record.getId()));
        assertEquals(PublicationStatus.FAILED, record.getStatus());
        assertEquals(1, record.getRetryCount());
    }

    @Test
    @DisplayName("Publishing after a failed update keeps the existing external alert")
    void testRepublishAfterFailedUpdate() {
        service.publish(detection.getId(), "tpl-1", List.of("reliefweb"), "en");
        PublishedAlert record = published.find(detection.getId(), "reliefweb", "en").orElseThrow();
        reliefweb.failWith(new ResourceAccessException("timeout"));
        assertThrows(ResourceAccessException.class, () -> service.update(record.getId()));
        reliefweb.failWith(null);

        PublishResult again = service.publish(detection.getId(), "tpl-1", List.of("reliefweb"), "en");

        assertTrue(again.isSuccess());
        assertEquals("already_published", again.getPublishedAlerts().get(0).status());
        assertEquals("reliefweb-1", again.getPublishedAlerts().get(0).externalId());
        assertEquals(1, reliefweb.published().size());
        assertEquals("reliefweb-1", record.getExternalId());
    }

    @Test
    @DisplayName("Cancel records the reason")
    void testCancel() {
        service.publish(detection.getId(), "tpl-1", List.of("gdacs"), "en");
        PublishedAlert record = published.find(detection.getId(), "gdacs", "en").orElseThrow();

        service.cancel(record.getId(), "false alarm");

        assertEquals(List.of("gdacs-1:false alarm"), gdacs.cancelled());
        assertEquals(PublicationStatus.CANCELLED, record.getStatus());
        assertEquals("false alarm", record.getCancellationReason());
        assertThrows(IllegalStateException.class, () -> service.update(record.getId()));
    }

    // ========== Monitor ==========

    @Test
    @DisplayName("Monitor checks health and stores the latest external status")
    void testMonitor() {
        gdacs.healthy(false);
        service.publish(detection.getId(), "tpl-1", null, "en");
        PublishedAlert stale = published.save(PublishedAlert.builder()
            .detectionId("det-old").externalSystem("reliefweb").externalId("rw-old")
            .status(PublicationStatus.PUBLISHED).publishedAt(NOW.minus(Duration.ofDays(3))).build());

        MonitorSummary summary = service.monitor();

        assertEquals(2, summary.getCheckedAlerts());
        assertEquals(2, summary.getStatusUpdates());
        assertEquals(0, summary.getErrors());
        assertTrue(summary.getApiHealth().get("reliefweb").healthy());
        assertFalse(summary.getApiHealth().get("gdacs").healthy());
        assertFalse(stale.getPublicationMetadata().containsKey("last_status_check"));
        PublishedAlert recent = published.find(detection.getId(), "reliefweb", "en").orElseThrow();
        assertEquals(Map.of("id", "reliefweb-1", "status", "active"), recent.getPublicationMetadata().get("last_status_check"));
    }
}
