package com.ewas.alerting.config;

import com.ewas.alerting.detector.DetectorContext;
import com.ewas.alerting.detector.DetectorRegistry;
import com.ewas.alerting.detector.classification.ModelCache;
import com.ewas.alerting.detector.schema.ConfigurationBinder;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.store.DetectorConfigStore;
import com.ewas.alerting.support.InMemoryDetectorConfigStore;
import com.ewas.alerting.support.InMemoryReadingSource;
import com.ewas.alerting.task.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ConfigurationValidator")
class ConfigurationValidatorTest {

    private AlertFrameworkProperties properties;
    private DetectorRegistry registry;
    private InMemoryDetectorConfigStore store;
    private ConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        properties = new AlertFrameworkProperties();
        ModelCache modelCache = new ModelCache(path -> texts -> List.of(), 2, Duration.ofMinutes(5));
        registry = new DetectorRegistry(
            new DetectorContext(new InMemoryReadingSource(), modelCache, Clock.systemUTC()), new ConfigurationBinder());
        store = new InMemoryDetectorConfigStore();
        validator = new ConfigurationValidator(properties, registry, store);
        ReflectionTestUtils.setField(validator, "activeProfile", "default");
        ReflectionTestUtils.setField(validator, "mongoUri", "mongodb://user:pw@localhost:27017/ewas");
    }

    private static AlertFrameworkProperties.ExternalSystem system(String baseUrl) {
        AlertFrameworkProperties.ExternalSystem system = new AlertFrameworkProperties.ExternalSystem();
        system.setBaseUrl(baseUrl);
        return system;
    }

    // ========== Properties ==========

    @Test
    @DisplayName("Defaults are valid")
    void testDefaults() {
        assertTrue(validator.validateProperties().isEmpty());
        assertDoesNotThrow(validator::validateConfiguration);
    }

    @Test
    @DisplayName("Out-of-range values are all reported")
    void testInvalidProperties() {
        properties.getWorker().setPoolSize(0);
        properties.getDeduplication().setMinLocationOverlap(1.5);
        properties.getProcessing().setMaxPendingPerPass(0);
        properties.getRetry().setPublish(new RetryPolicy(-1, Duration.ofSeconds(5)));

        List<String> errors = validator.validateProperties();

        assertEquals(4, errors.size());
        assertTrue(errors.contains("alert-framework.worker.pool-size must be at least 1"));
        assertTrue(errors.contains("alert-framework.retry.publish.max-retries must not be negative"));
    }

    @Test
    @DisplayName("Default validity and model timeouts must be positive")
    void testDurations() {
        properties.getProcessing().setDefaultValidity(Duration.ZERO);
        properties.getModelCache().setReadTimeout(Duration.ofSeconds(-1));
        properties.getTrigger().setWindow(null);

        assertEquals(List.of(
            "alert-framework.processing.default-validity must be positive",
            "alert-framework.model-cache timeouts must be positive",
            "alert-framework.trigger.window must be positive"), validator.validateProperties());
    }

    @Test
    @DisplayName("External systems need an http(s) base url and a positive timeout")
    void testSystems() {
        properties.getSystems().put("reliefweb", system("https://api.reliefweb.example"));
        properties.getSystems().put("gdacs", system(" "));
        properties.getSystems().put("hewsweb", system("ftp://hews.example"));
        AlertFrameworkProperties.ExternalSystem slow = system("http://slow.example");
        slow.setTimeout(Duration.ZERO);
        properties.getSystems().put("slow", slow);

        List<String> errors = validator.validateProperties();

        assertEquals(List.of(
            "alert-framework.systems.gdacs.base-url is not configured",
            "alert-framework.systems.hewsweb.base-url must be http(s): ftp://hews.example",
            "alert-framework.systems.slow.timeout must be positive"), errors);
    }

    @Test
    @DisplayName("Startup fails on invalid properties unless running the test profile")
    void testStartupFailure() {
        properties.getWorker().setQueueCapacity(-1);

        assertThrows(IllegalStateException.class, validator::validateConfiguration);

        ReflectionTestUtils.setField(validator, "activeProfile", "test");
        assertDoesNotThrow(validator::validateConfiguration);
    }

    // ========== Stored detectors ==========

    @Test
    @DisplayName("Stored detectors with invalid configuration are counted, not fatal")
    void testStoredDetectors() {
        Map<String, Object> good = new LinkedHashMap<>();
        good.put("variable_code", "rainfall");
        good.put("threshold_value", 100);
        store.save(DetectorConfig.builder().id("d1").name("Rain").type("threshold").configuration(good).build());
        store.save(DetectorConfig.builder().id("d2").name("Broken").type("threshold")
            .configuration(new LinkedHashMap<>()).build());
        store.save(DetectorConfig.builder().id("d3").name("Legacy").type("dataminr")
            .configuration(new LinkedHashMap<>()).build());

        assertEquals(2, validator.validateStoredDetectors());
        assertDoesNotThrow(validator::validateConfiguration);
    }

    @Test
    @DisplayName("Unreachable detector store does not block startup")
    void testStoreFailure() {
        DetectorConfigStore failing = mock(DetectorConfigStore.class);
        when(failing.findAll()).thenThrow(new DataAccessResourceFailureException("mongo down"));
        ConfigurationValidator offline = new ConfigurationValidator(properties, registry, failing);
        ReflectionTestUtils.setField(offline, "activeProfile", "default");

        assertEquals(0, offline.validateStoredDetectors());
        assertDoesNotThrow(offline::validateConfiguration);
    }
}
