package com.ewas.alerting.config;

import com.ewas.alerting.task.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AlertFrameworkProperties - tunables of the detection pipeline.
 *
 * All values can be set via application.properties, e.g.:
 * alert-framework.worker.enabled=true
 * alert-framework.retry.run.max-retries=3
 * alert-framework.systems.reliefweb.base-url=https://...
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "alert-framework")
public class AlertFrameworkProperties {

    private Worker worker = new Worker();

    private Retry retry = new Retry();

    private Deduplication deduplication = new Deduplication();

    private Processing processing = new Processing();

    private Monitor monitor = new Monitor();

    private Scheduler scheduler = new Scheduler();

    private ModelCacheSettings modelCache = new ModelCacheSettings();

    private Trigger trigger = new Trigger();

    /**
     * External alert dissemination systems keyed by name.
     */
    private Map<String, ExternalSystem> systems = new LinkedHashMap<>();

    @Data
    public static class Worker {
        /**
         * When false every task runs synchronously on the caller thread.
         */
        private boolean enabled = true;
        private int poolSize = 4;
        private int queueCapacity = 100;
        private String threadPrefix = "alert-worker-";
    }

    @Data
    public static class Retry {
        private RetryPolicy run = new RetryPolicy(3, Duration.ofSeconds(60));
        private RetryPolicy publish = new RetryPolicy(3, Duration.ofSeconds(60));
        private RetryPolicy update = new RetryPolicy(2, Duration.ofSeconds(30));
        private RetryPolicy cancel = new RetryPolicy(2, Duration.ofSeconds(30));
    }

    @Data
    public static class Deduplication {
        /**
         * Half-width of the temporal proximity window.
         */
        private Duration temporalWindow = Duration.ofHours(6);

        /**
         * Minimum Jaccard overlap of location sets for a temporal match.
         */
        private double minLocationOverlap = 0.5;

        /**
         * Look-back for hierarchical (geographic) matches.
         */
        private Duration geographicWindow = Duration.ofDays(1);
    }

    @Data
    public static class Processing {
        private int maxPendingPerPass = 100;

        /**
         * Analysis window used when a run names no start date.
         */
        private Duration defaultLookback = Duration.ofDays(7);

        /**
         * Validity applied when a detector does not specify one.
         */
        private Duration defaultValidity = Duration.ofDays(7);
    }

    @Data
    public static class Monitor {
        private boolean enabled = true;
        private Duration lookback = Duration.ofHours(24);
        private long intervalMs = 900_000;
    }

    @Data
    public static class Scheduler {
        /**
         * Periodically run every active detector.
         */
        private boolean enabled = false;
        private long intervalMs = 3_600_000;
    }

    @Data
    public static class Trigger {
        /**
         * Run detectors when ingestion reports new data.
         */
        private boolean enabled = true;
        private Duration window = Duration.ofHours(1);
    }

    @Data
    public static class ModelCacheSettings {
        private long maximumSize = 8;
        private Duration expireAfterAccess = Duration.ofHours(12);

        /**
         * HTTP budget of remote scoring endpoints.
         */
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class ExternalSystem {
        private String baseUrl;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(30);
    }
}
