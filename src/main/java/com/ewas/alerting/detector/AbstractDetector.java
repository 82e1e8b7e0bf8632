package com.ewas.alerting.detector;

import com.ewas.alerting.model.Detection;
import com.ewas.alerting.model.DetectionCandidate;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.model.Reading;
import com.ewas.alerting.reading.ReadingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base class of the built-in detectors.
 *
 * The default {@link #detect} loads readings and evaluates them one by one, so a
 * failing record only costs that record. Alert-shaping hooks carry the generic
 * defaults: severity from confidence, the context's default validity, the detector name as source.
 *
 * @param <C> typed settings bound from the stored configuration
 */
public abstract class AbstractDetector<C> implements Detector {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final DetectorConfig config;
    protected final C settings;
    protected final ReadingSource readingSource;
    protected final Clock clock;
    protected final Duration defaultValidity;

    protected AbstractDetector(DetectorConfig config, C settings, DetectorContext context) {
        this.config = config;
        this.settings = settings;
        this.readingSource = context.readingSource();
        this.clock = context.clock();
        this.defaultValidity = context.defaultValidity();
    }

    @Override
    public String name() {
        return config.getName();
    }

    public C settings() {
        return settings;
    }

    /**
     * Fetch the readings this detector scans for a window.
     */
    protected abstract List<Reading> loadData(Instant start, Instant end);

    /**
     * Evaluate a single reading; empty when it does not fire.
     */
    protected Optional<DetectionCandidate> evaluate(Reading reading) {
        return Optional.empty();
    }

    @Override
    public List<DetectionCandidate> detect(Instant start, Instant end) {
        List<Reading> readings = loadData(start, end);
        log.info("[DETECTOR-RUN] {} ({}) scanning {} readings in [{}, {}]", name(), type(), readings.size(), start, end);

        List<DetectionCandidate> candidates = new ArrayList<>();
        int skipped = 0;
        for (Reading reading : readings) {
            try {
                evaluate(reading).ifPresent(candidates::add);
            } catch (RuntimeException e) {
                skipped++;
                log.warn("[DETECTOR-RUN] {} skipped reading {}: {}", name(), reading.getId(), e.getMessage());
            }
        }

        log.info("[DETECTOR-RUN] {} completed: candidates={}, processed={}, skipped={}",
            name(), candidates.size(), readings.size(), skipped);
        return candidates;
    }

    @Override
    public int calculateSeverity(Detection detection) {
        Double confidence = detection.getConfidenceScore();
        if (confidence == null) {
            return 3;
        }
        if (confidence >= 0.8) {
            return 4;
        } else if (confidence >= 0.6) {
            return 3;
        } else if (confidence >= 0.4) {
            return 2;
        }
        return 1;
    }

    @Override
    public Map<String, Object> templateContext(Detection detection) {
        return new LinkedHashMap<>();
    }

    @Override
    public String dataSourceReference(Detection detection) {
        return name();
    }

    @Override
    public Duration validityPeriod(Detection detection) {
        return defaultValidity;
    }

    protected static Object detailValue(Detection detection, String key) {
        return detection.getDetail() == null ? null : detection.getDetail().get(key);
    }

    protected static Double detailNumber(Detection detection, String key) {
        Object value = detailValue(detection, key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    protected static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
