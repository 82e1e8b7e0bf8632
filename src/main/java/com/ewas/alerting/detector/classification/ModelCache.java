package com.ewas.alerting.detector.classification;

import com.ewas.alerting.config.AlertFrameworkProperties;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Process-owned cache of loaded classification models, keyed by resolved model path.
 * Lives as long as the worker process; models are loaded once per path.
 */
@Slf4j
@Component
public class ModelCache {

    private final LoadingCache<String, ClassificationModel> models;

    @Autowired
    public ModelCache(ClassificationModelLoader loader, AlertFrameworkProperties properties) {
        this(loader, properties.getModelCache().getMaximumSize(), properties.getModelCache().getExpireAfterAccess());
    }

    public ModelCache(ClassificationModelLoader loader, long maximumSize, Duration expireAfterAccess) {
        this.models = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterAccess(expireAfterAccess)
            .build(path -> {
                log.info("[MODEL-CACHE] Loading model {}", path);
                return loader.load(path);
            });
    }

    public ClassificationModel get(String modelPath) {
        return models.get(resolve(modelPath));
    }

    public long size() {
        models.cleanUp();
        return models.estimatedSize();
    }

    public void invalidateAll() {
        models.invalidateAll();
    }

    /**
     * Canonical cache key: trimmed, without trailing slashes.
     */
    static String resolve(String modelPath) {
        if (modelPath == null || modelPath.isBlank()) {
            throw new IllegalArgumentException("Model path is required");
        }
        String resolved = modelPath.trim();
        while (resolved.length() > 1 && resolved.endsWith("/")) {
            resolved = resolved.substring(0, resolved.length() - 1);
        }
        return resolved;
    }
}
