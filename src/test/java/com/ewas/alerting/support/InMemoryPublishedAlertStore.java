package com.ewas.alerting.support;

import com.ewas.alerting.model.PublishedAlert;
import com.ewas.alerting.store.PublishedAlertStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class InMemoryPublishedAlertStore implements PublishedAlertStore {

    private final Map<String, PublishedAlert> records = new LinkedHashMap<>();

    @Override
    public synchronized PublishedAlert save(PublishedAlert publishedAlert) {
        if (publishedAlert.getId() == null) {
            publishedAlert.setId("pub-" + (records.size() + 1));
        }
        records.put(publishedAlert.getId(), publishedAlert);
        return publishedAlert;
    }

    @Override
    public synchronized Optional<PublishedAlert> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized Optional<PublishedAlert> find(String detectionId, String externalSystem, String language) {
        return records.values().stream()
            .filter(r -> detectionId.equals(r.getDetectionId()))
            .filter(r -> externalSystem.equals(r.getExternalSystem()))
            .filter(r -> language.equals(r.getLanguage()))
            .findFirst();
    }

    @Override
    public synchronized List<PublishedAlert> findByDetectionId(String detectionId) {
        return records.values().stream()
            .filter(r -> detectionId.equals(r.getDetectionId()))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<PublishedAlert> findLiveSince(Instant since) {
        return records.values().stream()
            .filter(r -> r.getStatus().isLive())
            .filter(r -> r.getExternalId() != null)
            .filter(r -> r.getPublishedAt() != null && !r.getPublishedAt().isBefore(since))
            .collect(Collectors.toList());
    }

    public synchronized List<PublishedAlert> all() {
        return new ArrayList<>(records.values());
    }
}
