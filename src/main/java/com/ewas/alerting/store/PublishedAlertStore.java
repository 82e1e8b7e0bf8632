package com.ewas.alerting.store;

import com.ewas.alerting.model.PublishedAlert;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PublishedAlertStore {

    PublishedAlert save(PublishedAlert publishedAlert);

    Optional<PublishedAlert> findById(String id);

    Optional<PublishedAlert> find(String detectionId, String externalSystem, String language);

    List<PublishedAlert> findByDetectionId(String detectionId);

    /**
     * Live publications (published or updated) with an external id, published at or after the instant.
     */
    List<PublishedAlert> findLiveSince(Instant since);
}
