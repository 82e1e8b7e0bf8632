package com.ewas.alerting.store;

import com.ewas.alerting.model.Alert;

import java.util.Optional;

public interface AlertStore {

    Alert save(Alert alert);

    Optional<Alert> findByDetectionId(String detectionId);
}
