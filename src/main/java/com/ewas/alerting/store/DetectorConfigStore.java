package com.ewas.alerting.store;

import com.ewas.alerting.model.DetectorConfig;

import java.util.List;
import java.util.Optional;

public interface DetectorConfigStore {

    Optional<DetectorConfig> findById(String id);

    List<DetectorConfig> findAll();

    List<DetectorConfig> findActive();

    DetectorConfig save(DetectorConfig config);
}
