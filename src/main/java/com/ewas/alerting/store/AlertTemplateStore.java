package com.ewas.alerting.store;

import com.ewas.alerting.model.AlertTemplate;

import java.util.List;
import java.util.Optional;

public interface AlertTemplateStore {

    Optional<AlertTemplate> findById(String id);

    /**
     * Active templates for a category, including those bound to no detector type.
     */
    List<AlertTemplate> findActiveByCategory(String category);
}
