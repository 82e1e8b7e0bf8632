package com.ewas.alerting.store;

import com.ewas.alerting.model.Alert;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoAlertStore implements AlertStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public Alert save(Alert alert) {
        if (alert.getCreatedAt() == null) {
            alert.setCreatedAt(Instant.now());
        }
        return mongoTemplate.save(alert);
    }

    @Override
    public Optional<Alert> findByDetectionId(String detectionId) {
        Query query = new Query(Criteria.where("detectionId").is(detectionId));
        return Optional.ofNullable(mongoTemplate.findOne(query, Alert.class));
    }
}
