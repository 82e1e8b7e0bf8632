package com.ewas.alerting.store;

import com.ewas.alerting.model.Detection;
import com.ewas.alerting.model.DetectionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB store for detections. The detail payload is stored as an embedded document, keys untouched.
 */
@Component
@RequiredArgsConstructor
public class MongoDetectionStore implements DetectionStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public Detection save(Detection detection) {
        if (detection.getCreatedAt() == null) {
            detection.setCreatedAt(Instant.now());
        }
        return mongoTemplate.save(detection);
    }

    @Override
    public Optional<Detection> findById(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, Detection.class));
    }

    @Override
    public List<Detection> findPendingOriginals(String detectorId, Instant from, Instant to) {
        Criteria window = Criteria.where("eventTimestamp").gte(from);
        if (to != null) {
            window = window.lte(to);
        }
        Query query = new Query(Criteria.where("detectorId").is(detectorId)
            .and("status").is(DetectionStatus.PENDING)
            .and("duplicateOf").is(null)
            .andOperator(window))
            .with(Sort.by(Sort.Direction.ASC, "createdAt"));
        return mongoTemplate.find(query, Detection.class);
    }

    @Override
    public List<Detection> findPendingForProcessing(int limit) {
        Query query = new Query(Criteria.where("status").is(DetectionStatus.PENDING)
            .and("duplicateOf").is(null))
            .with(Sort.by(Sort.Direction.ASC, "createdAt"))
            .limit(limit);
        return mongoTemplate.find(query, Detection.class);
    }
}
