package com.ewas.alerting.store;

import com.ewas.alerting.model.DetectorConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoDetectorConfigStore implements DetectorConfigStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<DetectorConfig> findById(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, DetectorConfig.class));
    }

    @Override
    public List<DetectorConfig> findAll() {
        return mongoTemplate.find(new Query().with(Sort.by("name")), DetectorConfig.class);
    }

    @Override
    public List<DetectorConfig> findActive() {
        Query query = new Query(Criteria.where("active").is(true)).with(Sort.by("name"));
        return mongoTemplate.find(query, DetectorConfig.class);
    }

    @Override
    public DetectorConfig save(DetectorConfig config) {
        if (config.getCreatedAt() == null) {
            config.setCreatedAt(Instant.now());
        }
        return mongoTemplate.save(config);
    }
}
