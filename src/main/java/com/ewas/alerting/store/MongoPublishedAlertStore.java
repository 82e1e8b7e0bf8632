package com.ewas.alerting.store;

import com.ewas.alerting.model.PublicationStatus;
import com.ewas.alerting.model.PublishedAlert;
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
public class MongoPublishedAlertStore implements PublishedAlertStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public PublishedAlert save(PublishedAlert publishedAlert) {
        if (publishedAlert.getCreatedAt() == null) {
            publishedAlert.setCreatedAt(Instant.now());
        }
        return mongoTemplate.save(publishedAlert);
    }

    @Override
    public Optional<PublishedAlert> findById(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, PublishedAlert.class));
    }

    @Override
    public Optional<PublishedAlert> find(String detectionId, String externalSystem, String language) {
        Query query = new Query(Criteria.where("detectionId").is(detectionId)
            .and("externalSystem").is(externalSystem)
            .and("language").is(language));
        return Optional.ofNullable(mongoTemplate.findOne(query, PublishedAlert.class));
    }

    @Override
    public List<PublishedAlert> findByDetectionId(String detectionId) {
        return mongoTemplate.find(new Query(Criteria.where("detectionId").is(detectionId)), PublishedAlert.class);
    }

    @Override
    public List<PublishedAlert> findLiveSince(Instant since) {
        Query query = new Query(Criteria.where("status").in(PublicationStatus.PUBLISHED, PublicationStatus.UPDATED)
            .and("externalId").ne(null)
            .and("publishedAt").gte(since))
            .with(Sort.by(Sort.Direction.DESC, "publishedAt"));
        return mongoTemplate.find(query, PublishedAlert.class);
    }
}
