package com.ewas.alerting.store;

import com.ewas.alerting.model.AlertTemplate;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoAlertTemplateStore implements AlertTemplateStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<AlertTemplate> findById(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, AlertTemplate.class));
    }

    @Override
    public List<AlertTemplate> findActiveByCategory(String category) {
        Query query = new Query(Criteria.where("active").is(true).and("category").is(category))
            .with(Sort.by("name"));
        return mongoTemplate.find(query, AlertTemplate.class);
    }
}
