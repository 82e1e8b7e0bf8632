package com.ewas.alerting.store;

import com.ewas.alerting.model.Location;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoLocationStore implements LocationStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Location> findById(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, Location.class));
    }

    @Override
    public List<Location> findAllById(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return mongoTemplate.find(new Query(Criteria.where("_id").in(ids)), Location.class);
    }
}
