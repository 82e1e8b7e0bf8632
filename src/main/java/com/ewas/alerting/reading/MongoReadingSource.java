package com.ewas.alerting.reading;

import com.ewas.alerting.model.Reading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class MongoReadingSource implements ReadingSource {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<Reading> getReadings(String variableCode, Instant start, Instant end,
                                     Collection<String> locationIds, Integer adminLevel) {
        List<Criteria> filters = new ArrayList<>();
        filters.add(Criteria.where("variableCode").is(variableCode));
        // A reading belongs to the window when its period overlaps it
        if (start != null) {
            filters.add(new Criteria().orOperator(
                Criteria.where("endDate").gte(start),
                new Criteria().andOperator(Criteria.where("endDate").is(null), Criteria.where("startDate").gte(start))));
        }
        if (end != null) {
            filters.add(Criteria.where("startDate").lte(end));
        }
        if (locationIds != null && !locationIds.isEmpty()) {
            filters.add(Criteria.where("locationId").in(locationIds));
        }
        if (adminLevel != null) {
            filters.add(Criteria.where("adminLevel").is(adminLevel));
        }

        boolean windowed = start != null || end != null;
        Query query = new Query(new Criteria().andOperator(filters.toArray(new Criteria[0])))
            .with(Sort.by(windowed ? Sort.Direction.ASC : Sort.Direction.DESC, "startDate"));

        List<Reading> readings = mongoTemplate.find(query, Reading.class);
        log.debug("[READINGS] variable={} window=[{}, {}] adminLevel={} -> {} readings",
            variableCode, start, end, adminLevel, readings.size());
        return readings;
    }
}
