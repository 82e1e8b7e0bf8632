package com.ewas.alerting.store;

import com.ewas.alerting.model.Location;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface LocationStore {

    Optional<Location> findById(String id);

    List<Location> findAllById(Collection<String> ids);
}
