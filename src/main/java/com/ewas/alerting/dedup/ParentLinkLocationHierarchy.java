package com.ewas.alerting.dedup;

import com.ewas.alerting.model.Location;
import com.ewas.alerting.store.LocationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks Location.parentId links.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParentLinkLocationHierarchy implements LocationHierarchy {

    // Country -> admin1 -> admin2 -> admin3 with headroom
    private static final int MAX_DEPTH = 10;

    private final LocationStore locationStore;

    @Override
    public List<String> ancestorIds(String locationId) {
        List<String> ancestors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(locationId);

        Optional<Location> current = locationStore.findById(locationId);
        while (current.isPresent() && current.get().getParentId() != null && ancestors.size() < MAX_DEPTH) {
            String parentId = current.get().getParentId();
            if (!seen.add(parentId)) {
                log.warn("[HIERARCHY] Cycle detected at location {} while walking from {}", parentId, locationId);
                break;
            }
            ancestors.add(parentId);
            current = locationStore.findById(parentId);
        }
        return ancestors;
    }
}
