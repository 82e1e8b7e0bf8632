package com.ewas.alerting.dedup;

import java.util.List;

/**
 * Administrative hierarchy lookup used by the geographic duplicate check.
 */
public interface LocationHierarchy {

    /**
     * Ids of all ancestors of a location, nearest parent first. Empty for a root or unknown location.
     *
     * @throws org.springframework.dao.DataAccessException when the hierarchy cannot be read
     */
    List<String> ancestorIds(String locationId);

    default boolean isAncestorOrDescendant(String first, String second) {
        if (first.equals(second)) {
            return false;
        }
        return ancestorIds(second).contains(first) || ancestorIds(first).contains(second);
    }
}
