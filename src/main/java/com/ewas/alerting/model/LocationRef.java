package com.ewas.alerting.model;

import java.util.Objects;

/**
 * Reference to an administrative location as emitted by detectors.
 * Equality is by id only; name and admin level are descriptive.
 */
public record LocationRef(String id, String name, Integer adminLevel) {

    public LocationRef {
        Objects.requireNonNull(id, "location id");
    }

    public static LocationRef of(String id) {
        return new LocationRef(id, null, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocationRef other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
