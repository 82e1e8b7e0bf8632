package com.ewas.alerting.dedup;

/**
 * Heuristic that recognized a detection as a duplicate, in evaluation order.
 */
public enum DuplicateMatch {
    EXACT,
    TEMPORAL,
    GEOGRAPHIC
}
