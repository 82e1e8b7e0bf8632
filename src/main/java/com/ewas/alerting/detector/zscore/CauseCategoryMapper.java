package com.ewas.alerting.detector.zscore;

import java.util.Locale;

/**
 * Maps a free-text displacement cause to a category. Conflict wins over natural disaster,
 * which wins over economic causes; anything else falls back to the default category.
 */
public class CauseCategoryMapper {

    public static final String CONFLICT = "Conflict";
    public static final String NATURAL_DISASTERS = "Natural disasters";
    public static final String FOOD_SECURITY = "Food security";

    private final String defaultCategory;

    public CauseCategoryMapper(String defaultCategory) {
        this.defaultCategory = defaultCategory;
    }

    public String categoryFor(String cause) {
        if (cause == null || cause.isBlank()) {
            return defaultCategory;
        }
        String lower = cause.toLowerCase(Locale.ROOT).trim();
        if (lower.contains("conflict")) {
            return CONFLICT;
        } else if (lower.contains("natural disaster")) {
            return NATURAL_DISASTERS;
        } else if (lower.contains("economic")) {
            return FOOD_SECURITY;
        }
        return defaultCategory;
    }

    /**
     * Normalize a raw cause reading; unspecified reasons become "Unknown".
     */
    public static String normalizeCause(String text) {
        if (text == null || text.isBlank()) {
            return "Unknown";
        }
        String reason = text.trim();
        String lower = reason.toLowerCase(Locale.ROOT);
        if (lower.equals("no reason for displacement reported") || lower.equals("other reason")) {
            return "Unknown";
        }
        return reason;
    }
}
