package com.ewas.alerting.detector.scoring;

import com.ewas.alerting.model.Reading;

import java.util.List;
import java.util.Map;

/**
 * Resolves field paths against a reading's raw payload.
 *
 * Paths use dot notation with optional list indexing ({@code estimatedEventLocation[0].name}).
 * A top-level key holding a list resolves to the whole list. Two pseudo-fields read the
 * reading itself: {@value #TEXT_FALLBACK} and {@value #LOCATION_FALLBACK}.
 */
final class FieldPaths {

    static final String TEXT_FALLBACK = "text_fallback";
    static final String LOCATION_FALLBACK = "location_fallback";

    private FieldPaths() {
    }

    static Object resolve(Reading reading, String path) {
        if (TEXT_FALLBACK.equals(path)) {
            return reading.getText() == null ? "" : reading.getText();
        }
        if (LOCATION_FALLBACK.equals(path)) {
            return reading.getLocationName() == null ? "" : reading.getLocationName();
        }
        Map<String, Object> raw = reading.getRawPayload() == null ? Map.of() : reading.getRawPayload();
        if (raw.get(path) instanceof List<?> list) {
            return list;
        }

        Object current = raw;
        for (String part : path.split("\\.")) {
            int bracket = part.indexOf('[');
            String key = bracket >= 0 ? part.substring(0, bracket) : part;
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(key)) {
                return null;
            }
            current = map.get(key);
            if (bracket >= 0) {
                if (!(current instanceof List<?> list)) {
                    return null;
                }
                int index;
                try {
                    index = Integer.parseInt(part.substring(bracket + 1, part.indexOf(']', bracket)));
                } catch (NumberFormatException | StringIndexOutOfBoundsException e) {
                    return null;
                }
                current = index >= 0 && index < list.size() ? list.get(index) : null;
            }
        }
        return current;
    }

    static String asText(Object value) {
        return String.valueOf(value);
    }

    static Double asNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Short key for a path: its last segment without indexing.
     */
    static String simpleName(String path) {
        String last = path.substring(path.lastIndexOf('.') + 1);
        int bracket = last.indexOf('[');
        return bracket >= 0 ? last.substring(0, bracket) : last;
    }
}
