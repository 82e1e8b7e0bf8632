package com.ewas.alerting.task;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * ISO-8601 trigger inputs. Offset-less values are read as UTC; a bare date is its start of day.
 */
public final class TimeInputs {

    private TimeInputs() {
    }

    /**
     * @return null for null or blank input
     * @throws IllegalArgumentException when the value is not ISO-8601
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException notOffset) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException notLocal) {
                try {
                    return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Not an ISO-8601 date or timestamp: " + value, e);
                }
            }
        }
    }
}
