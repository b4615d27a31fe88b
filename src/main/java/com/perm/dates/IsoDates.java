package com.perm.dates;

import com.perm.exception.MalformedDateException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Conversion between ISO {@code YYYY-MM-DD} strings and civil dates.
 * Dates carry no time of day and no zone.
 */
public final class IsoDates {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private IsoDates() {
    }

    /**
     * Parse a date string.
     *
     * @param value ISO date string, e.g. {@code 2024-01-15}
     * @return the civil date
     * @throws MalformedDateException if the value is null, not in YYYY-MM-DD form, or not a real date
     */
    public static LocalDate parse(String value) {
        if (value == null) {
            throw new MalformedDateException("null");
        }
        try {
            return LocalDate.parse(value.trim(), FORMAT);
        } catch (DateTimeParseException e) {
            throw new MalformedDateException(value, e);
        }
    }

    /**
     * Parse an optional date string. Null and blank values mean "not set".
     */
    public static LocalDate parseOptional(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return parse(value);
    }

    /**
     * Format a date, or return null when there is none.
     */
    public static String format(LocalDate date) {
        return date == null ? null : date.format(FORMAT);
    }
}
