package com.perm.constraint;

import java.time.LocalDate;

/**
 * Legal bounds for one date field.
 *
 * @param min            Earliest allowed date (inclusive), null when unbounded or unknown
 * @param max            Latest allowed date (inclusive), null when unbounded or unknown
 * @param hint           Explanation of the bounds, or of what is missing to compute them
 * @param limitingFactor Condition that produced the tightest bound, null when neither applies
 */
public record DateConstraint(LocalDate min, LocalDate max, String hint, LimitingFactor limitingFactor) {

    public static DateConstraint unconstrained(String hint) {
        return new DateConstraint(null, null, hint, null);
    }

    public boolean hasBounds() {
        return min != null || max != null;
    }

    /**
     * Check whether a date lies within the bounds. Missing bounds do not restrict.
     */
    public boolean permits(LocalDate date) {
        return (min == null || !date.isBefore(min)) && (max == null || !date.isAfter(max));
    }
}
