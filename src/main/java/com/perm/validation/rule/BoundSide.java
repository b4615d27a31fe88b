package com.perm.validation.rule;

import java.time.LocalDate;

/**
 * How a date must relate to a bound.
 */
public enum BoundSide {
    /** Strictly after the bound. */
    AFTER("after"),
    /** On or after the bound. */
    NOT_BEFORE("on or after"),
    /** On or before the bound. */
    NOT_AFTER("on or before");

    private final String phrase;

    BoundSide(String phrase) {
        this.phrase = phrase;
    }

    public boolean holds(LocalDate date, LocalDate bound) {
        return switch (this) {
            case AFTER -> date.isAfter(bound);
            case NOT_BEFORE -> !date.isBefore(bound);
            case NOT_AFTER -> !date.isAfter(bound);
        };
    }

    public String phrase() {
        return phrase;
    }
}
