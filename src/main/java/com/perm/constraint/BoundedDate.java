package com.perm.constraint;

import java.time.LocalDate;

/**
 * A computed deadline together with the condition that set it.
 *
 * @param date           The deadline
 * @param limitingFactor Which candidate won
 */
public record BoundedDate(LocalDate date, LimitingFactor limitingFactor) {

    public boolean isPwdLimited() {
        return limitingFactor == LimitingFactor.PWD;
    }
}
