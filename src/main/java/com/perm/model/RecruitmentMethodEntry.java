package com.perm.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One additional recruitment step of a professional-occupation case.
 *
 * @param method      Recruitment method
 * @param date        Date the step was taken (may be unset while drafting)
 * @param description Free-text details
 */
public record RecruitmentMethodEntry(RecruitmentMethod method, LocalDate date, String description) {

    public RecruitmentMethodEntry {
        Objects.requireNonNull(method, "method");
    }

    public static RecruitmentMethodEntry of(RecruitmentMethod method, LocalDate date) {
        return new RecruitmentMethodEntry(method, date, null);
    }
}
