package com.perm.model;

import java.time.LocalDate;

/**
 * An agency request (RFI from DOL, RFE from USCIS) awaiting a response.
 * <p>
 * An entry is pending until its response is submitted; once submitted it never reverts.
 *
 * @param <T> concrete entry type
 */
public interface RequestEntry<T extends RequestEntry<T>> {

    String id();

    /**
     * Creation timestamp (epoch millis).
     */
    long createdAt();

    LocalDate receivedDate();

    LocalDate responseDueDate();

    LocalDate responseSubmittedDate();

    /**
     * Copy of this entry with one date slot replaced.
     */
    T withDate(DateField.EntryPart part, LocalDate value);

    default boolean isPending() {
        return responseSubmittedDate() == null;
    }

    default LocalDate date(DateField.EntryPart part) {
        return switch (part) {
            case RECEIVED -> receivedDate();
            case RESPONSE_DUE -> responseDueDate();
            case RESPONSE_SUBMITTED -> responseSubmittedDate();
        };
    }
}
