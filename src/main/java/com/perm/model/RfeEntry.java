package com.perm.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Request for Evidence issued by USCIS on an I-140 petition.
 *
 * @param id                    Entry identifier
 * @param createdAt             Creation timestamp (epoch millis)
 * @param receivedDate          Date the request was received
 * @param responseDueDate       Date the response is due
 * @param responseSubmittedDate Date the response was submitted, null while pending
 */
public record RfeEntry(
        String id,
        long createdAt,
        LocalDate receivedDate,
        LocalDate responseDueDate,
        LocalDate responseSubmittedDate
) implements RequestEntry<RfeEntry> {

    public RfeEntry {
        Objects.requireNonNull(id, "id");
    }

    public static RfeEntry pending(String id, LocalDate receivedDate, LocalDate responseDueDate) {
        return new RfeEntry(id, 0L, receivedDate, responseDueDate, null);
    }

    @Override
    public RfeEntry withDate(DateField.EntryPart part, LocalDate value) {
        return switch (part) {
            case RECEIVED -> new RfeEntry(id, createdAt, value, responseDueDate, responseSubmittedDate);
            case RESPONSE_DUE -> new RfeEntry(id, createdAt, receivedDate, value, responseSubmittedDate);
            case RESPONSE_SUBMITTED -> new RfeEntry(id, createdAt, receivedDate, responseDueDate, value);
        };
    }
}
