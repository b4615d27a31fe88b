package com.perm.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Request for Information issued by the Department of Labor on an ETA 9089 filing.
 *
 * @param id                    Entry identifier
 * @param createdAt             Creation timestamp (epoch millis)
 * @param receivedDate          Date the request was received
 * @param responseDueDate       Date the response is due
 * @param responseSubmittedDate Date the response was submitted, null while pending
 */
public record RfiEntry(
        String id,
        long createdAt,
        LocalDate receivedDate,
        LocalDate responseDueDate,
        LocalDate responseSubmittedDate
) implements RequestEntry<RfiEntry> {

    public RfiEntry {
        Objects.requireNonNull(id, "id");
    }

    public static RfiEntry pending(String id, LocalDate receivedDate, LocalDate responseDueDate) {
        return new RfiEntry(id, 0L, receivedDate, responseDueDate, null);
    }

    @Override
    public RfiEntry withDate(DateField.EntryPart part, LocalDate value) {
        return switch (part) {
            case RECEIVED -> new RfiEntry(id, createdAt, value, responseDueDate, responseSubmittedDate);
            case RESPONSE_DUE -> new RfiEntry(id, createdAt, receivedDate, value, responseSubmittedDate);
            case RESPONSE_SUBMITTED -> new RfiEntry(id, createdAt, receivedDate, responseDueDate, value);
        };
    }
}
