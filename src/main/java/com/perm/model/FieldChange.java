package com.perm.model;

import com.perm.dates.IsoDates;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A single edit to a case date.
 *
 * @param field   Field being edited
 * @param value   New value, null to clear
 * @param entryId Target RFI/RFE entry; null addresses the active (first pending) entry, or a new one
 *                when none is pending. Response submissions always name their entry.
 */
public record FieldChange(DateField field, LocalDate value, String entryId) {

    public FieldChange {
        Objects.requireNonNull(field, "field");
    }

    public static FieldChange of(DateField field, LocalDate value) {
        return new FieldChange(field, value, null);
    }

    /**
     * Create a change from wire identifiers, e.g. {@code ("jobOrderStartDate", "2024-03-01")}.
     */
    public static FieldChange of(String field, String isoValue) {
        return new FieldChange(DateField.fromWireName(field), IsoDates.parseOptional(isoValue), null);
    }

    public static FieldChange cleared(DateField field) {
        return new FieldChange(field, null, null);
    }

    public static FieldChange forEntry(DateField field, String entryId, LocalDate value) {
        return new FieldChange(field, value, entryId);
    }
}
