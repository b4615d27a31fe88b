package com.perm.constraint;

import java.time.LocalDate;

/**
 * Optional inputs for constraint resolution.
 *
 * @param asOf    Reference day; fields that record past events are capped at it. Null disables the cap.
 * @param entryId RFI/RFE entry to resolve entry fields for; null selects the active entry
 */
public record ResolveOptions(LocalDate asOf, String entryId) {

    private static final ResolveOptions NONE = new ResolveOptions(null, null);

    public static ResolveOptions none() {
        return NONE;
    }

    public static ResolveOptions asOf(LocalDate asOf) {
        return new ResolveOptions(asOf, null);
    }

    public static ResolveOptions forEntry(String entryId) {
        return new ResolveOptions(null, entryId);
    }

    public ResolveOptions withAsOf(LocalDate date) {
        return new ResolveOptions(date, entryId);
    }
}
