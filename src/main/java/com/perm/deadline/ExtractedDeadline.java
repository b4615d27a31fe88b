package com.perm.deadline;

import java.time.LocalDate;

/**
 * An active, dated deadline of a case as of a given day.
 *
 * @param type      Deadline type
 * @param label     Display label
 * @param date      Deadline date
 * @param daysUntil Days from the reference day to the deadline, negative when overdue
 * @param entryId   RFI/RFE entry the deadline belongs to, null for case deadlines
 */
public record ExtractedDeadline(DeadlineType type, String label, LocalDate date, long daysUntil, String entryId) {

    public boolean isOverdue() {
        return daysUntil < 0;
    }
}
