package com.perm.constraint;

import java.time.LocalDate;

/**
 * Period during which ETA 9089 may be filed.
 *
 * @param opens      First allowed filing date (30 days after the last recruitment step)
 * @param closes     Last allowed filing date (180 days after the first step, or PWD expiration if earlier)
 * @param pwdLimited Whether PWD expiration truncated the window
 */
public record FilingWindow(LocalDate opens, LocalDate closes, boolean pwdLimited) {

    /**
     * A window that opens after it closes cannot be used.
     */
    public boolean isValid() {
        return !opens.isAfter(closes);
    }
}
