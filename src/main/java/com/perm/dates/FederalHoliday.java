package com.perm.dates;

import java.time.LocalDate;

/**
 * A holiday as observed in a given year.
 *
 * @param name     Holiday name
 * @param observed Date the holiday is observed (after the weekend shift)
 */
public record FederalHoliday(String name, LocalDate observed) {
}
