package com.perm.dates;

import java.time.LocalDate;
import java.util.List;

/**
 * Source of non-working days other than weekends.
 * Implementations must be immutable so that identical inputs always produce identical results.
 */
public interface HolidayCalendar {

    /**
     * Check whether a date is an observed holiday.
     */
    boolean isHoliday(LocalDate date);

    /**
     * All observed holidays of a year, in date order.
     */
    List<FederalHoliday> holidaysOf(int year);
}
