package com.perm.dates;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Calendar-day and business-day arithmetic over civil dates.
 * <p>
 * A business day is any weekday that is not a holiday of the configured
 * {@link HolidayCalendar}. Arithmetic never fails for valid dates.
 */
public class DateArithmetic {

    private final HolidayCalendar holidays;

    public DateArithmetic(HolidayCalendar holidays) {
        this.holidays = Objects.requireNonNull(holidays, "holidays");
    }

    public HolidayCalendar getHolidays() {
        return holidays;
    }

    public LocalDate addCalendarDays(LocalDate date, int days) {
        return date.plusDays(days);
    }

    /**
     * Move a number of business days away from a date. The start date itself is not counted,
     * so adding 10 business days to a Monday lands on the Monday two weeks later when no
     * holiday intervenes. Negative values move backwards.
     *
     * @param date Start date (may itself be a weekend or holiday)
     * @param days Business days to add
     * @return the resulting business day, or {@code date} when {@code days} is zero
     */
    public LocalDate addBusinessDays(LocalDate date, int days) {
        int step = days < 0 ? -1 : 1;
        int remaining = Math.abs(days);
        LocalDate current = date;
        while (remaining > 0) {
            current = current.plusDays(step);
            if (isBusinessDay(current)) {
                remaining--;
            }
        }
        return current;
    }

    /**
     * Count business days in the half-open range {@code (start, end]}.
     *
     * @return the count, or 0 when {@code end} is not after {@code start}
     */
    public int countBusinessDays(LocalDate start, LocalDate end) {
        if (!end.isAfter(start)) {
            return 0;
        }
        int count = 0;
        for (LocalDate d = start.plusDays(1); !d.isAfter(end); d = d.plusDays(1)) {
            if (isBusinessDay(d)) {
                count++;
            }
        }
        return count;
    }

    /**
     * The date itself when it is a Sunday, otherwise the Sunday before it.
     */
    public LocalDate nearestSundayOnOrBefore(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
    }

    public boolean isSunday(LocalDate date) {
        return date.getDayOfWeek() == DayOfWeek.SUNDAY;
    }

    public boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public boolean isBusinessDay(LocalDate date) {
        return !isWeekend(date) && !holidays.isHoliday(date);
    }

    /**
     * Signed calendar days from {@code from} to {@code to}.
     */
    public long daysBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }

    /**
     * The earlier of two dates, ignoring nulls.
     */
    public static LocalDate earliest(LocalDate a, LocalDate b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    /**
     * The later of two dates, ignoring nulls.
     */
    public static LocalDate latest(LocalDate a, LocalDate b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
