package com.perm.dates;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * US federal holiday calendar computed from rules (5 U.S.C. 6103).
 * <p>
 * Fixed-date holidays falling on a Saturday are observed on the preceding Friday,
 * those falling on a Sunday on the following Monday. Inauguration Day (January 20,
 * every fourth year from 2021) is included for the D.C. area. Extra closure dates
 * supplied at construction are treated as holidays too.
 * <p>
 * Instances are immutable; per-year results are memoized.
 */
public class FederalHolidayCalendar implements HolidayCalendar {

    private static final Logger log = LoggerFactory.getLogger(FederalHolidayCalendar.class);

    private static final int FIRST_INAUGURATION_YEAR = 2021;

    private final Set<LocalDate> extraHolidays;
    private final Map<Integer, List<FederalHoliday>> byYear = new ConcurrentHashMap<>();

    public FederalHolidayCalendar() {
        this(List.of());
    }

    public FederalHolidayCalendar(Collection<LocalDate> extraHolidays) {
        this.extraHolidays = Set.copyOf(extraHolidays);
        if (!this.extraHolidays.isEmpty()) {
            log.info("Holiday calendar created with {} extra closure dates", this.extraHolidays.size());
        }
    }

    @Override
    public boolean isHoliday(LocalDate date) {
        if (extraHolidays.contains(date)) {
            return true;
        }
        // New Year's Day on a Saturday is observed on December 31 of the previous year
        return contains(holidaysOf(date.getYear()), date)
                || (date.getMonth() == Month.DECEMBER && contains(holidaysOf(date.getYear() + 1), date));
    }

    @Override
    public List<FederalHoliday> holidaysOf(int year) {
        return byYear.computeIfAbsent(year, FederalHolidayCalendar::computeYear);
    }

    private static boolean contains(List<FederalHoliday> holidays, LocalDate date) {
        for (FederalHoliday holiday : holidays) {
            if (holiday.observed().equals(date)) {
                return true;
            }
        }
        return false;
    }

    private static List<FederalHoliday> computeYear(int year) {
        List<FederalHoliday> holidays = new ArrayList<>();

        holidays.add(fixed("New Year", year, Month.JANUARY, 1));
        holidays.add(fixed("Juneteenth", year, Month.JUNE, 19));
        holidays.add(fixed("Independence Day", year, Month.JULY, 4));
        holidays.add(fixed("Veterans Day", year, Month.NOVEMBER, 11));
        holidays.add(fixed("Christmas", year, Month.DECEMBER, 25));

        holidays.add(nth("MLK Day", year, Month.JANUARY, DayOfWeek.MONDAY, 3));
        holidays.add(nth("Presidents Day", year, Month.FEBRUARY, DayOfWeek.MONDAY, 3));
        holidays.add(new FederalHoliday("Memorial Day",
                LocalDate.of(year, Month.MAY, 1).with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY))));
        holidays.add(nth("Labor Day", year, Month.SEPTEMBER, DayOfWeek.MONDAY, 1));
        holidays.add(nth("Columbus Day", year, Month.OCTOBER, DayOfWeek.MONDAY, 2));
        holidays.add(nth("Thanksgiving", year, Month.NOVEMBER, DayOfWeek.THURSDAY, 4));

        if (year >= FIRST_INAUGURATION_YEAR && (year - FIRST_INAUGURATION_YEAR) % 4 == 0) {
            holidays.add(fixed("Inauguration Day", year, Month.JANUARY, 20));
        }

        holidays.sort(Comparator.comparing(FederalHoliday::observed));
        return List.copyOf(holidays);
    }

    private static FederalHoliday fixed(String name, int year, Month month, int day) {
        return new FederalHoliday(name, observed(LocalDate.of(year, month, day)));
    }

    private static FederalHoliday nth(String name, int year, Month month, DayOfWeek dayOfWeek, int ordinal) {
        return new FederalHoliday(name,
                LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(ordinal, dayOfWeek)));
    }

    static LocalDate observed(LocalDate actual) {
        return switch (actual.getDayOfWeek()) {
            case SATURDAY -> actual.minusDays(1);
            case SUNDAY -> actual.plusDays(1);
            default -> actual;
        };
    }
}
