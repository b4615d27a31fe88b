package com.perm.config;

import java.time.LocalDate;
import java.util.List;

/**
 * Immutable day-count thresholds and holiday additions used by every engine component.
 * <p>
 * One instance is built at startup and shared read-only by all callers.
 *
 * @param filingWindowWaitDays        days after the last recruitment step before ETA 9089 may be filed
 * @param filingWindowCloseDays       days after the first recruitment step after which ETA 9089 may no longer be filed
 * @param recruitmentWindowDays       days after the first recruitment step by which recruitment must finish
 * @param pwdRecruitmentBufferDays    days before PWD expiration by which recruitment must finish
 * @param jobOrderStartDeadlineDays   days after the first recruitment step by which the job order must start
 * @param jobOrderPwdBufferDays       days before PWD expiration by which the job order must start
 * @param firstSundayAdDeadlineDays   days after the first recruitment step by which the first Sunday ad must run
 * @param firstSundayAdPwdBufferDays  days before PWD expiration by which the first Sunday ad must run
 * @param sundayAdGapDays             minimum days between the first and second Sunday ads
 * @param jobOrderMinDays             minimum job order duration in calendar days
 * @param noticeMinBusinessDays       minimum notice-of-filing posting in business days
 * @param pwdValidityYears            PWD validity after determination
 * @param eta9089ValidityDays         ETA 9089 certification validity in days
 * @param rfiResponseDays             days allowed to answer an RFI
 * @param minProfessionalMethods      distinct additional recruitment methods for professional occupations
 * @param extraHolidays               closure dates treated as non-business days in addition to federal holidays
 */
public record RulesConfig(
        int filingWindowWaitDays,
        int filingWindowCloseDays,
        int recruitmentWindowDays,
        int pwdRecruitmentBufferDays,
        int jobOrderStartDeadlineDays,
        int jobOrderPwdBufferDays,
        int firstSundayAdDeadlineDays,
        int firstSundayAdPwdBufferDays,
        int sundayAdGapDays,
        int jobOrderMinDays,
        int noticeMinBusinessDays,
        int pwdValidityYears,
        int eta9089ValidityDays,
        int rfiResponseDays,
        int minProfessionalMethods,
        List<LocalDate> extraHolidays
) {
    public RulesConfig {
        extraHolidays = extraHolidays == null ? List.of() : List.copyOf(extraHolidays);
    }

    /**
     * Regulatory defaults (20 CFR 656).
     */
    public static RulesConfig defaults() {
        return new RulesConfig(30, 180, 150, 30, 120, 60, 143, 37, 7, 30, 10, 1, 180, 30, 3, List.of());
    }

    /**
     * Days after the first recruitment step by which the second Sunday ad must run.
     * Same as the recruitment window.
     */
    public int secondSundayAdDeadlineDays() {
        return recruitmentWindowDays;
    }

    /**
     * Days before PWD expiration by which the second Sunday ad must run.
     */
    public int secondSundayAdPwdBufferDays() {
        return pwdRecruitmentBufferDays;
    }

    /**
     * Days after certification within which the I-140 must be filed.
     */
    public int i140FilingWindowDays() {
        return eta9089ValidityDays;
    }
}
