package com.perm.constraint;

import com.perm.config.RulesConfig;
import com.perm.dates.DateArithmetic;
import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.RecruitmentMethodEntry;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

import static com.perm.dates.DateArithmetic.earliest;
import static com.perm.dates.DateArithmetic.latest;

/**
 * Derived recruitment dates shared by the resolver, the validators and the filing window.
 * <p>
 * Each recruitment step has a deadline that is the earlier of "N days after the first
 * recruitment step" and "M days before PWD expiration". Sunday ad deadlines are moved
 * back to the last Sunday on or before that date.
 */
public class RecruitmentTimeline {

    /**
     * Deadline rule of one recruitment field.
     */
    record StepRule(int daysAfterFirst, int daysBeforePwd, boolean sunday) {
    }

    private final DateArithmetic arithmetic;
    private final Map<DateField, StepRule> stepRules = new EnumMap<>(DateField.class);

    public RecruitmentTimeline(DateArithmetic arithmetic, RulesConfig config) {
        this.arithmetic = arithmetic;
        StepRule window = new StepRule(config.recruitmentWindowDays(), config.pwdRecruitmentBufferDays(), false);
        stepRules.put(DateField.NOTICE_OF_FILING_START_DATE, window);
        stepRules.put(DateField.ADDITIONAL_RECRUITMENT_START_DATE, window);
        stepRules.put(DateField.ADDITIONAL_RECRUITMENT_END_DATE, window);
        stepRules.put(DateField.JOB_ORDER_START_DATE,
                new StepRule(config.jobOrderStartDeadlineDays(), config.jobOrderPwdBufferDays(), false));
        stepRules.put(DateField.SUNDAY_AD_FIRST_DATE,
                new StepRule(config.firstSundayAdDeadlineDays(), config.firstSundayAdPwdBufferDays(), true));
        stepRules.put(DateField.SUNDAY_AD_SECOND_DATE,
                new StepRule(config.secondSundayAdDeadlineDays(), config.secondSundayAdPwdBufferDays(), true));
    }

    /**
     * Earliest recruitment start: first Sunday ad, job order start or notice start.
     */
    public LocalDate firstRecruitmentDate(CaseDateFacts facts) {
        LocalDate first = facts.date(DateField.SUNDAY_AD_FIRST_DATE);
        first = earliest(first, facts.date(DateField.JOB_ORDER_START_DATE));
        return earliest(first, facts.date(DateField.NOTICE_OF_FILING_START_DATE));
    }

    /**
     * Latest recruitment end: second Sunday ad, job order end or notice end, plus the
     * additional recruitment end and method dates for professional occupations.
     */
    public LocalDate lastRecruitmentDate(CaseDateFacts facts) {
        LocalDate last = facts.date(DateField.SUNDAY_AD_SECOND_DATE);
        last = latest(last, facts.date(DateField.JOB_ORDER_END_DATE));
        last = latest(last, facts.date(DateField.NOTICE_OF_FILING_END_DATE));
        if (facts.isProfessionalOccupation()) {
            last = latest(last, facts.date(DateField.ADDITIONAL_RECRUITMENT_END_DATE));
            for (RecruitmentMethodEntry entry : facts.getAdditionalRecruitmentMethods()) {
                last = latest(last, entry.date());
            }
        }
        return last;
    }

    /**
     * Whether a field has a recruitment deadline.
     */
    public boolean hasDeadline(DateField field) {
        return stepRules.containsKey(field);
    }

    public boolean isSundayField(DateField field) {
        StepRule rule = stepRules.get(field);
        return rule != null && rule.sunday();
    }

    /**
     * Deadline of a recruitment field.
     *
     * @return the tightest deadline, or null when neither a first recruitment date nor a PWD
     *         expiration is known, or the field has no recruitment deadline
     */
    public BoundedDate deadlineFor(DateField field, CaseDateFacts facts) {
        StepRule rule = stepRules.get(field);
        if (rule == null) {
            return null;
        }
        LocalDate first = firstRecruitmentDate(facts);
        LocalDate pwdExpiration = facts.date(DateField.PWD_EXPIRATION_DATE);

        LocalDate fromRecruitment = first == null ? null : align(first.plusDays(rule.daysAfterFirst()), rule);
        LocalDate fromPwd = pwdExpiration == null ? null : align(pwdExpiration.minusDays(rule.daysBeforePwd()), rule);
        return tighter(fromRecruitment, fromPwd);
    }

    /**
     * Latest date any recruitment step may take place: min(first + 150, PWD - 30).
     *
     * @return null until recruitment has started
     */
    public BoundedDate recruitmentWindowCloses(CaseDateFacts facts) {
        if (firstRecruitmentDate(facts) == null) {
            return null;
        }
        return deadlineFor(DateField.NOTICE_OF_FILING_START_DATE, facts);
    }

    public String describe(DateField field) {
        StepRule rule = stepRules.get(field);
        return rule == null ? "" : rule.daysAfterFirst() + " days from first recruitment or "
                + rule.daysBeforePwd() + " days before PWD expiration";
    }

    int daysAfterFirst(DateField field) {
        return stepRules.get(field).daysAfterFirst();
    }

    int daysBeforePwd(DateField field) {
        return stepRules.get(field).daysBeforePwd();
    }

    private LocalDate align(LocalDate date, StepRule rule) {
        return rule.sunday() ? arithmetic.nearestSundayOnOrBefore(date) : date;
    }

    /**
     * The earlier of a recruitment-derived and a PWD-derived deadline. Ties go to recruitment.
     */
    static BoundedDate tighter(LocalDate fromRecruitment, LocalDate fromPwd) {
        if (fromRecruitment != null && (fromPwd == null || !fromRecruitment.isAfter(fromPwd))) {
            return new BoundedDate(fromRecruitment, LimitingFactor.RECRUITMENT);
        }
        if (fromPwd != null) {
            return new BoundedDate(fromPwd, LimitingFactor.PWD);
        }
        return null;
    }
}
