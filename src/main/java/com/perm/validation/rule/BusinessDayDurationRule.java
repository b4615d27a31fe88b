package com.perm.validation.rule;

import com.perm.dates.DateArithmetic;
import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.time.LocalDate;
import java.util.List;

/**
 * Rule that checks a posting period covers a number of business days.
 * <p>
 * In short-period mode it only flags periods that are non-empty but too short.
 */
public class BusinessDayDurationRule extends AbstractRule {

    private final DateField start;
    private final DateField end;
    private final int minBusinessDays;
    private final boolean shortPeriodOnly;
    private final DateArithmetic arithmetic;

    public BusinessDayDurationRule(RuleId id, DateField start, DateField end, int minBusinessDays,
                                   boolean shortPeriodOnly, DateArithmetic arithmetic, String regulation) {
        super(id, regulation);
        this.start = start;
        this.end = end;
        this.minBusinessDays = minBusinessDays;
        this.shortPeriodOnly = shortPeriodOnly;
        this.arithmetic = arithmetic;
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        LocalDate startDate = facts.date(start);
        LocalDate endDate = facts.date(end);
        if (startDate == null || endDate == null) {
            return List.of();
        }
        int businessDays = arithmetic.countBusinessDays(startDate, endDate);
        boolean violated = shortPeriodOnly
                ? businessDays > 0 && businessDays < minBusinessDays
                : businessDays < minBusinessDays;
        if (!violated) {
            return List.of();
        }
        return List.of(issue(end.wireName(), "Current: " + businessDays
                + " business days, minimum " + minBusinessDays));
    }
}
