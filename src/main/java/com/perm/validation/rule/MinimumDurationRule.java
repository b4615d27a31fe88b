package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Rule that checks a period lasts at least a number of calendar days.
 */
public class MinimumDurationRule extends AbstractRule {

    private final DateField start;
    private final DateField end;
    private final int minDays;

    public MinimumDurationRule(RuleId id, DateField start, DateField end, int minDays, String regulation) {
        super(id, regulation);
        this.start = start;
        this.end = end;
        this.minDays = minDays;
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        LocalDate startDate = facts.date(start);
        LocalDate endDate = facts.date(end);
        if (startDate == null || endDate == null) {
            return List.of();
        }
        long days = ChronoUnit.DAYS.between(startDate, endDate);
        if (days >= minDays) {
            return List.of();
        }
        return List.of(issue(end.wireName(), "Current: " + days + " days"));
    }
}
