package com.perm.validation.rule;

import com.perm.dates.DateArithmetic;
import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;

/**
 * Rule that checks a newspaper ad date falls on a Sunday.
 */
public class SundayRule extends AbstractRule {

    private final DateField field;
    private final DateArithmetic arithmetic;

    public SundayRule(RuleId id, DateField field, DateArithmetic arithmetic, String regulation) {
        super(id, regulation);
        this.field = field;
        this.arithmetic = arithmetic;
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        LocalDate date = facts.date(field);
        if (date == null || arithmetic.isSunday(date)) {
            return List.of();
        }
        return List.of(issue(field.wireName(), date + " is a "
                + date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.US)));
    }
}
