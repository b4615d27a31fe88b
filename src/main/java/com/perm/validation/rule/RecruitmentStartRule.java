package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.time.LocalDate;
import java.util.List;

/**
 * Rule that checks the earliest recruitment step is strictly after PWD determination.
 * The issue is reported on the field holding the earliest step.
 */
public class RecruitmentStartRule extends AbstractRule {

    private static final List<DateField> START_FIELDS = List.of(
            DateField.SUNDAY_AD_FIRST_DATE,
            DateField.JOB_ORDER_START_DATE,
            DateField.NOTICE_OF_FILING_START_DATE);

    public RecruitmentStartRule(RuleId id, String regulation) {
        super(id, regulation);
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        LocalDate determination = facts.date(DateField.PWD_DETERMINATION_DATE);
        if (determination == null) {
            return List.of();
        }
        DateField earliestField = null;
        LocalDate earliest = null;
        for (DateField field : START_FIELDS) {
            LocalDate date = facts.date(field);
            if (date != null && (earliest == null || date.isBefore(earliest))) {
                earliest = date;
                earliestField = field;
            }
        }
        if (earliest == null || earliest.isAfter(determination)) {
            return List.of();
        }
        return List.of(issue(earliestField.wireName(), earliestField.wireName() + " " + earliest
                + " is not after PWD determination " + determination));
    }
}
