package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.RequestEntry;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.time.LocalDate;

/**
 * Rule that compares two dates of the same entry.
 */
public class EntryOrderRule extends AbstractEntryRule {

    private final DateField.EntryPart subject;
    private final DateField.EntryPart reference;
    private final BoundSide side;

    public EntryOrderRule(RuleId id, DateField.Scope scope, DateField.EntryPart subject,
                          BoundSide side, DateField.EntryPart reference, String regulation) {
        super(id, scope, regulation);
        this.subject = subject;
        this.reference = reference;
        this.side = side;
    }

    @Override
    protected ValidationIssue check(CaseDateFacts facts, RequestEntry<?> entry, int index) {
        LocalDate subjectDate = entry.date(subject);
        LocalDate referenceDate = entry.date(reference);
        if (subjectDate == null || referenceDate == null || side.holds(subjectDate, referenceDate)) {
            return null;
        }
        return issue(fieldPath(index, subject), partName(subject) + " " + subjectDate + " must be "
                + side.phrase() + " " + partName(reference) + " " + referenceDate);
    }
}
