package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.RequestEntry;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.time.LocalDate;

/**
 * Rule that checks a fixed response period: due date exactly N days after receipt.
 */
public class EntryDueDateRule extends AbstractEntryRule {

    private final int responseDays;

    public EntryDueDateRule(RuleId id, DateField.Scope scope, int responseDays, String regulation) {
        super(id, scope, regulation);
        this.responseDays = responseDays;
    }

    @Override
    protected ValidationIssue check(CaseDateFacts facts, RequestEntry<?> entry, int index) {
        LocalDate received = entry.receivedDate();
        LocalDate due = entry.responseDueDate();
        if (received == null || due == null) {
            return null;
        }
        LocalDate expected = received.plusDays(responseDays);
        if (expected.equals(due)) {
            return null;
        }
        return issue(fieldPath(index, DateField.EntryPart.RESPONSE_DUE), "Expected " + expected + ", found " + due);
    }
}
