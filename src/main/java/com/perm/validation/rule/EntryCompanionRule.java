package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.RequestEntry;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

/**
 * Rule that checks an entry with a submitted response also records when it was due.
 */
public class EntryCompanionRule extends AbstractEntryRule {

    public EntryCompanionRule(RuleId id, DateField.Scope scope) {
        super(id, scope, null);
    }

    @Override
    protected ValidationIssue check(CaseDateFacts facts, RequestEntry<?> entry, int index) {
        if (entry.responseSubmittedDate() != null && entry.responseDueDate() == null) {
            return issue(fieldPath(index, DateField.EntryPart.RESPONSE_DUE), null);
        }
        return null;
    }
}
