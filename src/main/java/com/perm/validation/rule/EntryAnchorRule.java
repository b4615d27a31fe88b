package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.RequestEntry;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.time.LocalDate;

/**
 * Rule that checks each entry was received strictly after the case milestone it responds to.
 */
public class EntryAnchorRule extends AbstractEntryRule {

    private final DateField anchor;

    public EntryAnchorRule(RuleId id, DateField.Scope scope, DateField anchor, String regulation) {
        super(id, scope, regulation);
        this.anchor = anchor;
    }

    @Override
    protected ValidationIssue check(CaseDateFacts facts, RequestEntry<?> entry, int index) {
        LocalDate received = entry.receivedDate();
        LocalDate anchorDate = facts.date(anchor);
        if (received == null || anchorDate == null || received.isAfter(anchorDate)) {
            return null;
        }
        return issue(fieldPath(index, DateField.EntryPart.RECEIVED),
                "Received " + received + ", " + anchor.wireName() + " " + anchorDate);
    }
}
