package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.RequestEntry;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for rules evaluated once per RFI or RFE entry.
 */
public abstract class AbstractEntryRule extends AbstractRule {

    protected final DateField.Scope scope;

    protected AbstractEntryRule(RuleId id, DateField.Scope scope, String regulation) {
        super(id, regulation);
        if (scope == DateField.Scope.CASE) {
            throw new IllegalArgumentException("Entry rules need an RFI or RFE scope");
        }
        this.scope = scope;
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        List<? extends RequestEntry<?>> entries = scope == DateField.Scope.RFI
                ? facts.getRfiEntries()
                : facts.getRfeEntries();
        List<ValidationIssue> issues = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            ValidationIssue issue = check(facts, entries.get(i), i);
            if (issue != null) {
                issues.add(issue);
            }
        }
        return issues;
    }

    /**
     * Check one entry.
     *
     * @return the violation, or null when the entry passes
     */
    protected abstract ValidationIssue check(CaseDateFacts facts, RequestEntry<?> entry, int index);

    protected String fieldPath(int index, DateField.EntryPart part) {
        String list = scope == DateField.Scope.RFI ? "rfiEntries" : "rfeEntries";
        return list + "[" + index + "]." + partName(part);
    }

    protected static String partName(DateField.EntryPart part) {
        return switch (part) {
            case RECEIVED -> "receivedDate";
            case RESPONSE_DUE -> "responseDueDate";
            case RESPONSE_SUBMITTED -> "responseSubmittedDate";
        };
    }
}
