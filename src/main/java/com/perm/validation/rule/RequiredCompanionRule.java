package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.util.List;

/**
 * Rule that checks a date is set whenever another date is set.
 */
public class RequiredCompanionRule extends AbstractRule {

    private final DateField present;
    private final DateField required;

    public RequiredCompanionRule(RuleId id, DateField present, DateField required) {
        super(id, null);
        this.present = present;
        this.required = required;
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        if (facts.has(present) && !facts.has(required)) {
            return List.of(issue(required.wireName(), null));
        }
        return List.of();
    }
}
