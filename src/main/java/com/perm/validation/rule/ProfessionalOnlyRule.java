package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;
import com.perm.validation.ValidationRule;

import java.util.List;

/**
 * Applies a rule only to professional-occupation cases.
 */
public class ProfessionalOnlyRule implements ValidationRule {

    private final ValidationRule delegate;

    public ProfessionalOnlyRule(ValidationRule delegate) {
        this.delegate = delegate;
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        return facts.isProfessionalOccupation() ? delegate.evaluate(facts) : List.of();
    }

    @Override
    public RuleId getId() {
        return delegate.getId();
    }

    @Override
    public String toString() {
        return delegate + " [professional only]";
    }
}
