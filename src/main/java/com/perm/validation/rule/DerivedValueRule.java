package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.time.LocalDate;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Rule that checks a stored derived date matches the value computed from its source.
 */
public class DerivedValueRule extends AbstractRule {

    private final DateField source;
    private final DateField derived;
    private final UnaryOperator<LocalDate> derivation;

    public DerivedValueRule(RuleId id, DateField source, DateField derived,
                            UnaryOperator<LocalDate> derivation, String regulation) {
        super(id, regulation);
        this.source = source;
        this.derived = derived;
        this.derivation = derivation;
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        LocalDate sourceDate = facts.date(source);
        LocalDate actual = facts.date(derived);
        if (sourceDate == null || actual == null) {
            return List.of();
        }
        LocalDate expected = derivation.apply(sourceDate);
        if (expected.equals(actual)) {
            return List.of();
        }
        return List.of(issue(derived.wireName(), "Expected " + expected + ", found " + actual));
    }
}
