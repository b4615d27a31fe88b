package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.util.List;
import java.util.function.Function;

/**
 * Rule that checks a text field is present and not blank.
 */
public class RequiredTextRule extends AbstractRule {

    private final String field;
    private final Function<CaseDateFacts, String> value;

    public RequiredTextRule(RuleId id, String field, Function<CaseDateFacts, String> value) {
        super(id, null);
        this.field = field;
        this.value = value;
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        String text = value.apply(facts);
        if (text == null || text.isBlank()) {
            return List.of(issue(field, null));
        }
        return List.of();
    }
}
