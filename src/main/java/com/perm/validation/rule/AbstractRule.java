package com.perm.validation.rule;

import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;
import com.perm.validation.ValidationRule;

/**
 * Base class holding the rule identity and its regulation citation.
 */
public abstract class AbstractRule implements ValidationRule {

    protected final RuleId id;
    protected final String regulation;

    protected AbstractRule(RuleId id, String regulation) {
        this.id = id;
        this.regulation = regulation;
    }

    @Override
    public RuleId getId() {
        return id;
    }

    protected ValidationIssue issue(String field, String detail) {
        String message = detail == null ? id.description() : id.description() + ". " + detail;
        if (regulation != null) {
            message = message + " (" + regulation + ")";
        }
        return ValidationIssue.of(id, field, message, regulation);
    }

    @Override
    public String toString() {
        return id.code() + ": " + id.description();
    }
}
