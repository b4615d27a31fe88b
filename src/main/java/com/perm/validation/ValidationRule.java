package com.perm.validation;

import com.perm.model.CaseDateFacts;

import java.util.List;

/**
 * A pure check over a case snapshot.
 * Rules that look at list entries report one issue per offending entry.
 */
public interface ValidationRule {

    /**
     * Evaluate the rule.
     *
     * @param facts Case snapshot
     * @return the violations found, empty when the rule holds or does not apply
     */
    List<ValidationIssue> evaluate(CaseDateFacts facts);

    RuleId getId();
}
