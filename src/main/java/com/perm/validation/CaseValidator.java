package com.perm.validation;

import com.perm.model.CaseDateFacts;

/**
 * Validates the cross-field consistency of a case.
 */
public interface CaseValidator {

    /**
     * Run every rule.
     *
     * @param facts Case snapshot
     * @return errors and warnings; valid iff there are no errors
     */
    ValidationResult validateCaseForm(CaseDateFacts facts);

    /**
     * Run the rules of one category only.
     */
    ValidationResult validateCategory(CaseDateFacts facts, RuleCategory category);
}
