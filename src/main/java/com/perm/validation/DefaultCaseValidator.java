package com.perm.validation;

import com.perm.model.CaseDateFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of CaseValidator over a fixed rule list.
 */
public class DefaultCaseValidator implements CaseValidator {

    private static final Logger log = LoggerFactory.getLogger(DefaultCaseValidator.class);

    private final List<ValidationRule> rules;

    public DefaultCaseValidator(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
        log.info("Case validator initialized with {} rules", this.rules.size());
    }

    public List<ValidationRule> getRules() {
        return rules;
    }

    @Override
    public ValidationResult validateCaseForm(CaseDateFacts facts) {
        return run(facts, null);
    }

    @Override
    public ValidationResult validateCategory(CaseDateFacts facts, RuleCategory category) {
        return run(facts, category);
    }

    private ValidationResult run(CaseDateFacts facts, RuleCategory category) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ValidationRule rule : rules) {
            if (category == null || rule.getId().category() == category) {
                issues.addAll(rule.evaluate(facts));
            }
        }
        ValidationResult result = ValidationResult.of(issues);
        log.debug("Validated case: {}", result);
        return result;
    }
}
