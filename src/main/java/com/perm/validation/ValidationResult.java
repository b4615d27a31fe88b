package com.perm.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating a case. A case is valid iff it has no errors; warnings never block.
 */
public final class ValidationResult {

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    private ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    /**
     * Split issues by severity.
     */
    public static ValidationResult of(List<ValidationIssue> issues) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            if (issue.isError()) {
                errors.add(issue);
            } else {
                warnings.add(issue);
            }
        }
        return new ValidationResult(errors, warnings);
    }

    public static ValidationResult valid() {
        return new ValidationResult(List.of(), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationIssue> getErrors() {
        return errors;
    }

    public List<ValidationIssue> getWarnings() {
        return warnings;
    }

    /**
     * Whether any error or warning carries the given rule code.
     */
    public boolean hasIssue(String ruleCode) {
        return errors.stream().anyMatch(i -> i.ruleId().equals(ruleCode))
                || warnings.stream().anyMatch(i -> i.ruleId().equals(ruleCode));
    }

    @Override
    public String toString() {
        return "ValidationResult{" +
                "valid=" + isValid() +
                ", errors=" + errors.size() +
                ", warnings=" + warnings.size() +
                '}';
    }
}
