package com.perm.validation;

/**
 * One rule violation.
 *
 * @param ruleId     Published rule identifier, e.g. {@code V-ETA-01}
 * @param field      Wire name of the offending field; entry fields are indexed, e.g. {@code rfiEntries[1].responseDueDate}
 * @param message    User-facing message
 * @param severity   Error or warning
 * @param regulation CFR citation, null when none applies
 */
public record ValidationIssue(String ruleId, String field, String message, Severity severity, String regulation) {

    public static ValidationIssue of(RuleId rule, String field, String message, String regulation) {
        return new ValidationIssue(rule.code(), field, message, rule.severity(), regulation);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
