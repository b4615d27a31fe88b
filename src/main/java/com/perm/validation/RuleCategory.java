package com.perm.validation;

/**
 * Kinds of validation rules.
 */
public enum RuleCategory {
    SUNDAY_ALIGNMENT,
    CHRONOLOGICAL_ORDER,
    MINIMUM_DURATION,
    MANDATORY_COUNT,
    WINDOW_MEMBERSHIP,
    DUPLICATE_PREVENTION,
    REQUIRED_FIELD,
    REFERENTIAL
}
