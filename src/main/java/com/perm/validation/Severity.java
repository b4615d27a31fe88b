package com.perm.validation;

/**
 * Errors block saving a case; warnings are advisory.
 */
public enum Severity {
    ERROR("error"),
    WARNING("warning");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
