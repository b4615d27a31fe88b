package com.perm.constraint;

/**
 * Upstream condition that produced a bound.
 */
public enum LimitingFactor {
    RECRUITMENT("recruitment"),
    PWD("pwd");

    private final String wireName;

    LimitingFactor(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
