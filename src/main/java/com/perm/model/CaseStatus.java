package com.perm.model;

import com.perm.exception.MalformedInputException;

/**
 * Stage of a PERM case.
 */
public enum CaseStatus {
    PWD("pwd"),
    RECRUITMENT("recruitment"),
    ETA9089("eta9089"),
    I140("i140"),
    CLOSED("closed");

    private final String wireName;

    CaseStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static CaseStatus fromWireName(String value) {
        for (CaseStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new MalformedInputException("Unknown case status: " + value);
    }
}
