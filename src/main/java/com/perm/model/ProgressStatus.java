package com.perm.model;

import com.perm.exception.MalformedInputException;

/**
 * Progress within the current case stage.
 */
public enum ProgressStatus {
    WORKING("working"),
    WAITING_INTAKE("waiting_intake"),
    FILED("filed"),
    APPROVED("approved"),
    UNDER_REVIEW("under_review"),
    RFI_RFE("rfi_rfe");

    private final String wireName;

    ProgressStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ProgressStatus fromWireName(String value) {
        for (ProgressStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new MalformedInputException("Unknown progress status: " + value);
    }
}
