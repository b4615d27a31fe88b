package com.perm.deadline;

import com.perm.exception.MalformedInputException;

/**
 * Regulatory deadlines whose relevance can be superseded by later filings.
 */
public enum DeadlineType {
    PWD_EXPIRATION("pwd_expiration", "PWD Expiration"),
    FILING_WINDOW_OPENS("filing_window_opens", "ETA 9089 Filing Window Opens"),
    FILING_WINDOW_CLOSES("filing_window_closes", "ETA 9089 Filing Window Closes"),
    RECRUITMENT_WINDOW_CLOSES("recruitment_window_closes", "Recruitment Window Closes"),
    I140_FILING_DEADLINE("i140_filing_deadline", "I-140 Filing Deadline"),
    RFI_DUE("rfi_due", "RFI Response Due"),
    RFE_DUE("rfe_due", "RFE Response Due");

    private final String wireName;
    private final String label;

    DeadlineType(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    /**
     * @throws MalformedInputException for unknown identifiers
     */
    public static DeadlineType fromWireName(String value) {
        for (DeadlineType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new MalformedInputException("Unknown deadline type: " + value);
    }
}
