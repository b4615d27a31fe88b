package com.perm.deadline;

/**
 * Why a deadline is no longer active.
 */
public enum SupersessionReason {
    CASE_CLOSED("Case is closed"),
    CASE_DELETED("Case is deleted"),
    NO_DATE("Deadline date is not set"),
    ETA9089_FILED("ETA 9089 has been filed"),
    NOT_CERTIFIED("ETA 9089 is not certified"),
    I140_FILED("I-140 has been filed"),
    RFI_RESPONDED("RFI response has been submitted"),
    RFE_RESPONDED("RFE response has been submitted");

    private final String description;

    SupersessionReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
