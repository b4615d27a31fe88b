package com.perm.validation;

import static com.perm.validation.RuleCategory.*;
import static com.perm.validation.Severity.ERROR;
import static com.perm.validation.Severity.WARNING;

/**
 * The closed set of case validation rules.
 */
public enum RuleId {
    // Case
    CASE_01("V-CASE-01", REQUIRED_FIELD, ERROR, "Employer name is required"),
    CASE_02("V-CASE-02", REQUIRED_FIELD, ERROR, "Beneficiary identifier is required"),
    CASE_03("V-CASE-03", REQUIRED_FIELD, ERROR, "Position title is required"),

    // PWD
    PWD_01("V-PWD-01", CHRONOLOGICAL_ORDER, ERROR, "PWD determination must be after filing"),
    PWD_02("V-PWD-02", CHRONOLOGICAL_ORDER, ERROR, "PWD expiration must be after determination"),
    PWD_03("V-PWD-03", REFERENTIAL, WARNING, "PWD expiration should match the calculated value"),

    // Recruitment
    REC_01("V-REC-01", SUNDAY_ALIGNMENT, ERROR, "First Sunday ad must be on a Sunday"),
    REC_02("V-REC-02", SUNDAY_ALIGNMENT, ERROR, "Second Sunday ad must be on a Sunday"),
    REC_03("V-REC-03", CHRONOLOGICAL_ORDER, ERROR, "Second Sunday ad must be after the first"),
    REC_04("V-REC-04", CHRONOLOGICAL_ORDER, ERROR, "Job order end must be after start"),
    REC_05("V-REC-05", MINIMUM_DURATION, ERROR, "Job order must run at least 30 days"),
    REC_06("V-REC-06", CHRONOLOGICAL_ORDER, ERROR, "Notice of filing end must be after start"),
    REC_07("V-REC-07", MINIMUM_DURATION, ERROR, "Notice of filing must be posted at least 10 business days"),
    REC_08("V-REC-08", REFERENTIAL, ERROR, "Notice of filing start requires an end date"),
    REC_09("V-REC-09", REFERENTIAL, ERROR, "Notice of filing end requires a start date"),
    REC_10("V-REC-10", MINIMUM_DURATION, WARNING, "Notice of filing period is short"),
    REC_11("V-REC-11", CHRONOLOGICAL_ORDER, ERROR, "Recruitment must start after PWD determination"),

    // Professional occupation
    PRO_01("V-PRO-01", MANDATORY_COUNT, WARNING, "Professional occupations need at least 3 additional recruitment methods"),
    PRO_02("V-PRO-02", DUPLICATE_PREVENTION, ERROR, "Additional recruitment methods must be distinct"),
    PRO_03("V-PRO-03", MINIMUM_DURATION, ERROR, "Additional recruitment must end on or after its start"),
    PRO_04("V-PRO-04", CHRONOLOGICAL_ORDER, ERROR, "Additional recruitment must be after PWD determination"),
    PRO_05("V-PRO-05", WINDOW_MEMBERSHIP, ERROR, "Additional recruitment must fall within the recruitment window"),

    // ETA 9089
    ETA_01("V-ETA-01", WINDOW_MEMBERSHIP, ERROR, "ETA 9089 filing must be at least 30 days after recruitment ends"),
    ETA_02("V-ETA-02", WINDOW_MEMBERSHIP, ERROR, "ETA 9089 filing must be within 180 days after recruitment starts"),
    ETA_03("V-ETA-03", WINDOW_MEMBERSHIP, ERROR, "ETA 9089 filing must be on or before PWD expiration"),
    ETA_04("V-ETA-04", CHRONOLOGICAL_ORDER, ERROR, "ETA 9089 certification must be after filing"),
    ETA_05("V-ETA-05", REFERENTIAL, WARNING, "ETA 9089 expiration should be 180 days after certification"),
    ETA_06("V-ETA-06", CHRONOLOGICAL_ORDER, ERROR, "ETA 9089 audit must be after filing"),
    ETA_07("V-ETA-07", CHRONOLOGICAL_ORDER, ERROR, "ETA 9089 certification must be after audit"),

    // I-140
    I140_01("V-I140-01", CHRONOLOGICAL_ORDER, ERROR, "I-140 filing must be after ETA 9089 certification"),
    I140_02("V-I140-02", WINDOW_MEMBERSHIP, ERROR, "I-140 must be filed within 180 days of certification"),
    I140_03("V-I140-03", CHRONOLOGICAL_ORDER, ERROR, "I-140 receipt must be after filing"),
    I140_04("V-I140-04", CHRONOLOGICAL_ORDER, ERROR, "I-140 approval must be after receipt"),
    I140_05("V-I140-05", CHRONOLOGICAL_ORDER, ERROR, "I-140 denial must be after receipt"),

    // RFI
    RFI_01("V-RFI-01", CHRONOLOGICAL_ORDER, ERROR, "RFI must be received after ETA 9089 filing"),
    RFI_02("V-RFI-02", REFERENTIAL, ERROR, "RFI response is due 30 days after receipt"),
    RFI_03("V-RFI-03", CHRONOLOGICAL_ORDER, ERROR, "RFI response must be submitted after receipt"),
    RFI_04("V-RFI-04", WINDOW_MEMBERSHIP, WARNING, "RFI response was submitted after the due date"),
    RFI_05("V-RFI-05", REFERENTIAL, ERROR, "A submitted RFI response requires a due date"),

    // RFE
    RFE_01("V-RFE-01", CHRONOLOGICAL_ORDER, ERROR, "RFE must be received after I-140 filing"),
    RFE_02("V-RFE-02", CHRONOLOGICAL_ORDER, ERROR, "RFE due date must be after receipt"),
    RFE_03("V-RFE-03", CHRONOLOGICAL_ORDER, ERROR, "RFE response must be submitted after receipt"),
    RFE_04("V-RFE-04", WINDOW_MEMBERSHIP, WARNING, "RFE response was submitted after the due date"),
    RFE_05("V-RFE-05", REFERENTIAL, ERROR, "A submitted RFE response requires a due date");

    private final String code;
    private final RuleCategory category;
    private final Severity severity;
    private final String description;

    RuleId(String code, RuleCategory category, Severity severity, String description) {
        this.code = code;
        this.category = category;
        this.severity = severity;
        this.description = description;
    }

    /**
     * Published identifier, e.g. {@code V-REC-03}.
     */
    public String code() {
        return code;
    }

    public RuleCategory category() {
        return category;
    }

    public Severity severity() {
        return severity;
    }

    public String description() {
        return description;
    }

    public boolean isProfessionalOnly() {
        return name().startsWith("PRO_");
    }
}
