package com.perm.model;

import com.perm.exception.MalformedInputException;

/**
 * Every date a case carries, identified by its wire name.
 * <p>
 * Case-scoped fields live directly on {@link CaseDateFacts}; RFI and RFE fields
 * address a single entry of the corresponding list.
 */
public enum DateField {
    // PWD
    PWD_FILING_DATE("pwdFilingDate", Scope.CASE, null),
    PWD_DETERMINATION_DATE("pwdDeterminationDate", Scope.CASE, null),
    PWD_EXPIRATION_DATE("pwdExpirationDate", Scope.CASE, null),

    // Recruitment
    SUNDAY_AD_FIRST_DATE("sundayAdFirstDate", Scope.CASE, null),
    SUNDAY_AD_SECOND_DATE("sundayAdSecondDate", Scope.CASE, null),
    JOB_ORDER_START_DATE("jobOrderStartDate", Scope.CASE, null),
    JOB_ORDER_END_DATE("jobOrderEndDate", Scope.CASE, null),
    NOTICE_OF_FILING_START_DATE("noticeOfFilingStartDate", Scope.CASE, null),
    NOTICE_OF_FILING_END_DATE("noticeOfFilingEndDate", Scope.CASE, null),
    ADDITIONAL_RECRUITMENT_START_DATE("additionalRecruitmentStartDate", Scope.CASE, null),
    ADDITIONAL_RECRUITMENT_END_DATE("additionalRecruitmentEndDate", Scope.CASE, null),

    // ETA 9089
    ETA9089_FILING_DATE("eta9089FilingDate", Scope.CASE, null),
    ETA9089_AUDIT_DATE("eta9089AuditDate", Scope.CASE, null),
    ETA9089_CERTIFICATION_DATE("eta9089CertificationDate", Scope.CASE, null),
    ETA9089_EXPIRATION_DATE("eta9089ExpirationDate", Scope.CASE, null),

    // I-140
    I140_FILING_DATE("i140FilingDate", Scope.CASE, null),
    I140_RECEIPT_DATE("i140ReceiptDate", Scope.CASE, null),
    I140_APPROVAL_DATE("i140ApprovalDate", Scope.CASE, null),
    I140_DENIAL_DATE("i140DenialDate", Scope.CASE, null),

    // RFI entry
    RFI_RECEIVED_DATE("rfiReceivedDate", Scope.RFI, EntryPart.RECEIVED),
    RFI_RESPONSE_DUE_DATE("rfiResponseDueDate", Scope.RFI, EntryPart.RESPONSE_DUE),
    RFI_RESPONSE_SUBMITTED_DATE("rfiResponseSubmittedDate", Scope.RFI, EntryPart.RESPONSE_SUBMITTED),

    // RFE entry
    RFE_RECEIVED_DATE("rfeReceivedDate", Scope.RFE, EntryPart.RECEIVED),
    RFE_RESPONSE_DUE_DATE("rfeResponseDueDate", Scope.RFE, EntryPart.RESPONSE_DUE),
    RFE_RESPONSE_SUBMITTED_DATE("rfeResponseSubmittedDate", Scope.RFE, EntryPart.RESPONSE_SUBMITTED);

    /**
     * Where a field is stored.
     */
    public enum Scope {
        CASE,
        RFI,
        RFE
    }

    /**
     * Date slot of an RFI/RFE entry.
     */
    public enum EntryPart {
        RECEIVED,
        RESPONSE_DUE,
        RESPONSE_SUBMITTED
    }

    private final String wireName;
    private final Scope scope;
    private final EntryPart entryPart;

    DateField(String wireName, Scope scope, EntryPart entryPart) {
        this.wireName = wireName;
        this.scope = scope;
        this.entryPart = entryPart;
    }

    public String wireName() {
        return wireName;
    }

    public Scope scope() {
        return scope;
    }

    /**
     * Entry slot for RFI/RFE fields, null for case fields.
     */
    public EntryPart entryPart() {
        return entryPart;
    }

    public boolean isEntryScoped() {
        return scope != Scope.CASE;
    }

    /**
     * Resolve a field from its camelCase wire name or its snake_case form
     * (e.g. {@code pwdFilingDate} or {@code pwd_filing_date}).
     *
     * @throws MalformedInputException for unknown identifiers
     */
    public static DateField fromWireName(String value) {
        if (value != null) {
            for (DateField field : values()) {
                if (field.wireName.equals(value) || field.name().equalsIgnoreCase(value)) {
                    return field;
                }
            }
        }
        throw new MalformedInputException("Unknown date field: " + value);
    }
}
