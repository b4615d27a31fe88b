package com.perm.model;

import com.perm.exception.MalformedInputException;

/**
 * Additional recruitment steps available to professional occupations (20 CFR 656.17(e)(1)(ii)).
 */
public enum RecruitmentMethod {
    LOCAL_NEWSPAPER("local_newspaper", "Local or ethnic newspaper"),
    RADIO_AD("radio_ad", "Radio advertisement"),
    TV_AD("tv_ad", "Television advertisement"),
    JOB_FAIR("job_fair", "Job fair"),
    CAMPUS_PLACEMENT("campus_placement", "Campus placement office"),
    TRADE_ORGANIZATION("trade_organization", "Trade or professional organization"),
    PRIVATE_EMPLOYMENT_FIRM("private_employment_firm", "Private employment firm"),
    EMPLOYEE_REFERRAL("employee_referral", "Employee referral program"),
    EMPLOYER_WEBSITE("employer_website", "Employer's website"),
    JOB_WEBSITE_AD("job_website_ad", "Job search website"),
    ON_CAMPUS_RECRUITMENT("on_campus_recruitment", "On-campus recruiting");

    private final String wireName;
    private final String label;

    RecruitmentMethod(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    public static RecruitmentMethod fromWireName(String value) {
        for (RecruitmentMethod method : values()) {
            if (method.wireName.equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new MalformedInputException("Unknown recruitment method: " + value);
    }
}
