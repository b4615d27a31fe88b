package com.perm.status;

import com.perm.config.RulesConfig;
import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.RecruitmentMethodEntry;

import java.util.EnumSet;
import java.util.Set;

/**
 * Whether the mandatory recruitment of a case has been carried out.
 */
public class RecruitmentCompleteness {

    private static final Set<DateField> BASIC_FIELDS = EnumSet.of(
            DateField.JOB_ORDER_START_DATE,
            DateField.JOB_ORDER_END_DATE,
            DateField.SUNDAY_AD_FIRST_DATE,
            DateField.SUNDAY_AD_SECOND_DATE,
            DateField.NOTICE_OF_FILING_START_DATE,
            DateField.NOTICE_OF_FILING_END_DATE);

    private final int minProfessionalMethods;

    public RecruitmentCompleteness(RulesConfig config) {
        this.minProfessionalMethods = config.minProfessionalMethods();
    }

    /**
     * Job order, both Sunday ads and the notice of filing all have their dates.
     */
    public boolean isBasicComplete(CaseDateFacts facts) {
        for (DateField field : BASIC_FIELDS) {
            if (!facts.has(field)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Enough dated additional methods, or an additional recruitment end date.
     */
    public boolean isProfessionalComplete(CaseDateFacts facts) {
        if (facts.has(DateField.ADDITIONAL_RECRUITMENT_END_DATE)) {
            return true;
        }
        long dated = facts.getAdditionalRecruitmentMethods().stream()
                .map(RecruitmentMethodEntry::date)
                .filter(d -> d != null)
                .count();
        return dated >= minProfessionalMethods;
    }

    public boolean isComplete(CaseDateFacts facts) {
        return isBasicComplete(facts) && (!facts.isProfessionalOccupation() || isProfessionalComplete(facts));
    }
}
