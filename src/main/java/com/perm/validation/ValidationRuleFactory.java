package com.perm.validation;

import com.perm.config.RulesConfig;
import com.perm.constraint.BoundedDate;
import com.perm.constraint.RecruitmentTimeline;
import com.perm.dates.DateArithmetic;
import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.validation.rule.BoundSide;
import com.perm.validation.rule.BusinessDayDurationRule;
import com.perm.validation.rule.ChronologicalOrderRule;
import com.perm.validation.rule.DerivedValueRule;
import com.perm.validation.rule.DuplicateMethodRule;
import com.perm.validation.rule.EntryAnchorRule;
import com.perm.validation.rule.EntryCompanionRule;
import com.perm.validation.rule.EntryDueDateRule;
import com.perm.validation.rule.EntryOrderRule;
import com.perm.validation.rule.MethodCountRule;
import com.perm.validation.rule.MethodDateRule;
import com.perm.validation.rule.MinimumDurationRule;
import com.perm.validation.rule.ProfessionalOnlyRule;
import com.perm.validation.rule.RecruitmentStartRule;
import com.perm.validation.rule.RequiredCompanionRule;
import com.perm.validation.rule.RequiredTextRule;
import com.perm.validation.rule.SundayRule;
import com.perm.validation.rule.WindowRule;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.perm.model.DateField.*;
import static com.perm.model.DateField.EntryPart.RECEIVED;
import static com.perm.model.DateField.EntryPart.RESPONSE_DUE;
import static com.perm.model.DateField.EntryPart.RESPONSE_SUBMITTED;

/**
 * Builds the rule implementation of each {@link RuleId}.
 */
public class ValidationRuleFactory {

    private static final String REG_ADVERTISING = "20 CFR § 656.17(e)(1)(i)(B)";
    private static final String REG_JOB_ORDER = "20 CFR § 656.17(e)(1)(i)(A)";
    private static final String REG_NOTICE = "20 CFR § 656.10(d)(1)(ii)";
    private static final String REG_PROFESSIONAL = "20 CFR § 656.17(e)";
    private static final String REG_FILING = "20 CFR § 656.40(c)";
    private static final String REG_RECRUITMENT_WINDOW = "20 CFR § 656.17(e)";
    private static final String REG_VALIDITY = "20 CFR § 656.30(b)(1)";

    private final DateArithmetic arithmetic;
    private final RecruitmentTimeline timeline;
    private final RulesConfig config;

    public ValidationRuleFactory(DateArithmetic arithmetic, RecruitmentTimeline timeline, RulesConfig config) {
        this.arithmetic = arithmetic;
        this.timeline = timeline;
        this.config = config;
    }

    /**
     * Create every rule, in declaration order.
     */
    public List<ValidationRule> createAll() {
        List<ValidationRule> rules = new ArrayList<>();
        for (RuleId id : RuleId.values()) {
            rules.add(create(id));
        }
        return rules;
    }

    public ValidationRule create(RuleId id) {
        ValidationRule rule = createUnscoped(id);
        return id.isProfessionalOnly() ? new ProfessionalOnlyRule(rule) : rule;
    }

    private ValidationRule createUnscoped(RuleId id) {
        return switch (id) {
            case CASE_01 -> new RequiredTextRule(id, "employerName", CaseDateFacts::getEmployerName);
            case CASE_02 -> new RequiredTextRule(id, "beneficiaryIdentifier", CaseDateFacts::getBeneficiaryIdentifier);
            case CASE_03 -> new RequiredTextRule(id, "positionTitle", CaseDateFacts::getPositionTitle);

            case PWD_01 -> new ChronologicalOrderRule(id, PWD_DETERMINATION_DATE, PWD_FILING_DATE);
            case PWD_02 -> new ChronologicalOrderRule(id, PWD_EXPIRATION_DATE, PWD_DETERMINATION_DATE);
            case PWD_03 -> new DerivedValueRule(id, PWD_DETERMINATION_DATE, PWD_EXPIRATION_DATE,
                    d -> d.plusYears(config.pwdValidityYears()), null);

            case REC_01 -> new SundayRule(id, SUNDAY_AD_FIRST_DATE, arithmetic, REG_ADVERTISING);
            case REC_02 -> new SundayRule(id, SUNDAY_AD_SECOND_DATE, arithmetic, REG_ADVERTISING);
            case REC_03 -> new ChronologicalOrderRule(id, SUNDAY_AD_SECOND_DATE, SUNDAY_AD_FIRST_DATE);
            case REC_04 -> new ChronologicalOrderRule(id, JOB_ORDER_END_DATE, JOB_ORDER_START_DATE);
            case REC_05 -> new MinimumDurationRule(id, JOB_ORDER_START_DATE, JOB_ORDER_END_DATE,
                    config.jobOrderMinDays(), REG_JOB_ORDER);
            case REC_06 -> new ChronologicalOrderRule(id, NOTICE_OF_FILING_END_DATE, NOTICE_OF_FILING_START_DATE);
            case REC_07 -> new BusinessDayDurationRule(id, NOTICE_OF_FILING_START_DATE, NOTICE_OF_FILING_END_DATE,
                    config.noticeMinBusinessDays(), false, arithmetic, REG_NOTICE);
            case REC_08 -> new RequiredCompanionRule(id, NOTICE_OF_FILING_START_DATE, NOTICE_OF_FILING_END_DATE);
            case REC_09 -> new RequiredCompanionRule(id, NOTICE_OF_FILING_END_DATE, NOTICE_OF_FILING_START_DATE);
            case REC_10 -> new BusinessDayDurationRule(id, NOTICE_OF_FILING_START_DATE, NOTICE_OF_FILING_END_DATE,
                    config.noticeMinBusinessDays(), true, arithmetic, REG_NOTICE);
            case REC_11 -> new RecruitmentStartRule(id, REG_RECRUITMENT_WINDOW);

            case PRO_01 -> new MethodCountRule(id, config.minProfessionalMethods(), REG_PROFESSIONAL);
            case PRO_02 -> new DuplicateMethodRule(id);
            case PRO_03 -> new MinimumDurationRule(id, ADDITIONAL_RECRUITMENT_START_DATE,
                    ADDITIONAL_RECRUITMENT_END_DATE, 0, null);
            case PRO_04 -> new MethodDateRule(id, f -> f.date(PWD_DETERMINATION_DATE), BoundSide.AFTER,
                    "PWD determination", REG_PROFESSIONAL);
            case PRO_05 -> new MethodDateRule(id, this::recruitmentWindowCloses, BoundSide.NOT_AFTER,
                    "recruitment window closes", REG_PROFESSIONAL);

            case ETA_01 -> new WindowRule(id, ETA9089_FILING_DATE, this::filingWindowOpens, BoundSide.NOT_BEFORE,
                    config.filingWindowWaitDays() + " days after last recruitment", REG_FILING);
            case ETA_02 -> new WindowRule(id, ETA9089_FILING_DATE, this::filingWindowNaturalClose, BoundSide.NOT_AFTER,
                    config.filingWindowCloseDays() + " days after first recruitment", REG_FILING);
            case ETA_03 -> new WindowRule(id, ETA9089_FILING_DATE, f -> f.date(PWD_EXPIRATION_DATE), BoundSide.NOT_AFTER,
                    "PWD expiration", REG_FILING);
            case ETA_04 -> new ChronologicalOrderRule(id, ETA9089_CERTIFICATION_DATE, ETA9089_FILING_DATE);
            case ETA_05 -> new DerivedValueRule(id, ETA9089_CERTIFICATION_DATE, ETA9089_EXPIRATION_DATE,
                    d -> d.plusDays(config.eta9089ValidityDays()), REG_VALIDITY);
            case ETA_06 -> new ChronologicalOrderRule(id, ETA9089_AUDIT_DATE, ETA9089_FILING_DATE);
            case ETA_07 -> new ChronologicalOrderRule(id, ETA9089_CERTIFICATION_DATE, ETA9089_AUDIT_DATE);

            case I140_01 -> new ChronologicalOrderRule(id, I140_FILING_DATE, ETA9089_CERTIFICATION_DATE);
            case I140_02 -> new WindowRule(id, I140_FILING_DATE, this::i140Deadline, BoundSide.NOT_AFTER,
                    "certification validity", REG_VALIDITY);
            case I140_03 -> new ChronologicalOrderRule(id, I140_RECEIPT_DATE, I140_FILING_DATE);
            case I140_04 -> new ChronologicalOrderRule(id, I140_APPROVAL_DATE,
                    List.of(I140_RECEIPT_DATE, I140_FILING_DATE), null);
            case I140_05 -> new ChronologicalOrderRule(id, I140_DENIAL_DATE,
                    List.of(I140_RECEIPT_DATE, I140_FILING_DATE), null);

            case RFI_01 -> new EntryAnchorRule(id, Scope.RFI, ETA9089_FILING_DATE, null);
            case RFI_02 -> new EntryDueDateRule(id, Scope.RFI, config.rfiResponseDays(), null);
            case RFI_03 -> new EntryOrderRule(id, Scope.RFI, RESPONSE_SUBMITTED, BoundSide.AFTER, RECEIVED, null);
            case RFI_04 -> new EntryOrderRule(id, Scope.RFI, RESPONSE_SUBMITTED, BoundSide.NOT_AFTER, RESPONSE_DUE, null);
            case RFI_05 -> new EntryCompanionRule(id, Scope.RFI);

            case RFE_01 -> new EntryAnchorRule(id, Scope.RFE, I140_FILING_DATE, null);
            case RFE_02 -> new EntryOrderRule(id, Scope.RFE, RESPONSE_DUE, BoundSide.AFTER, RECEIVED, null);
            case RFE_03 -> new EntryOrderRule(id, Scope.RFE, RESPONSE_SUBMITTED, BoundSide.AFTER, RECEIVED, null);
            case RFE_04 -> new EntryOrderRule(id, Scope.RFE, RESPONSE_SUBMITTED, BoundSide.NOT_AFTER, RESPONSE_DUE, null);
            case RFE_05 -> new EntryCompanionRule(id, Scope.RFE);
        };
    }

    private LocalDate recruitmentWindowCloses(CaseDateFacts facts) {
        BoundedDate closes = timeline.deadlineFor(NOTICE_OF_FILING_START_DATE, facts);
        return closes == null ? null : closes.date();
    }

    private LocalDate filingWindowOpens(CaseDateFacts facts) {
        LocalDate last = timeline.lastRecruitmentDate(facts);
        return last == null ? null : last.plusDays(config.filingWindowWaitDays());
    }

    private LocalDate filingWindowNaturalClose(CaseDateFacts facts) {
        LocalDate first = timeline.firstRecruitmentDate(facts);
        return first == null ? null : first.plusDays(config.filingWindowCloseDays());
    }

    private LocalDate i140Deadline(CaseDateFacts facts) {
        LocalDate certification = facts.date(ETA9089_CERTIFICATION_DATE);
        if (certification == null) {
            return null;
        }
        return DateArithmetic.earliest(certification.plusDays(config.i140FilingWindowDays()),
                facts.date(ETA9089_EXPIRATION_DATE));
    }
}
