package com.perm.cascade;

import com.perm.config.RulesConfig;
import com.perm.dates.DateArithmetic;
import com.perm.exception.ConfigurationException;
import com.perm.model.DateField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed dependency table of derived dates.
 */
public final class CascadeRules {

    private CascadeRules() {
    }

    /**
     * Standard PERM derivations:
     * <ul>
     *   <li>PWD determination: expiration one year later</li>
     *   <li>Notice of filing start: end after the minimum posting in business days</li>
     *   <li>Job order start: end after the minimum posting in calendar days</li>
     *   <li>ETA 9089 certification: expiration after the validity period</li>
     *   <li>RFI received: response due after the response period</li>
     * </ul>
     */
    public static Map<DateField, CascadeRule> standard(DateArithmetic arithmetic, RulesConfig config) {
        return index(List.of(
                new CascadeRule(DateField.PWD_DETERMINATION_DATE, DateField.PWD_EXPIRATION_DATE,
                        d -> d.plusYears(config.pwdValidityYears()),
                        "+" + config.pwdValidityYears() + " year"),
                new CascadeRule(DateField.NOTICE_OF_FILING_START_DATE, DateField.NOTICE_OF_FILING_END_DATE,
                        d -> arithmetic.addBusinessDays(d, config.noticeMinBusinessDays()),
                        "+" + config.noticeMinBusinessDays() + " business days"),
                new CascadeRule(DateField.JOB_ORDER_START_DATE, DateField.JOB_ORDER_END_DATE,
                        d -> arithmetic.addCalendarDays(d, config.jobOrderMinDays()),
                        "+" + config.jobOrderMinDays() + " calendar days"),
                new CascadeRule(DateField.ETA9089_CERTIFICATION_DATE, DateField.ETA9089_EXPIRATION_DATE,
                        d -> arithmetic.addCalendarDays(d, config.eta9089ValidityDays()),
                        "+" + config.eta9089ValidityDays() + " calendar days"),
                new CascadeRule(DateField.RFI_RECEIVED_DATE, DateField.RFI_RESPONSE_DUE_DATE,
                        d -> arithmetic.addCalendarDays(d, config.rfiResponseDays()),
                        "+" + config.rfiResponseDays() + " calendar days")
        ));
    }

    /**
     * Index rules by trigger, rejecting tables that would cascade more than one hop.
     */
    static Map<DateField, CascadeRule> index(List<CascadeRule> rules) {
        Map<DateField, CascadeRule> byTrigger = new EnumMap<>(DateField.class);
        for (CascadeRule rule : rules) {
            if (rule.trigger().scope() != rule.derived().scope()) {
                throw new ConfigurationException("Cascade " + rule.trigger() + " -> " + rule.derived()
                        + " crosses storage scopes");
            }
            if (byTrigger.put(rule.trigger(), rule) != null) {
                throw new ConfigurationException("Duplicate cascade trigger: " + rule.trigger());
            }
        }
        for (CascadeRule rule : rules) {
            if (byTrigger.containsKey(rule.derived())) {
                throw new ConfigurationException("Derived field " + rule.derived() + " cannot also be a trigger");
            }
        }
        return Collections.unmodifiableMap(byTrigger);
    }
}
