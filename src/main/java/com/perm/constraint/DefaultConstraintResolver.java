package com.perm.constraint;

import com.perm.config.RulesConfig;
import com.perm.dates.DateArithmetic;
import com.perm.exception.MalformedInputException;
import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.RequestEntries;
import com.perm.model.RequestEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.perm.dates.DateArithmetic.earliest;
import static com.perm.model.DateField.*;

/**
 * Default implementation of ConstraintResolver.
 */
public class DefaultConstraintResolver implements ConstraintResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultConstraintResolver.class);

    /**
     * Fields recording events that have already happened; capped at the reference day.
     */
    private static final Set<DateField> PAST_EVENT_FIELDS = EnumSet.of(
            PWD_FILING_DATE, PWD_DETERMINATION_DATE,
            ETA9089_FILING_DATE, ETA9089_AUDIT_DATE, ETA9089_CERTIFICATION_DATE,
            I140_FILING_DATE, I140_RECEIPT_DATE, I140_APPROVAL_DATE, I140_DENIAL_DATE,
            RFI_RECEIVED_DATE, RFI_RESPONSE_SUBMITTED_DATE,
            RFE_RECEIVED_DATE, RFE_RESPONSE_SUBMITTED_DATE);

    private final DateArithmetic arithmetic;
    private final RecruitmentTimeline timeline;
    private final RulesConfig config;

    public DefaultConstraintResolver(DateArithmetic arithmetic, RecruitmentTimeline timeline, RulesConfig config) {
        this.arithmetic = arithmetic;
        this.timeline = timeline;
        this.config = config;
    }

    @Override
    public DateConstraint resolveConstraints(DateField field, CaseDateFacts facts, ResolveOptions options) {
        DateConstraint constraint = resolve(field, facts, options);
        if (options.asOf() != null && PAST_EVENT_FIELDS.contains(field)) {
            constraint = capAt(constraint, options.asOf());
        }
        log.debug("Resolved {}: min={}, max={}, factor={}",
                field.wireName(), constraint.min(), constraint.max(), constraint.limitingFactor());
        return constraint;
    }

    @Override
    public Map<DateField, DateConstraint> resolveAll(CaseDateFacts facts, ResolveOptions options) {
        Map<DateField, DateConstraint> result = new EnumMap<>(DateField.class);
        for (DateField field : DateField.values()) {
            if (!field.isEntryScoped()) {
                result.put(field, resolveConstraints(field, facts, options));
            }
        }
        return result;
    }

    private DateConstraint resolve(DateField field, CaseDateFacts facts, ResolveOptions options) {
        return switch (field) {
            case PWD_FILING_DATE -> before(facts.date(PWD_DETERMINATION_DATE), "determination",
                    "Enter PWD determination date to bound filing date");
            case PWD_DETERMINATION_DATE -> after(facts.date(PWD_FILING_DATE), "PWD filing",
                    "Enter PWD filing date first");
            case PWD_EXPIRATION_DATE -> after(facts.date(PWD_DETERMINATION_DATE), "PWD determination",
                    "Calculated from determination date");

            case SUNDAY_AD_FIRST_DATE, JOB_ORDER_START_DATE, NOTICE_OF_FILING_START_DATE,
                    ADDITIONAL_RECRUITMENT_START_DATE -> recruitmentStep(field, facts,
                    facts.date(PWD_DETERMINATION_DATE), "PWD determination");
            case SUNDAY_AD_SECOND_DATE -> secondSundayAd(facts);
            case ADDITIONAL_RECRUITMENT_END_DATE -> facts.has(ADDITIONAL_RECRUITMENT_START_DATE)
                    ? recruitmentStep(field, facts, facts.date(ADDITIONAL_RECRUITMENT_START_DATE), "additional recruitment start")
                    : recruitmentStep(field, facts, facts.date(PWD_DETERMINATION_DATE), "PWD determination");
            case JOB_ORDER_END_DATE -> jobOrderEnd(facts);
            case NOTICE_OF_FILING_END_DATE -> noticeEnd(facts);

            case ETA9089_FILING_DATE -> eta9089Filing(facts);
            case ETA9089_AUDIT_DATE -> after(facts.date(ETA9089_FILING_DATE), "ETA 9089 filing",
                    "Enter filing date first");
            case ETA9089_CERTIFICATION_DATE -> facts.has(ETA9089_AUDIT_DATE)
                    ? after(facts.date(ETA9089_AUDIT_DATE), "audit", "")
                    : after(facts.date(ETA9089_FILING_DATE), "ETA 9089 filing", "Enter filing date first");
            case ETA9089_EXPIRATION_DATE -> after(facts.date(ETA9089_CERTIFICATION_DATE), "certification",
                    "Calculated from certification date");

            case I140_FILING_DATE -> i140Filing(facts);
            case I140_RECEIPT_DATE -> after(facts.date(I140_FILING_DATE), "I-140 filing",
                    "Enter I-140 filing date first");
            case I140_APPROVAL_DATE, I140_DENIAL_DATE -> facts.has(I140_RECEIPT_DATE)
                    ? after(facts.date(I140_RECEIPT_DATE), "I-140 receipt", "")
                    : after(facts.date(I140_FILING_DATE), "I-140 filing", "Enter I-140 filing date first");

            case RFI_RECEIVED_DATE -> after(facts.date(ETA9089_FILING_DATE), "ETA 9089 filing",
                    "Enter ETA 9089 filing date first");
            case RFE_RECEIVED_DATE -> after(facts.date(I140_FILING_DATE), "I-140 filing",
                    "Enter I-140 filing date first");
            case RFI_RESPONSE_DUE_DATE, RFI_RESPONSE_SUBMITTED_DATE ->
                    afterReceived(selectEntry(facts.getRfiEntries(), options.entryId(), "RFI"), "RFI");
            case RFE_RESPONSE_DUE_DATE, RFE_RESPONSE_SUBMITTED_DATE ->
                    afterReceived(selectEntry(facts.getRfeEntries(), options.entryId(), "RFE"), "RFE");
        };
    }

    private DateConstraint after(LocalDate anchor, String label, String missingHint) {
        if (anchor == null) {
            return DateConstraint.unconstrained(missingHint);
        }
        return new DateConstraint(anchor.plusDays(1), null, "Must be after " + label + " (" + anchor + ")", null);
    }

    private DateConstraint before(LocalDate anchor, String label, String missingHint) {
        if (anchor == null) {
            return DateConstraint.unconstrained(missingHint);
        }
        return new DateConstraint(null, anchor.minusDays(1), "Must be before " + label + " (" + anchor + ")", null);
    }

    private DateConstraint recruitmentStep(DateField field, CaseDateFacts facts, LocalDate anchor, String label) {
        LocalDate min = anchor == null ? null : anchor.plusDays(1);
        return withDeadline(field, facts, min, anchor == null
                ? "Enter PWD determination date first"
                : "After " + label + " (" + anchor + ")");
    }

    private DateConstraint secondSundayAd(CaseDateFacts facts) {
        LocalDate first = facts.date(SUNDAY_AD_FIRST_DATE);
        if (first == null) {
            LocalDate determination = facts.date(PWD_DETERMINATION_DATE);
            DateConstraint constraint = withDeadline(SUNDAY_AD_SECOND_DATE, facts,
                    determination == null ? null : determination.plusDays(1), "");
            return new DateConstraint(constraint.min(), constraint.max(),
                    "Enter first Sunday ad date first. Ads must be at least one week apart.",
                    constraint.limitingFactor());
        }
        // The next Sunday, not the day after
        LocalDate min = first.plusDays(config.sundayAdGapDays());
        return withDeadline(SUNDAY_AD_SECOND_DATE, facts, min,
                "Must be a Sunday at least " + config.sundayAdGapDays() + " days after " + first);
    }

    private DateConstraint withDeadline(DateField field, CaseDateFacts facts, LocalDate min, String minHint) {
        BoundedDate deadline = timeline.deadlineFor(field, facts);
        if (deadline == null) {
            return new DateConstraint(min, null, minHint, null);
        }
        String sundayNote = timeline.isSundayField(field) ? ", must be a Sunday" : "";
        String reason = deadline.limitingFactor() == LimitingFactor.RECRUITMENT
                ? timeline.daysAfterFirst(field) + " days from first recruitment"
                : timeline.daysBeforePwd(field) + " days before PWD expiration";
        String hint = (minHint.isEmpty() ? "" : minHint + ". ")
                + "By " + deadline.date() + sundayNote + " (" + reason + ")";
        return new DateConstraint(min, deadline.date(), hint, deadline.limitingFactor());
    }

    private DateConstraint jobOrderEnd(CaseDateFacts facts) {
        LocalDate start = facts.date(JOB_ORDER_START_DATE);
        if (start == null) {
            return DateConstraint.unconstrained("Calculated +" + config.jobOrderMinDays()
                    + " days from start. Enter start date first.");
        }
        LocalDate min = start.plusDays(config.jobOrderMinDays());
        return new DateConstraint(min, null,
                "Minimum " + config.jobOrderMinDays() + " days required. Earliest: " + min, null);
    }

    private DateConstraint noticeEnd(CaseDateFacts facts) {
        LocalDate start = facts.date(NOTICE_OF_FILING_START_DATE);
        if (start == null) {
            return DateConstraint.unconstrained("Calculated +" + config.noticeMinBusinessDays()
                    + " business days from start. Enter start date first.");
        }
        LocalDate min = arithmetic.addBusinessDays(start, config.noticeMinBusinessDays());
        return new DateConstraint(min, null,
                "Minimum " + config.noticeMinBusinessDays() + " business days required. Earliest: " + min, null);
    }

    private DateConstraint eta9089Filing(CaseDateFacts facts) {
        LocalDate last = timeline.lastRecruitmentDate(facts);
        LocalDate first = timeline.firstRecruitmentDate(facts);
        LocalDate min = last == null ? null : last.plusDays(config.filingWindowWaitDays());
        BoundedDate close = RecruitmentTimeline.tighter(
                first == null ? null : first.plusDays(config.filingWindowCloseDays()),
                facts.date(PWD_EXPIRATION_DATE));

        String hint;
        if (min != null && close != null) {
            hint = "Filing window: " + min + " to " + close.date()
                    + (close.isPwdLimited() ? " (limited by PWD expiration)" : "");
        } else if (last != null && first == null) {
            hint = "Enter first recruitment start date to calculate window close.";
        } else if (first != null) {
            hint = "Complete recruitment end dates to open filing window.";
        } else {
            hint = "Complete recruitment dates first. Window: " + config.filingWindowWaitDays()
                    + " days after last recruitment to " + config.filingWindowCloseDays() + " days after first.";
        }
        return new DateConstraint(min, close == null ? null : close.date(), hint,
                close == null ? null : close.limitingFactor());
    }

    private DateConstraint i140Filing(CaseDateFacts facts) {
        LocalDate certification = facts.date(ETA9089_CERTIFICATION_DATE);
        if (certification == null) {
            return DateConstraint.unconstrained(
                    "Enter ETA 9089 certification date first. Filing must be after certification.");
        }
        LocalDate max = earliest(certification.plusDays(config.i140FilingWindowDays()),
                facts.date(ETA9089_EXPIRATION_DATE));
        return new DateConstraint(certification.plusDays(1), max,
                "Must be after " + certification + ", within " + config.i140FilingWindowDays()
                        + " days of certification", null);
    }

    private <T extends RequestEntry<T>> Optional<T> selectEntry(List<T> entries, String entryId, String kind) {
        if (entryId == null) {
            return RequestEntries.firstPending(entries);
        }
        Optional<T> entry = RequestEntries.findById(entries, entryId);
        if (entry.isEmpty()) {
            throw new MalformedInputException("Unknown " + kind + " entry: " + entryId);
        }
        return entry;
    }

    private DateConstraint afterReceived(Optional<? extends RequestEntry<?>> entry, String kind) {
        if (entry.isEmpty()) {
            return DateConstraint.unconstrained("No pending " + kind + " entry");
        }
        return after(entry.get().receivedDate(), kind + " receipt", "Enter " + kind + " received date first");
    }

    /**
     * Cap a past-event field at the reference day. When even the earliest allowed date lies
     * after it, the bounds stay as they are and the hint says so.
     */
    private static DateConstraint capAt(DateConstraint constraint, LocalDate asOf) {
        if (constraint.max() != null && !constraint.max().isAfter(asOf)) {
            return constraint;
        }
        if (constraint.min() != null && constraint.min().isAfter(asOf)) {
            return new DateConstraint(constraint.min(), constraint.max(),
                    withNote(constraint.hint(), "Earliest date " + constraint.min() + " is still in the future"),
                    constraint.limitingFactor());
        }
        return new DateConstraint(constraint.min(), asOf, withNote(constraint.hint(), "Cannot be in the future"), null);
    }

    private static String withNote(String hint, String note) {
        return hint.isEmpty() ? note : hint + ". " + note;
    }
}
