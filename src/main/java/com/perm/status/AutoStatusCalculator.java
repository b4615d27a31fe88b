package com.perm.status;

import com.perm.constraint.FilingWindowCalculator;
import com.perm.model.CaseDateFacts;
import com.perm.model.CaseStatus;
import com.perm.model.DateField;
import com.perm.model.ProgressStatus;
import com.perm.model.RequestEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Derives the case stage from its milestones, most advanced milestone first.
 * <p>
 * Pending RFE/RFI responses take precedence over every other milestone.
 */
public class AutoStatusCalculator {

    private static final Logger log = LoggerFactory.getLogger(AutoStatusCalculator.class);

    private final RecruitmentCompleteness completeness;
    private final FilingWindowCalculator filingWindow;

    public AutoStatusCalculator(RecruitmentCompleteness completeness, FilingWindowCalculator filingWindow) {
        this.completeness = completeness;
        this.filingWindow = filingWindow;
    }

    /**
     * @param facts Case snapshot
     * @param asOf  Day used to decide whether the ETA 9089 filing window has opened
     */
    public AutoStatus calculate(CaseDateFacts facts, LocalDate asOf) {
        AutoStatus status = derive(facts, asOf);
        log.debug("Derived status {}/{}", status.caseStatus().wireName(), status.progressStatus().wireName());
        return status;
    }

    private AutoStatus derive(CaseDateFacts facts, LocalDate asOf) {
        if (hasOpenRequest(facts.getRfeEntries())) {
            return AutoStatus.of(CaseStatus.I140, ProgressStatus.RFI_RFE);
        }
        if (hasOpenRequest(facts.getRfiEntries())) {
            return AutoStatus.of(CaseStatus.ETA9089, ProgressStatus.RFI_RFE);
        }
        if (facts.has(DateField.I140_APPROVAL_DATE)) {
            return AutoStatus.of(CaseStatus.I140, ProgressStatus.APPROVED);
        }
        if (facts.has(DateField.I140_DENIAL_DATE)) {
            return AutoStatus.of(CaseStatus.CLOSED, ProgressStatus.APPROVED);
        }
        if (facts.has(DateField.I140_FILING_DATE)) {
            return AutoStatus.of(CaseStatus.I140, ProgressStatus.FILED);
        }
        if (facts.has(DateField.ETA9089_CERTIFICATION_DATE)) {
            return AutoStatus.of(CaseStatus.I140, ProgressStatus.WORKING);
        }
        if (facts.has(DateField.ETA9089_FILING_DATE)) {
            return AutoStatus.of(CaseStatus.ETA9089, ProgressStatus.FILED);
        }
        if (facts.has(DateField.PWD_DETERMINATION_DATE)) {
            if (!completeness.isComplete(facts)) {
                return AutoStatus.of(CaseStatus.RECRUITMENT, ProgressStatus.WORKING);
            }
            Optional<LocalDate> opens = filingWindow.opens(facts);
            boolean windowOpen = opens.isPresent() && !opens.get().isAfter(asOf);
            return windowOpen
                    ? AutoStatus.of(CaseStatus.ETA9089, ProgressStatus.WORKING)
                    : AutoStatus.of(CaseStatus.RECRUITMENT, ProgressStatus.FILED);
        }
        if (facts.has(DateField.PWD_FILING_DATE)) {
            return AutoStatus.of(CaseStatus.PWD, ProgressStatus.FILED);
        }
        return AutoStatus.of(CaseStatus.PWD, ProgressStatus.WORKING);
    }

    /**
     * A request counts once it has been received and until it is answered.
     */
    private static boolean hasOpenRequest(List<? extends RequestEntry<?>> entries) {
        for (RequestEntry<?> entry : entries) {
            if (entry.receivedDate() != null && entry.isPending()) {
                return true;
            }
        }
        return false;
    }
}
