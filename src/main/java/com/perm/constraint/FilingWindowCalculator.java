package com.perm.constraint;

import com.perm.config.RulesConfig;
import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Computes the ETA 9089 filing window of a case and where a given day falls in it.
 */
public class FilingWindowCalculator {

    private final RecruitmentTimeline timeline;
    private final RulesConfig config;

    public FilingWindowCalculator(RecruitmentTimeline timeline, RulesConfig config) {
        this.timeline = timeline;
        this.config = config;
    }

    /**
     * Window opening date alone: 30 days after the last recruitment step.
     */
    public Optional<LocalDate> opens(CaseDateFacts facts) {
        LocalDate last = timeline.lastRecruitmentDate(facts);
        return last == null ? Optional.empty() : Optional.of(last.plusDays(config.filingWindowWaitDays()));
    }

    /**
     * Window closing date alone: 180 days after the first recruitment step, capped by PWD expiration.
     * Empty until recruitment has started.
     */
    public Optional<BoundedDate> closes(CaseDateFacts facts) {
        LocalDate first = timeline.firstRecruitmentDate(facts);
        if (first == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(RecruitmentTimeline.tighter(first.plusDays(config.filingWindowCloseDays()),
                facts.date(DateField.PWD_EXPIRATION_DATE)));
    }

    /**
     * Full window, available once both the first and the last recruitment dates are known.
     */
    public Optional<FilingWindow> calculate(CaseDateFacts facts) {
        LocalDate first = timeline.firstRecruitmentDate(facts);
        Optional<LocalDate> opens = opens(facts);
        if (first == null || opens.isEmpty()) {
            return Optional.empty();
        }
        BoundedDate closes = closes(facts).orElseThrow();
        return Optional.of(new FilingWindow(opens.get(), closes.date(), closes.isPwdLimited()));
    }

    /**
     * Describe the window as seen on a reference date.
     */
    public FilingWindowStatus status(CaseDateFacts facts, LocalDate referenceDate) {
        Optional<FilingWindow> calculated = calculate(facts);
        if (calculated.isEmpty()) {
            return new FilingWindowStatus(FilingWindowStatus.State.CLOSED, null, null, null,
                    "Complete recruitment dates to calculate filing window");
        }
        FilingWindow window = calculated.get();
        if (!window.isValid()) {
            return new FilingWindowStatus(FilingWindowStatus.State.CLOSED, window, null, null,
                    "Filing window is invalid (opens after it closes). Review recruitment dates.");
        }
        if (referenceDate.isBefore(window.opens())) {
            int days = (int) ChronoUnit.DAYS.between(referenceDate, window.opens());
            return new FilingWindowStatus(FilingWindowStatus.State.WAITING, window, days, null,
                    "Must wait " + days + (days == 1 ? " day" : " days") + " before filing");
        }
        if (!referenceDate.isAfter(window.closes())) {
            int days = (int) ChronoUnit.DAYS.between(referenceDate, window.closes());
            String pwdNote = window.pwdLimited() ? " (limited by PWD expiration)" : "";
            return new FilingWindowStatus(FilingWindowStatus.State.OPEN, window, null, days,
                    "Ready to file, " + days + (days == 1 ? " day" : " days") + " remaining" + pwdNote);
        }
        return new FilingWindowStatus(FilingWindowStatus.State.CLOSED, window, null, null,
                "Filing window has closed. Recruitment must be restarted.");
    }
}
