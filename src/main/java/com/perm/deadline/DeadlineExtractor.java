package com.perm.deadline;

import com.perm.constraint.BoundedDate;
import com.perm.constraint.FilingWindowCalculator;
import com.perm.constraint.RecruitmentTimeline;
import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.RequestEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Lists the deadlines of a case that are both active and dated, for dashboards,
 * calendars and reminder dispatch.
 */
public class DeadlineExtractor {

    private static final Logger log = LoggerFactory.getLogger(DeadlineExtractor.class);

    private final DeadlineActivationEngine activationEngine;
    private final FilingWindowCalculator filingWindow;
    private final RecruitmentTimeline timeline;

    public DeadlineExtractor(DeadlineActivationEngine activationEngine, FilingWindowCalculator filingWindow,
                             RecruitmentTimeline timeline) {
        this.activationEngine = activationEngine;
        this.filingWindow = filingWindow;
        this.timeline = timeline;
    }

    /**
     * Active, dated deadlines sorted most urgent first.
     *
     * @param facts Case snapshot
     * @param today Reference day for {@code daysUntil}
     */
    public List<ExtractedDeadline> extractActiveDeadlines(CaseDateFacts facts, LocalDate today) {
        List<ExtractedDeadline> deadlines = new ArrayList<>();
        for (DeadlineType type : DeadlineType.values()) {
            if (!activationEngine.isDeadlineActive(type, facts).active()) {
                continue;
            }
            dateOf(type, facts).ifPresent(dated -> deadlines.add(new ExtractedDeadline(
                    type, type.label(), dated.date(), ChronoUnit.DAYS.between(today, dated.date()), dated.entryId())));
        }
        deadlines.sort(Comparator.comparingLong(ExtractedDeadline::daysUntil));
        log.debug("Extracted {} active deadlines", deadlines.size());
        return deadlines;
    }

    /**
     * Deadline types currently active, dated or not.
     */
    public List<DeadlineType> activeDeadlineTypes(CaseDateFacts facts) {
        List<DeadlineType> types = new ArrayList<>();
        for (DeadlineType type : DeadlineType.values()) {
            if (activationEngine.isDeadlineActive(type, facts).active()) {
                types.add(type);
            }
        }
        return types;
    }

    /**
     * Whether a reminder may be sent: the deadline is active and has a date.
     */
    public boolean shouldRemind(DeadlineType type, CaseDateFacts facts) {
        return activationEngine.isDeadlineActive(type, facts).active() && dateOf(type, facts).isPresent();
    }

    private record Dated(LocalDate date, String entryId) {
    }

    private Optional<Dated> dateOf(DeadlineType type, CaseDateFacts facts) {
        return switch (type) {
            case PWD_EXPIRATION -> caseDate(facts.date(DateField.PWD_EXPIRATION_DATE));
            case FILING_WINDOW_OPENS -> filingWindow.opens(facts).map(d -> new Dated(d, null));
            case FILING_WINDOW_CLOSES -> filingWindow.closes(facts).map(b -> new Dated(b.date(), null));
            case RECRUITMENT_WINDOW_CLOSES -> {
                BoundedDate closes = timeline.recruitmentWindowCloses(facts);
                yield closes == null ? Optional.empty() : caseDate(closes.date());
            }
            case I140_FILING_DEADLINE -> caseDate(facts.date(DateField.ETA9089_EXPIRATION_DATE));
            case RFI_DUE -> entryDue(activationEngine.getActiveRfiEntry(facts.getRfiEntries()));
            case RFE_DUE -> entryDue(activationEngine.getActiveRfeEntry(facts.getRfeEntries()));
        };
    }

    private static Optional<Dated> caseDate(LocalDate date) {
        return date == null ? Optional.empty() : Optional.of(new Dated(date, null));
    }

    private static Optional<Dated> entryDue(Optional<? extends RequestEntry<?>> entry) {
        return entry.filter(e -> e.responseDueDate() != null)
                .map(e -> new Dated(e.responseDueDate(), e.id()));
    }
}
