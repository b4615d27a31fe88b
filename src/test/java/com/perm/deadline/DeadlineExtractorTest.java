package com.perm.deadline;

import com.perm.config.RulesConfig;
import com.perm.constraint.FilingWindowCalculator;
import com.perm.constraint.RecruitmentTimeline;
import com.perm.dates.DateArithmetic;
import com.perm.dates.FederalHolidayCalendar;
import com.perm.model.CaseDateFacts;
import com.perm.model.CaseStatus;
import com.perm.model.DateField;
import com.perm.model.RfiEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineExtractorTest {

    private DeadlineExtractor extractor;

    @BeforeEach
    void setUp() {
        RulesConfig config = RulesConfig.defaults();
        RecruitmentTimeline timeline = new RecruitmentTimeline(new DateArithmetic(new FederalHolidayCalendar()), config);
        extractor = new DeadlineExtractor(new DefaultDeadlineActivationEngine(),
                new FilingWindowCalculator(timeline, config), timeline);
    }

    private static CaseDateFacts recruitmentCase() {
        return CaseDateFacts.builder()
                .caseStatus(CaseStatus.RECRUITMENT)
                .date(DateField.PWD_DETERMINATION_DATE, "2024-01-15")
                .date(DateField.PWD_EXPIRATION_DATE, "2025-01-15")
                .date(DateField.SUNDAY_AD_FIRST_DATE, "2024-02-04")
                .date(DateField.SUNDAY_AD_SECOND_DATE, "2024-02-11")
                .date(DateField.JOB_ORDER_START_DATE, "2024-02-01")
                .date(DateField.JOB_ORDER_END_DATE, "2024-03-02")
                .date(DateField.NOTICE_OF_FILING_START_DATE, "2024-02-01")
                .date(DateField.NOTICE_OF_FILING_END_DATE, "2024-02-15")
                .build();
    }

    private static CaseDateFacts certifiedCase() {
        return recruitmentCase().toBuilder()
                .caseStatus(CaseStatus.I140)
                .date(DateField.ETA9089_FILING_DATE, "2024-04-10")
                .date(DateField.ETA9089_CERTIFICATION_DATE, "2024-06-03")
                .date(DateField.ETA9089_EXPIRATION_DATE, "2024-11-30")
                .rfiEntry(RfiEntry.pending("rfi-1", LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31)))
                .build();
    }

    @Test
    @DisplayName("Recruitment-stage deadlines are listed most urgent first")
    void recruitmentStageDeadlines() {
        List<ExtractedDeadline> deadlines = extractor.extractActiveDeadlines(recruitmentCase(), LocalDate.of(2024, 3, 15));

        assertEquals(List.of(DeadlineType.FILING_WINDOW_OPENS, DeadlineType.RECRUITMENT_WINDOW_CLOSES,
                        DeadlineType.FILING_WINDOW_CLOSES, DeadlineType.PWD_EXPIRATION),
                deadlines.stream().map(ExtractedDeadline::type).toList());

        ExtractedDeadline opens = deadlines.get(0);
        assertEquals(LocalDate.of(2024, 4, 1), opens.date());
        assertEquals(17, opens.daysUntil());
        assertEquals("ETA 9089 Filing Window Opens", opens.label());
        assertNull(opens.entryId());
        assertEquals(LocalDate.of(2024, 6, 30), deadlines.get(1).date());
        assertEquals(LocalDate.of(2024, 7, 30), deadlines.get(2).date());
        assertEquals(306, deadlines.get(3).daysUntil());
    }

    @Test
    @DisplayName("After certification only the I-140 and RFI deadlines remain")
    void certifiedCaseDeadlines() {
        List<ExtractedDeadline> deadlines = extractor.extractActiveDeadlines(certifiedCase(), LocalDate.of(2024, 6, 10));

        assertEquals(2, deadlines.size());
        ExtractedDeadline rfi = deadlines.get(0);
        assertEquals(DeadlineType.RFI_DUE, rfi.type());
        assertEquals("rfi-1", rfi.entryId());
        assertEquals(-10, rfi.daysUntil());
        assertTrue(rfi.isOverdue());

        ExtractedDeadline i140 = deadlines.get(1);
        assertEquals(DeadlineType.I140_FILING_DEADLINE, i140.type());
        assertEquals(LocalDate.of(2024, 11, 30), i140.date());
        assertEquals(173, i140.daysUntil());
    }

    @Test
    @DisplayName("Before recruitment starts only the PWD expiration is extracted")
    void noWindowDeadlinesBeforeRecruitment() {
        CaseDateFacts facts = CaseDateFacts.builder()
                .date(DateField.PWD_DETERMINATION_DATE, "2024-06-30")
                .date(DateField.PWD_EXPIRATION_DATE, "2025-06-30")
                .build();

        List<ExtractedDeadline> deadlines = extractor.extractActiveDeadlines(facts, LocalDate.of(2025, 6, 1));

        assertEquals(List.of(DeadlineType.PWD_EXPIRATION), deadlines.stream().map(ExtractedDeadline::type).toList());
        assertFalse(extractor.shouldRemind(DeadlineType.FILING_WINDOW_CLOSES, facts));
        assertFalse(extractor.shouldRemind(DeadlineType.RECRUITMENT_WINDOW_CLOSES, facts));
    }

    @Test
    void closedCaseHasNothingToExtract() {
        CaseDateFacts closed = certifiedCase().toBuilder().caseStatus(CaseStatus.CLOSED).build();

        assertTrue(extractor.extractActiveDeadlines(closed, LocalDate.of(2024, 6, 10)).isEmpty());
        assertTrue(extractor.activeDeadlineTypes(closed).isEmpty());
    }

    @Test
    @DisplayName("An active deadline without a date is not reminded")
    void undatedDeadlineIsNotReminded() {
        CaseDateFacts facts = CaseDateFacts.builder()
                .rfiEntry(RfiEntry.pending("rfi-1", LocalDate.of(2024, 5, 1), null))
                .build();

        assertTrue(extractor.activeDeadlineTypes(facts).contains(DeadlineType.RFI_DUE));
        assertFalse(extractor.shouldRemind(DeadlineType.RFI_DUE, facts));
        assertTrue(extractor.extractActiveDeadlines(facts, LocalDate.of(2024, 5, 2)).stream()
                .noneMatch(d -> d.type() == DeadlineType.RFI_DUE));
    }

    @Test
    void supersededDeadlineIsNotReminded() {
        assertTrue(extractor.shouldRemind(DeadlineType.PWD_EXPIRATION, recruitmentCase()));
        assertFalse(extractor.shouldRemind(DeadlineType.PWD_EXPIRATION, certifiedCase()));
    }
}
