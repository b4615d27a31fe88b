package com.perm.constraint;

import com.perm.config.RulesConfig;
import com.perm.dates.DateArithmetic;
import com.perm.dates.FederalHolidayCalendar;
import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.RecruitmentMethod;
import com.perm.model.RecruitmentMethodEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class FilingWindowCalculatorTest {

    private RecruitmentTimeline timeline;
    private FilingWindowCalculator calculator;

    @BeforeEach
    void setUp() {
        RulesConfig config = RulesConfig.defaults();
        timeline = new RecruitmentTimeline(new DateArithmetic(new FederalHolidayCalendar()), config);
        calculator = new FilingWindowCalculator(timeline, config);
    }

    private static CaseDateFacts recruitmentCase() {
        return CaseDateFacts.builder()
                .date(DateField.PWD_EXPIRATION_DATE, "2025-01-15")
                .date(DateField.SUNDAY_AD_FIRST_DATE, "2024-02-04")
                .date(DateField.SUNDAY_AD_SECOND_DATE, "2024-02-11")
                .date(DateField.JOB_ORDER_START_DATE, "2024-02-01")
                .date(DateField.JOB_ORDER_END_DATE, "2024-03-02")
                .date(DateField.NOTICE_OF_FILING_START_DATE, "2024-02-01")
                .date(DateField.NOTICE_OF_FILING_END_DATE, "2024-02-15")
                .build();
    }

    // =====================================================================
    // Recruitment timeline
    // =====================================================================

    @Test
    void firstAndLastRecruitmentDates() {
        CaseDateFacts facts = recruitmentCase();

        assertEquals(LocalDate.of(2024, 2, 1), timeline.firstRecruitmentDate(facts));
        assertEquals(LocalDate.of(2024, 3, 2), timeline.lastRecruitmentDate(facts));
    }

    @Test
    @DisplayName("Professional recruitment dates extend the last recruitment date")
    void professionalMethodsExtendLastDate() {
        CaseDateFacts facts = recruitmentCase().toBuilder()
                .professionalOccupation(true)
                .additionalRecruitmentMethod(RecruitmentMethodEntry.of(RecruitmentMethod.JOB_FAIR, LocalDate.of(2024, 3, 20)))
                .build();
        CaseDateFacts nonProfessional = facts.toBuilder().professionalOccupation(false).build();

        assertEquals(LocalDate.of(2024, 3, 20), timeline.lastRecruitmentDate(facts));
        assertEquals(LocalDate.of(2024, 3, 2), timeline.lastRecruitmentDate(nonProfessional));
    }

    @Test
    void recruitmentWindowCloses() {
        BoundedDate closes = timeline.recruitmentWindowCloses(recruitmentCase());

        assertEquals(LocalDate.of(2024, 6, 30), closes.date());
        assertEquals(LimitingFactor.RECRUITMENT, closes.limitingFactor());
    }

    @Test
    void tiesGoToRecruitment() {
        LocalDate day = LocalDate.of(2024, 6, 1);

        assertEquals(LimitingFactor.RECRUITMENT, RecruitmentTimeline.tighter(day, day).limitingFactor());
        assertEquals(LimitingFactor.PWD, RecruitmentTimeline.tighter(day.plusDays(1), day).limitingFactor());
        assertNull(RecruitmentTimeline.tighter(null, null));
    }

    // =====================================================================
    // Filing window
    // =====================================================================

    @Test
    void calculatesWindow() {
        FilingWindow window = calculator.calculate(recruitmentCase()).orElseThrow();

        assertEquals(LocalDate.of(2024, 4, 1), window.opens());
        assertEquals(LocalDate.of(2024, 7, 30), window.closes());
        assertFalse(window.pwdLimited());
        assertTrue(window.isValid());
    }

    @Test
    void noWindowWithoutRecruitment() {
        CaseDateFacts facts = CaseDateFacts.builder().date(DateField.PWD_EXPIRATION_DATE, "2025-01-15").build();

        assertTrue(calculator.calculate(facts).isEmpty());
        assertTrue(calculator.opens(facts).isEmpty());
        assertTrue(calculator.closes(facts).isEmpty());
        assertNull(timeline.recruitmentWindowCloses(facts));
    }

    @Test
    void waitingStatus() {
        FilingWindowStatus status = calculator.status(recruitmentCase(), LocalDate.of(2024, 3, 15));

        assertEquals(FilingWindowStatus.State.WAITING, status.state());
        assertEquals(17, status.daysUntilOpen());
        assertNull(status.daysRemaining());
        assertEquals("Must wait 17 days before filing", status.message());
    }

    @Test
    void openStatus() {
        FilingWindowStatus status = calculator.status(recruitmentCase(), LocalDate.of(2024, 7, 29));

        assertEquals(FilingWindowStatus.State.OPEN, status.state());
        assertEquals(1, status.daysRemaining());
        assertEquals("Ready to file, 1 day remaining", status.message());
    }

    @Test
    void closedStatus() {
        FilingWindowStatus status = calculator.status(recruitmentCase(), LocalDate.of(2024, 7, 31));

        assertEquals(FilingWindowStatus.State.CLOSED, status.state());
        assertNotNull(status.window());
    }

    @Test
    @DisplayName("A window truncated before it opens is reported as invalid")
    void invalidWindow() {
        CaseDateFacts facts = recruitmentCase().toBuilder()
                .date(DateField.PWD_EXPIRATION_DATE, "2024-03-15")
                .build();

        FilingWindow window = calculator.calculate(facts).orElseThrow();
        FilingWindowStatus status = calculator.status(facts, LocalDate.of(2024, 3, 1));

        assertTrue(window.pwdLimited());
        assertFalse(window.isValid());
        assertEquals(FilingWindowStatus.State.CLOSED, status.state());
        assertTrue(status.message().startsWith("Filing window is invalid"));
    }

    @Test
    void incompleteRecruitmentStatus() {
        FilingWindowStatus status = calculator.status(CaseDateFacts.builder().build(), LocalDate.of(2024, 3, 1));

        assertEquals(FilingWindowStatus.State.CLOSED, status.state());
        assertNull(status.window());
    }
}
