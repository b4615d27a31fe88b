package com.perm.status;

import com.perm.config.RulesConfig;
import com.perm.constraint.FilingWindowCalculator;
import com.perm.constraint.RecruitmentTimeline;
import com.perm.dates.DateArithmetic;
import com.perm.dates.FederalHolidayCalendar;
import com.perm.model.CaseDateFacts;
import com.perm.model.CaseStatus;
import com.perm.model.DateField;
import com.perm.model.ProgressStatus;
import com.perm.model.RfeEntry;
import com.perm.model.RfiEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class AutoStatusCalculatorTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 3, 15);

    private AutoStatusCalculator calculator;

    @BeforeEach
    void setUp() {
        RulesConfig config = RulesConfig.defaults();
        RecruitmentTimeline timeline = new RecruitmentTimeline(new DateArithmetic(new FederalHolidayCalendar()), config);
        calculator = new AutoStatusCalculator(new RecruitmentCompleteness(config),
                new FilingWindowCalculator(timeline, config));
    }

    private static CaseDateFacts.Builder recruited() {
        return CaseDateFacts.builder()
                .date(DateField.PWD_FILING_DATE, "2023-11-01")
                .date(DateField.PWD_DETERMINATION_DATE, "2024-01-15")
                .date(DateField.PWD_EXPIRATION_DATE, "2025-01-15")
                .date(DateField.SUNDAY_AD_FIRST_DATE, "2024-02-04")
                .date(DateField.SUNDAY_AD_SECOND_DATE, "2024-02-11")
                .date(DateField.JOB_ORDER_START_DATE, "2024-02-01")
                .date(DateField.JOB_ORDER_END_DATE, "2024-03-02")
                .date(DateField.NOTICE_OF_FILING_START_DATE, "2024-02-01")
                .date(DateField.NOTICE_OF_FILING_END_DATE, "2024-02-15");
    }

    private static CaseDateFacts.Builder certified() {
        return recruited()
                .date(DateField.ETA9089_FILING_DATE, "2024-04-10")
                .date(DateField.ETA9089_CERTIFICATION_DATE, "2024-06-03")
                .date(DateField.ETA9089_EXPIRATION_DATE, "2024-11-30");
    }

    private void assertStatus(CaseStatus caseStatus, ProgressStatus progress, CaseDateFacts facts, LocalDate asOf) {
        AutoStatus status = calculator.calculate(facts, asOf);
        assertEquals(caseStatus, status.caseStatus(), "case status");
        assertEquals(progress, status.progressStatus(), "progress status");
    }

    // ==================== PWD and recruitment ====================

    @Test
    void emptyCaseIsWorkingOnPwd() {
        assertStatus(CaseStatus.PWD, ProgressStatus.WORKING, CaseDateFacts.builder().build(), AS_OF);
    }

    @Test
    void filedPwd() {
        CaseDateFacts facts = CaseDateFacts.builder().date(DateField.PWD_FILING_DATE, "2023-11-01").build();
        assertStatus(CaseStatus.PWD, ProgressStatus.FILED, facts, AS_OF);
    }

    @Test
    @DisplayName("Determined PWD with unfinished recruitment is working on recruitment")
    void incompleteRecruitment() {
        CaseDateFacts facts = recruited().date(DateField.NOTICE_OF_FILING_END_DATE, (LocalDate) null).build();
        assertStatus(CaseStatus.RECRUITMENT, ProgressStatus.WORKING, facts, AS_OF);
    }

    @ParameterizedTest(name = "as of {0}: {1}/{2}")
    @CsvSource({
            "2024-03-15, RECRUITMENT, FILED",
            "2024-03-31, RECRUITMENT, FILED",
            "2024-04-01, ETA9089, WORKING",
            "2024-05-01, ETA9089, WORKING"
    })
    @DisplayName("Complete recruitment moves to ETA 9089 once the filing window opens")
    void completeRecruitmentFollowsFilingWindow(LocalDate asOf, CaseStatus caseStatus, ProgressStatus progress) {
        assertStatus(caseStatus, progress, recruited().build(), asOf);
    }

    // ==================== ETA 9089 and I-140 ====================

    @Test
    void filedEta9089() {
        CaseDateFacts facts = recruited().date(DateField.ETA9089_FILING_DATE, "2024-04-10").build();
        assertStatus(CaseStatus.ETA9089, ProgressStatus.FILED, facts, AS_OF);
    }

    @Test
    void certificationStartsI140Work() {
        assertStatus(CaseStatus.I140, ProgressStatus.WORKING, certified().build(), AS_OF);
    }

    @Test
    void filedI140() {
        CaseDateFacts facts = certified().date(DateField.I140_FILING_DATE, "2024-07-01").build();
        assertStatus(CaseStatus.I140, ProgressStatus.FILED, facts, AS_OF);
    }

    @Test
    void approvedI140() {
        CaseDateFacts facts = certified()
                .date(DateField.I140_FILING_DATE, "2024-07-01")
                .date(DateField.I140_APPROVAL_DATE, "2024-09-01")
                .build();
        assertStatus(CaseStatus.I140, ProgressStatus.APPROVED, facts, AS_OF);
    }

    @Test
    void deniedI140ClosesTheCase() {
        CaseDateFacts facts = certified()
                .date(DateField.I140_FILING_DATE, "2024-07-01")
                .date(DateField.I140_DENIAL_DATE, "2024-09-01")
                .build();
        assertStatus(CaseStatus.CLOSED, ProgressStatus.APPROVED, facts, AS_OF);
    }

    // ==================== RFI / RFE ====================

    @Test
    @DisplayName("An open RFI puts the case back into ETA 9089")
    void openRfi() {
        CaseDateFacts facts = certified()
                .rfiEntry(RfiEntry.pending("rfi-1", LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31)))
                .build();
        assertStatus(CaseStatus.ETA9089, ProgressStatus.RFI_RFE, facts, AS_OF);
    }

    @Test
    @DisplayName("An open RFE outranks an open RFI and an approval")
    void openRfeWins() {
        CaseDateFacts facts = certified()
                .date(DateField.I140_APPROVAL_DATE, "2024-09-01")
                .rfiEntry(RfiEntry.pending("rfi-1", LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31)))
                .rfeEntry(RfeEntry.pending("rfe-1", LocalDate.of(2024, 8, 1), LocalDate.of(2024, 10, 1)))
                .build();
        assertStatus(CaseStatus.I140, ProgressStatus.RFI_RFE, facts, AS_OF);
    }

    @Test
    void answeredOrUnreceivedRequestsAreIgnored() {
        CaseDateFacts facts = certified()
                .rfiEntry(new RfiEntry("rfi-1", 1L, LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31),
                        LocalDate.of(2024, 5, 20)))
                .rfeEntry(RfeEntry.pending("rfe-1", null, LocalDate.of(2024, 10, 1)))
                .build();
        assertStatus(CaseStatus.I140, ProgressStatus.WORKING, facts, AS_OF);
    }

    @Test
    void openRequestBehindAnsweredOneStillCounts() {
        CaseDateFacts facts = certified()
                .rfiEntry(new RfiEntry("rfi-1", 1L, LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31),
                        LocalDate.of(2024, 5, 20)))
                .rfiEntry(RfiEntry.pending("rfi-2", LocalDate.of(2024, 6, 1), LocalDate.of(2024, 7, 1)))
                .build();
        assertStatus(CaseStatus.ETA9089, ProgressStatus.RFI_RFE, facts, AS_OF);
    }
}
