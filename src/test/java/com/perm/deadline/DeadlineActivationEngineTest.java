package com.perm.deadline;

import com.perm.exception.MalformedInputException;
import com.perm.model.CaseDateFacts;
import com.perm.model.CaseStatus;
import com.perm.model.DateField;
import com.perm.model.RfeEntry;
import com.perm.model.RfiEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineActivationEngineTest {

    private final DeadlineActivationEngine engine = new DefaultDeadlineActivationEngine();

    private static RfiEntry answeredRfi(String id) {
        return new RfiEntry(id, 1L, LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31), LocalDate.of(2024, 5, 20));
    }

    private static RfiEntry pendingRfi(String id) {
        return RfiEntry.pending(id, LocalDate.of(2024, 7, 1), LocalDate.of(2024, 7, 31));
    }

    // =====================================================================
    // PWD expiration
    // =====================================================================

    @Test
    void pwdExpirationActive() {
        CaseDateFacts facts = CaseDateFacts.builder().date(DateField.PWD_EXPIRATION_DATE, "2025-06-30").build();

        DeadlineStatus status = engine.isDeadlineActive("pwd_expiration", facts);

        assertTrue(status.active());
        assertNull(status.supersededReason());
    }

    @Test
    void pwdExpirationSupersededByEtaFiling() {
        CaseDateFacts facts = CaseDateFacts.builder()
                .date(DateField.PWD_EXPIRATION_DATE, "2025-06-30")
                .date(DateField.ETA9089_FILING_DATE, "2024-12-01")
                .build();

        assertEquals(DeadlineStatus.superseded(SupersessionReason.ETA9089_FILED),
                engine.isDeadlineActive(DeadlineType.PWD_EXPIRATION, facts));
    }

    @Test
    void pwdExpirationWithoutDate() {
        assertEquals(SupersessionReason.NO_DATE,
                engine.isDeadlineActive(DeadlineType.PWD_EXPIRATION, CaseDateFacts.builder().build()).supersededReason());
    }

    // =====================================================================
    // Windows and I-140
    // =====================================================================

    @ParameterizedTest
    @EnumSource(value = DeadlineType.class, names = {"FILING_WINDOW_OPENS", "FILING_WINDOW_CLOSES", "RECRUITMENT_WINDOW_CLOSES"})
    void windowsCloseOnceEtaIsFiled(DeadlineType type) {
        CaseDateFacts open = CaseDateFacts.builder().date(DateField.SUNDAY_AD_FIRST_DATE, "2024-02-04").build();
        CaseDateFacts filed = open.toBuilder().date(DateField.ETA9089_FILING_DATE, "2024-04-10").build();

        assertTrue(engine.isDeadlineActive(type, open).active());
        assertEquals(SupersessionReason.ETA9089_FILED, engine.isDeadlineActive(type, filed).supersededReason());
    }

    @Test
    @DisplayName("I-140 deadline needs both certification and expiration dates")
    void i140NeedsCertification() {
        CaseDateFacts certifiedOnly = CaseDateFacts.builder()
                .date(DateField.ETA9089_CERTIFICATION_DATE, "2024-06-01").build();
        CaseDateFacts filedNotCertified = CaseDateFacts.builder()
                .date(DateField.ETA9089_FILING_DATE, "2024-04-10").build();

        assertEquals(SupersessionReason.NOT_CERTIFIED,
                engine.isDeadlineActive("i140_filing_deadline", certifiedOnly).supersededReason());
        assertEquals(SupersessionReason.NOT_CERTIFIED,
                engine.isDeadlineActive(DeadlineType.I140_FILING_DEADLINE, filedNotCertified).supersededReason());
    }

    @Test
    void i140ActiveUntilFiled() {
        CaseDateFacts certified = CaseDateFacts.builder()
                .date(DateField.ETA9089_CERTIFICATION_DATE, "2024-06-01")
                .date(DateField.ETA9089_EXPIRATION_DATE, "2024-11-28")
                .build();
        CaseDateFacts filed = certified.toBuilder().date(DateField.I140_FILING_DATE, "2024-07-01").build();

        assertTrue(engine.isDeadlineActive(DeadlineType.I140_FILING_DEADLINE, certified).active());
        assertEquals(SupersessionReason.I140_FILED,
                engine.isDeadlineActive(DeadlineType.I140_FILING_DEADLINE, filed).supersededReason());
    }

    // =====================================================================
    // RFI / RFE
    // =====================================================================

    @Test
    @DisplayName("First responded, second pending: RFI due is active and the second entry is returned")
    void secondRfiPending() {
        List<RfiEntry> entries = List.of(answeredRfi("rfi-1"), pendingRfi("rfi-2"));
        CaseDateFacts facts = CaseDateFacts.builder().rfiEntries(entries).build();

        assertTrue(engine.isDeadlineActive(DeadlineType.RFI_DUE, facts).active());
        assertEquals("rfi-2", engine.getActiveRfiEntry(entries).orElseThrow().id());
    }

    @Test
    @DisplayName("A pending entry anywhere in the list keeps the deadline active")
    void pendingEntryPositionDoesNotMatter() {
        List<RfiEntry> entries = List.of(pendingRfi("rfi-1"), answeredRfi("rfi-2"));
        CaseDateFacts facts = CaseDateFacts.builder().rfiEntries(entries).build();

        assertTrue(engine.isDeadlineActive(DeadlineType.RFI_DUE, facts).active());
        assertEquals("rfi-1", engine.getActiveRfiEntry(entries).orElseThrow().id());
    }

    @Test
    void allRfisAnswered() {
        CaseDateFacts facts = CaseDateFacts.builder().rfiEntry(answeredRfi("rfi-1")).build();

        assertEquals(SupersessionReason.RFI_RESPONDED,
                engine.isDeadlineActive(DeadlineType.RFI_DUE, facts).supersededReason());
        assertTrue(engine.getActiveRfiEntry(facts.getRfiEntries()).isEmpty());
    }

    @Test
    @DisplayName("No entries at all is reported as responded")
    void noEntriesCountsAsResponded() {
        CaseDateFacts facts = CaseDateFacts.builder().build();

        assertEquals(SupersessionReason.RFI_RESPONDED,
                engine.isDeadlineActive(DeadlineType.RFI_DUE, facts).supersededReason());
        assertEquals(SupersessionReason.RFE_RESPONDED,
                engine.isDeadlineActive(DeadlineType.RFE_DUE, facts).supersededReason());
        assertTrue(engine.getActiveRfeEntry(List.of()).isEmpty());
        assertTrue(engine.getActiveRfeEntry(null).isEmpty());
    }

    @Test
    void pendingRfe() {
        RfeEntry pending = RfeEntry.pending("rfe-1", LocalDate.of(2024, 9, 1), null);
        CaseDateFacts facts = CaseDateFacts.builder().rfeEntry(pending).build();

        assertTrue(engine.isDeadlineActive(DeadlineType.RFE_DUE, facts).active());
        assertEquals(pending, engine.getActiveRfeEntry(facts.getRfeEntries()).orElseThrow());
    }

    // =====================================================================
    // Global filters
    // =====================================================================

    @ParameterizedTest
    @EnumSource(DeadlineType.class)
    void closedCaseHasNoActiveDeadline(DeadlineType type) {
        CaseDateFacts facts = activeEverywhere().toBuilder()
                .caseStatus(CaseStatus.CLOSED)
                .deletedAt(Instant.parse("2024-06-01T00:00:00Z"))
                .build();

        assertEquals(DeadlineStatus.superseded(SupersessionReason.CASE_CLOSED), engine.isDeadlineActive(type, facts));
    }

    @ParameterizedTest
    @EnumSource(DeadlineType.class)
    void deletedCaseHasNoActiveDeadline(DeadlineType type) {
        CaseDateFacts facts = activeEverywhere().toBuilder()
                .deletedAt(Instant.parse("2024-06-01T00:00:00Z"))
                .build();

        assertEquals(SupersessionReason.CASE_DELETED, engine.isDeadlineActive(type, facts).supersededReason());
    }

    @ParameterizedTest
    @EnumSource(DeadlineType.class)
    @DisplayName("Every deadline type yields exactly one of active or a reason")
    void everyTypeIsDecided(DeadlineType type) {
        for (CaseDateFacts facts : List.of(CaseDateFacts.builder().build(), activeEverywhere())) {
            DeadlineStatus status = engine.isDeadlineActive(type, facts);
            assertNotNull(status);
            assertEquals(status.active(), status.supersededReason() == null);
        }
    }

    @Test
    void hasAnyActiveDeadline() {
        CaseDateFacts allFiled = CaseDateFacts.builder()
                .date(DateField.ETA9089_FILING_DATE, "2024-04-10")
                .build();

        assertTrue(engine.hasAnyActiveDeadline(activeEverywhere()));
        assertFalse(engine.hasAnyActiveDeadline(allFiled));
        assertFalse(engine.hasAnyActiveDeadline(activeEverywhere().toBuilder().caseStatus(CaseStatus.CLOSED).build()));
    }

    @Test
    void unknownDeadlineType() {
        assertThrows(MalformedInputException.class,
                () -> engine.isDeadlineActive("visa_bulletin", CaseDateFacts.builder().build()));
    }

    @Test
    void statusInvariant() {
        assertThrows(IllegalArgumentException.class, () -> new DeadlineStatus(true, SupersessionReason.NO_DATE));
        assertThrows(IllegalArgumentException.class, () -> new DeadlineStatus(false, null));
    }

    @Test
    void statusFactories() {
        DeadlineStatus active = DeadlineStatus.activeStatus();
        assertTrue(active.active());
        assertNull(active.supersededReason());

        DeadlineStatus superseded = DeadlineStatus.superseded(SupersessionReason.I140_FILED);
        assertFalse(superseded.active());
        assertEquals(SupersessionReason.I140_FILED, superseded.supersededReason());
    }

    private static CaseDateFacts activeEverywhere() {
        return CaseDateFacts.builder()
                .date(DateField.PWD_EXPIRATION_DATE, "2025-06-30")
                .date(DateField.ETA9089_CERTIFICATION_DATE, "2024-06-01")
                .date(DateField.ETA9089_EXPIRATION_DATE, "2024-11-28")
                .rfiEntry(pendingRfi("rfi-1"))
                .rfeEntry(RfeEntry.pending("rfe-1", LocalDate.of(2024, 9, 1), LocalDate.of(2024, 10, 1)))
                .build();
    }
}
