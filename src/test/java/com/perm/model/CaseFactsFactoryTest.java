package com.perm.model;

import com.perm.exception.MalformedDateException;
import com.perm.exception.MalformedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class CaseFactsFactoryTest {

    @Test
    @DisplayName("Full case payload is mapped onto a snapshot")
    void parsesFixture() throws IOException {
        CaseDateFacts facts = CaseFactsFactory.fromJson(fixture("case-recruitment.json"));

        assertEquals("Acme Corp", facts.getEmployerName());
        assertEquals("Software Engineer", facts.getPositionTitle());
        assertEquals(CaseStatus.RECRUITMENT, facts.getCaseStatus());
        assertEquals(ProgressStatus.WORKING, facts.getProgressStatus());
        assertTrue(facts.isProfessionalOccupation());
        assertEquals(4, facts.getRecruitmentApplicantsCount());
        assertEquals(LocalDate.of(2025, 1, 15), facts.date(DateField.PWD_EXPIRATION_DATE));
        assertEquals(LocalDate.of(2024, 2, 4), facts.date(DateField.SUNDAY_AD_FIRST_DATE));
        assertEquals(3, facts.getAdditionalRecruitmentMethods().size());
        assertEquals(RecruitmentMethod.JOB_FAIR, facts.getAdditionalRecruitmentMethods().get(0).method());
        assertEquals("Campus fair", facts.getAdditionalRecruitmentMethods().get(0).description());
        assertFalse(facts.isDeleted());
    }

    @Test
    void parsesRequestEntriesInOrder() {
        CaseDateFacts facts = CaseFactsFactory.fromJson("""
                {
                  "rfiEntries": [
                    {"id": "rfi-1", "createdAt": 1700000000000, "receivedDate": "2024-05-01",
                     "responseDueDate": "2024-05-31", "responseSubmittedDate": "2024-05-20"},
                    {"id": "rfi-2", "receivedDate": "2024-06-01", "responseDueDate": "2024-07-01"}
                  ],
                  "rfeEntries": [
                    {"id": "rfe-1", "receivedDate": "2024-09-01", "responseDueDate": null}
                  ]
                }
                """);

        assertEquals(2, facts.getRfiEntries().size());
        assertEquals("rfi-1", facts.getRfiEntries().get(0).id());
        assertEquals(1700000000000L, facts.getRfiEntries().get(0).createdAt());
        assertFalse(facts.getRfiEntries().get(0).isPending());
        assertTrue(facts.getRfiEntries().get(1).isPending());
        assertNull(facts.getRfeEntries().get(0).responseDueDate());
    }

    @Test
    void nullAndBlankDatesAreUnset() {
        CaseDateFacts facts = CaseFactsFactory.fromJson("""
                {"pwdFilingDate": null, "pwdDeterminationDate": "", "eta9089FilingDate": "2024-06-01"}
                """);

        assertFalse(facts.has(DateField.PWD_FILING_DATE));
        assertFalse(facts.has(DateField.PWD_DETERMINATION_DATE));
        assertTrue(facts.has(DateField.ETA9089_FILING_DATE));
    }

    @Test
    void deletedAtAcceptsMillisAndIsoInstant() {
        CaseDateFacts fromMillis = CaseFactsFactory.fromJson("{\"deletedAt\": 1718000000000}");
        CaseDateFacts fromIso = CaseFactsFactory.fromJson("{\"deletedAt\": \"2024-06-10T06:13:20Z\"}");

        assertEquals(Instant.ofEpochMilli(1718000000000L), fromMillis.getDeletedAt());
        assertEquals(Instant.parse("2024-06-10T06:13:20Z"), fromIso.getDeletedAt());
        assertTrue(fromIso.isDeleted());
    }

    @Test
    void defaultsWhenStatusMissing() {
        CaseDateFacts facts = CaseFactsFactory.fromJson("{}");

        assertEquals(CaseStatus.PWD, facts.getCaseStatus());
        assertEquals(ProgressStatus.WORKING, facts.getProgressStatus());
        assertTrue(facts.getDates().isEmpty());
    }

    // =====================================================================
    // Malformed payloads
    // =====================================================================

    @Test
    void malformedDate() {
        MalformedDateException e = assertThrows(MalformedDateException.class,
                () -> CaseFactsFactory.fromJson("{\"pwdFilingDate\": \"2024-02-30\"}"));
        assertEquals("2024-02-30", e.getRawValue());
    }

    @Test
    void unknownEnumValues() {
        assertThrows(MalformedInputException.class, () -> CaseFactsFactory.fromJson("{\"caseStatus\": \"pending\"}"));
        assertThrows(MalformedInputException.class, () -> CaseFactsFactory.fromJson(
                "{\"additionalRecruitmentMethods\": [{\"method\": \"billboard\", \"date\": \"2024-02-01\"}]}"));
    }

    @Test
    void notAJsonObject() {
        assertThrows(MalformedInputException.class, () -> CaseFactsFactory.fromJson("[1, 2]"));
        assertThrows(MalformedInputException.class, () -> CaseFactsFactory.fromJson("{ not json"));
        assertThrows(MalformedInputException.class, () -> CaseFactsFactory.fromJson(" "));
    }

    @Test
    void entryWithoutId() {
        assertThrows(MalformedInputException.class, () -> CaseFactsFactory.fromJson(
                "{\"rfiEntries\": [{\"receivedDate\": \"2024-05-01\"}]}"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"several\"", "2.5", "true"})
    void applicantsCountMustBeInteger(String value) {
        assertThrows(MalformedInputException.class, () -> CaseFactsFactory.fromJson(
                "{\"recruitmentApplicantsCount\": " + value + "}"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"yes\"", "1.5", "1", "\"true\""})
    @DisplayName("Professional flag must be a JSON boolean")
    void professionalFlagMustBeBoolean(String value) {
        assertThrows(MalformedInputException.class, () -> CaseFactsFactory.fromJson(
                "{\"isProfessionalOccupation\": " + value + "}"));
    }

    @Test
    void professionalFlagDefaultsToFalse() {
        assertFalse(CaseFactsFactory.fromJson("{}").isProfessionalOccupation());
        assertFalse(CaseFactsFactory.fromJson("{\"isProfessionalOccupation\": null}").isProfessionalOccupation());
        assertFalse(CaseFactsFactory.fromJson("{\"isProfessionalOccupation\": false}").isProfessionalOccupation());
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = CaseFactsFactoryTest.class.getClassLoader().getResourceAsStream(name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
