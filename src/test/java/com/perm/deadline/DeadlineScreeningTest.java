package com.perm.deadline;

import com.perm.config.RulesConfig;
import com.perm.constraint.FilingWindowCalculator;
import com.perm.constraint.RecruitmentTimeline;
import com.perm.dates.DateArithmetic;
import com.perm.dates.FederalHolidayCalendar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineScreeningTest {

    private final DeadlineScreening screening = createScreening();

    private static DeadlineScreening createScreening() {
        RulesConfig config = RulesConfig.defaults();
        RecruitmentTimeline timeline = new RecruitmentTimeline(new DateArithmetic(new FederalHolidayCalendar()), config);
        DeadlineActivationEngine engine = new DefaultDeadlineActivationEngine();
        return new DeadlineScreening(engine,
                new DeadlineExtractor(engine, new FilingWindowCalculator(timeline, config), timeline));
    }

    @Test
    @DisplayName("Malformed cases are skipped without aborting the batch")
    void malformedCasesAreSkipped() {
        Map<String, String> payloads = new LinkedHashMap<>();
        payloads.put("case-1", "{\"pwdExpirationDate\": \"2025-06-30\"}");
        payloads.put("case-2", "{\"pwdExpirationDate\": \"2025-06-31\"}");
        payloads.put("case-3", "{\"caseStatus\": \"closed\", \"pwdExpirationDate\": \"2025-06-30\"}");
        payloads.put("case-4", "not json");

        List<CaseScreening> results = screening.screen(payloads, LocalDate.of(2025, 6, 1));

        assertEquals(2, results.size());
        CaseScreening first = results.get(0);
        assertEquals("case-1", first.caseId());
        assertTrue(first.anyActive());
        assertEquals(1, first.activeDeadlines().size());
        assertEquals(29, first.activeDeadlines().get(0).daysUntil());

        CaseScreening closed = results.get(1);
        assertEquals("case-3", closed.caseId());
        assertFalse(closed.anyActive());
        assertTrue(closed.activeDeadlines().isEmpty());
    }

    @Test
    void emptyBatch() {
        assertTrue(screening.screen(Map.of(), LocalDate.of(2025, 6, 1)).isEmpty());
    }
}
