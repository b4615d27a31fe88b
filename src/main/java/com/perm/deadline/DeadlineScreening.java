package com.perm.deadline;

import com.perm.exception.MalformedInputException;
import com.perm.model.CaseDateFacts;
import com.perm.model.CaseFactsFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Evaluates deadlines for many raw case payloads, as done by scheduled jobs.
 * A malformed case is logged and skipped; it never aborts the batch.
 */
public class DeadlineScreening {

    private static final Logger log = LoggerFactory.getLogger(DeadlineScreening.class);

    private final DeadlineActivationEngine activationEngine;
    private final DeadlineExtractor extractor;

    public DeadlineScreening(DeadlineActivationEngine activationEngine, DeadlineExtractor extractor) {
        this.activationEngine = activationEngine;
        this.extractor = extractor;
    }

    /**
     * Screen a batch of cases.
     *
     * @param payloadsById JSON case payloads keyed by case id, in processing order
     * @param today        Reference day
     * @return one result per well-formed case, in input order
     */
    public List<CaseScreening> screen(Map<String, String> payloadsById, LocalDate today) {
        List<CaseScreening> results = new ArrayList<>();
        int skipped = 0;
        for (Map.Entry<String, String> entry : payloadsById.entrySet()) {
            try {
                CaseDateFacts facts = CaseFactsFactory.fromJson(entry.getValue());
                results.add(new CaseScreening(entry.getKey(),
                        activationEngine.hasAnyActiveDeadline(facts),
                        extractor.extractActiveDeadlines(facts, today)));
            } catch (MalformedInputException e) {
                skipped++;
                log.warn("Skipping case {}: {}", entry.getKey(), e.getMessage());
            }
        }
        log.info("Screened {} cases ({} skipped as malformed)", results.size(), skipped);
        return results;
    }
}
