package com.perm.deadline;

import java.util.List;

/**
 * Deadline summary of one case in a batch run.
 *
 * @param caseId          Case identifier supplied by the caller
 * @param anyActive       Whether any deadline is active
 * @param activeDeadlines Active, dated deadlines, most urgent first
 */
public record CaseScreening(String caseId, boolean anyActive, List<ExtractedDeadline> activeDeadlines) {
}
