package com.perm.deadline;

import com.perm.model.CaseDateFacts;
import com.perm.model.RfeEntry;
import com.perm.model.RfiEntry;

import java.util.List;
import java.util.Optional;

/**
 * Decides which deadlines of a case are still relevant.
 * <p>
 * Closed and deleted cases have no active deadline; otherwise each deadline type
 * is superseded by the filing or response it tracks.
 */
public interface DeadlineActivationEngine {

    /**
     * Evaluate one deadline.
     *
     * @param type  Deadline type
     * @param facts Case snapshot
     * @return active, or inactive with exactly one reason
     */
    DeadlineStatus isDeadlineActive(DeadlineType type, CaseDateFacts facts);

    /**
     * Evaluate a deadline identified by its wire name.
     *
     * @throws com.perm.exception.MalformedInputException for unknown identifiers
     */
    default DeadlineStatus isDeadlineActive(String type, CaseDateFacts facts) {
        return isDeadlineActive(DeadlineType.fromWireName(type), facts);
    }

    /**
     * First RFI entry (by list order) without a submitted response.
     */
    Optional<RfiEntry> getActiveRfiEntry(List<RfiEntry> entries);

    /**
     * First RFE entry (by list order) without a submitted response.
     */
    Optional<RfeEntry> getActiveRfeEntry(List<RfeEntry> entries);

    /**
     * Whether at least one deadline type is active.
     */
    boolean hasAnyActiveDeadline(CaseDateFacts facts);
}
