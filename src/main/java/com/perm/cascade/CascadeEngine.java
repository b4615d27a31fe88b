package com.perm.cascade;

import com.perm.model.CaseDateFacts;
import com.perm.model.FieldChange;

import java.util.List;

/**
 * Applies date edits and recomputes the dates derived from them.
 * <p>
 * Propagation is a single hop: derived fields never trigger further derivations.
 * Applying the same change twice gives the same snapshot as applying it once.
 */
public interface CascadeEngine {

    /**
     * Apply one change.
     *
     * @param facts  Snapshot before the edit (not modified)
     * @param change The edit
     * @return a new snapshot with the edited field and its derived field updated
     * @throws com.perm.exception.MalformedInputException if an RFI/RFE change names an unknown entry, or a
     *                                                    response submission names none
     */
    CaseDateFacts applyCascade(CaseDateFacts facts, FieldChange change);

    /**
     * Apply several changes in order.
     */
    default CaseDateFacts applyCascadeMultiple(CaseDateFacts facts, List<FieldChange> changes) {
        CaseDateFacts result = facts;
        for (FieldChange change : changes) {
            result = applyCascade(result, change);
        }
        return result;
    }
}
