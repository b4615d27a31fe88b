package com.perm.deadline;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.RequestEntries;
import com.perm.model.RequestEntry;
import com.perm.model.RfeEntry;
import com.perm.model.RfiEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Default implementation of DeadlineActivationEngine.
 */
public class DefaultDeadlineActivationEngine implements DeadlineActivationEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultDeadlineActivationEngine.class);

    @Override
    public DeadlineStatus isDeadlineActive(DeadlineType type, CaseDateFacts facts) {
        DeadlineStatus status = evaluate(type, facts);
        log.debug("Deadline {}: active={}, reason={}", type.wireName(), status.active(), status.supersededReason());
        return status;
    }

    private DeadlineStatus evaluate(DeadlineType type, CaseDateFacts facts) {
        // Global filters take precedence over every per-type rule
        if (facts.isClosed()) {
            return DeadlineStatus.superseded(SupersessionReason.CASE_CLOSED);
        }
        if (facts.isDeleted()) {
            return DeadlineStatus.superseded(SupersessionReason.CASE_DELETED);
        }

        return switch (type) {
            case PWD_EXPIRATION -> pwdExpiration(facts);
            case FILING_WINDOW_OPENS, FILING_WINDOW_CLOSES, RECRUITMENT_WINDOW_CLOSES -> facts.has(DateField.ETA9089_FILING_DATE)
                    ? DeadlineStatus.superseded(SupersessionReason.ETA9089_FILED)
                    : DeadlineStatus.activeStatus();
            case I140_FILING_DEADLINE -> i140Filing(facts);
            case RFI_DUE -> response(facts.getRfiEntries(), SupersessionReason.RFI_RESPONDED);
            case RFE_DUE -> response(facts.getRfeEntries(), SupersessionReason.RFE_RESPONDED);
        };
    }

    private DeadlineStatus pwdExpiration(CaseDateFacts facts) {
        if (!facts.has(DateField.PWD_EXPIRATION_DATE)) {
            return DeadlineStatus.superseded(SupersessionReason.NO_DATE);
        }
        if (facts.has(DateField.ETA9089_FILING_DATE)) {
            return DeadlineStatus.superseded(SupersessionReason.ETA9089_FILED);
        }
        return DeadlineStatus.activeStatus();
    }

    private DeadlineStatus i140Filing(CaseDateFacts facts) {
        if (!facts.has(DateField.ETA9089_CERTIFICATION_DATE) || !facts.has(DateField.ETA9089_EXPIRATION_DATE)) {
            return DeadlineStatus.superseded(SupersessionReason.NOT_CERTIFIED);
        }
        if (facts.has(DateField.I140_FILING_DATE)) {
            return DeadlineStatus.superseded(SupersessionReason.I140_FILED);
        }
        return DeadlineStatus.activeStatus();
    }

    /**
     * Active while any entry is pending, wherever it sits in the list.
     * No entries at all also counts as responded.
     */
    private <T extends RequestEntry<T>> DeadlineStatus response(List<T> entries, SupersessionReason responded) {
        return RequestEntries.allResponded(entries)
                ? DeadlineStatus.superseded(responded)
                : DeadlineStatus.activeStatus();
    }

    @Override
    public Optional<RfiEntry> getActiveRfiEntry(List<RfiEntry> entries) {
        return RequestEntries.firstPending(entries);
    }

    @Override
    public Optional<RfeEntry> getActiveRfeEntry(List<RfeEntry> entries) {
        return RequestEntries.firstPending(entries);
    }

    @Override
    public boolean hasAnyActiveDeadline(CaseDateFacts facts) {
        for (DeadlineType type : DeadlineType.values()) {
            if (evaluate(type, facts).active()) {
                return true;
            }
        }
        return false;
    }
}
