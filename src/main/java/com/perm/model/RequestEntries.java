package com.perm.model;

import java.util.List;
import java.util.Optional;

/**
 * Lookups over ordered RFI/RFE lists. List order is insertion order.
 */
public final class RequestEntries {

    private RequestEntries() {
    }

    /**
     * First entry (by list order) without a submitted response.
     */
    public static <T extends RequestEntry<T>> Optional<T> firstPending(List<T> entries) {
        if (entries == null) {
            return Optional.empty();
        }
        for (T entry : entries) {
            if (entry.isPending()) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public static <T extends RequestEntry<T>> Optional<T> findById(List<T> entries, String id) {
        for (T entry : entries) {
            if (entry.id().equals(id)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public static <T extends RequestEntry<T>> boolean allResponded(List<T> entries) {
        return firstPending(entries).isEmpty();
    }
}
