package com.perm.cascade;

import com.perm.exception.MalformedInputException;
import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.model.FieldChange;
import com.perm.model.RequestEntries;
import com.perm.model.RequestEntry;
import com.perm.model.RfeEntry;
import com.perm.model.RfiEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Default implementation of CascadeEngine driven by a trigger-to-rule table.
 */
public class DefaultCascadeEngine implements CascadeEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultCascadeEngine.class);

    private final Map<DateField, CascadeRule> rules;

    public DefaultCascadeEngine(Map<DateField, CascadeRule> rules) {
        this.rules = CascadeRules.index(new ArrayList<>(rules.values()));
        log.info("Cascade engine initialized with {} rules", this.rules.size());
    }

    public Map<DateField, CascadeRule> getRules() {
        return rules;
    }

    @Override
    public CaseDateFacts applyCascade(CaseDateFacts facts, FieldChange change) {
        DateField field = change.field();
        CascadeRule rule = rules.get(field);
        if (rule != null) {
            log.debug("Cascade {} = {} -> {} ({})", field.wireName(), change.value(),
                    rule.derived().wireName(), rule.label());
        }

        return switch (field.scope()) {
            case CASE -> applyToCase(facts, change, rule);
            case RFI -> facts.toBuilder()
                    .rfiEntries(applyToEntries(facts.getRfiEntries(), change, rule, "RFI",
                            id -> RfiEntry.pending(id, null, null)))
                    .build();
            case RFE -> facts.toBuilder()
                    .rfeEntries(applyToEntries(facts.getRfeEntries(), change, rule, "RFE",
                            id -> RfeEntry.pending(id, null, null)))
                    .build();
        };
    }

    private CaseDateFacts applyToCase(CaseDateFacts facts, FieldChange change, CascadeRule rule) {
        CaseDateFacts.Builder builder = facts.toBuilder().date(change.field(), change.value());
        if (rule != null) {
            builder.date(rule.derived(), rule.derive(change.value()));
        }
        return builder.build();
    }

    /**
     * Apply an entry-scoped change. Without an entry id the change addresses the first
     * pending entry, and a new entry is opened when none is pending.
     */
    private <T extends RequestEntry<T>> List<T> applyToEntries(List<T> entries, FieldChange change,
                                                               CascadeRule rule, String kind,
                                                               Function<String, T> newEntry) {
        Optional<T> existing = target(entries, change, kind);
        if (existing.isEmpty() && change.value() == null) {
            return entries;
        }
        T target = existing.orElseGet(() -> newEntry.apply(nextId(entries, kind)));
        T updated = target.withDate(change.field().entryPart(), change.value());
        if (rule != null) {
            updated = updated.withDate(rule.derived().entryPart(), rule.derive(change.value()));
        }

        List<T> result = new ArrayList<>(entries.size() + 1);
        for (T entry : entries) {
            result.add(entry == target ? updated : entry);
        }
        if (existing.isEmpty()) {
            log.debug("Opened {} entry {}", kind, updated.id());
            result.add(updated);
        }
        return result;
    }

    private <T extends RequestEntry<T>> Optional<T> target(List<T> entries, FieldChange change, String kind) {
        if (change.entryId() != null) {
            Optional<T> byId = RequestEntries.findById(entries, change.entryId());
            if (byId.isEmpty()) {
                throw new MalformedInputException("Unknown " + kind + " entry: " + change.entryId());
            }
            return byId;
        }
        // A submitted response closes its entry, so it is only ever addressed by id
        if (change.field().entryPart() == DateField.EntryPart.RESPONSE_SUBMITTED) {
            throw new MalformedInputException(kind + " response submission must name its entry");
        }
        return RequestEntries.firstPending(entries);
    }

    private static <T extends RequestEntry<T>> String nextId(List<T> entries, String kind) {
        String prefix = kind.toLowerCase(Locale.ROOT) + "-";
        int n = entries.size() + 1;
        while (RequestEntries.findById(entries, prefix + n).isPresent()) {
            n++;
        }
        return prefix + n;
    }
}
