package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * Rule that checks a date against a computed window edge.
 * The rule does not apply while the edge cannot be computed.
 */
public class WindowRule extends AbstractRule {

    private final DateField field;
    private final Function<CaseDateFacts, LocalDate> bound;
    private final BoundSide side;
    private final String boundLabel;

    public WindowRule(RuleId id, DateField field, Function<CaseDateFacts, LocalDate> bound,
                      BoundSide side, String boundLabel, String regulation) {
        super(id, regulation);
        this.field = field;
        this.bound = bound;
        this.side = side;
        this.boundLabel = boundLabel;
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        LocalDate date = facts.date(field);
        if (date == null) {
            return List.of();
        }
        LocalDate edge = bound.apply(facts);
        if (edge == null || side.holds(date, edge)) {
            return List.of();
        }
        return List.of(issue(field.wireName(), field.wireName() + " " + date + " must be "
                + side.phrase() + " " + edge + " (" + boundLabel + ")"));
    }
}
