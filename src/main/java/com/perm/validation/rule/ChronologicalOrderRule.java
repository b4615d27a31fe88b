package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.time.LocalDate;
import java.util.List;

/**
 * Rule that checks a date is strictly after an earlier milestone.
 * <p>
 * Several anchors may be given in order of preference; the first one present is used
 * (e.g. approval after receipt, or after filing when there is no receipt date).
 */
public class ChronologicalOrderRule extends AbstractRule {

    private final DateField later;
    private final List<DateField> anchors;

    public ChronologicalOrderRule(RuleId id, DateField later, List<DateField> anchors, String regulation) {
        super(id, regulation);
        this.later = later;
        this.anchors = List.copyOf(anchors);
    }

    public ChronologicalOrderRule(RuleId id, DateField later, DateField anchor) {
        this(id, later, List.of(anchor), null);
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        LocalDate date = facts.date(later);
        if (date == null) {
            return List.of();
        }
        for (DateField anchor : anchors) {
            LocalDate anchorDate = facts.date(anchor);
            if (anchorDate != null) {
                if (date.isAfter(anchorDate)) {
                    return List.of();
                }
                return List.of(issue(later.wireName(),
                        later.wireName() + " " + date + " is not after " + anchor.wireName() + " " + anchorDate));
            }
        }
        return List.of();
    }
}
