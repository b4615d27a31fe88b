package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.RecruitmentMethodEntry;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Rule that checks the date of every additional recruitment entry against a bound.
 */
public class MethodDateRule extends AbstractRule {

    private final Function<CaseDateFacts, LocalDate> bound;
    private final BoundSide side;
    private final String boundLabel;

    public MethodDateRule(RuleId id, Function<CaseDateFacts, LocalDate> bound, BoundSide side,
                          String boundLabel, String regulation) {
        super(id, regulation);
        this.bound = bound;
        this.side = side;
        this.boundLabel = boundLabel;
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        LocalDate edge = bound.apply(facts);
        if (edge == null) {
            return List.of();
        }
        List<ValidationIssue> issues = new ArrayList<>();
        List<RecruitmentMethodEntry> entries = facts.getAdditionalRecruitmentMethods();
        for (int i = 0; i < entries.size(); i++) {
            LocalDate date = entries.get(i).date();
            if (date != null && !side.holds(date, edge)) {
                issues.add(issue("additionalRecruitmentMethods[" + i + "].date",
                        entries.get(i).method().label() + " on " + date + " must be "
                                + side.phrase() + " " + edge + " (" + boundLabel + ")"));
            }
        }
        return issues;
    }
}
