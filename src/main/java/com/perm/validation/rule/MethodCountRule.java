package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.RecruitmentMethod;
import com.perm.model.RecruitmentMethodEntry;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Rule that checks enough distinct additional recruitment methods were used.
 */
public class MethodCountRule extends AbstractRule {

    private final int minMethods;

    public MethodCountRule(RuleId id, int minMethods, String regulation) {
        super(id, regulation);
        this.minMethods = minMethods;
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        Set<RecruitmentMethod> distinct = EnumSet.noneOf(RecruitmentMethod.class);
        for (RecruitmentMethodEntry entry : facts.getAdditionalRecruitmentMethods()) {
            distinct.add(entry.method());
        }
        if (distinct.size() >= minMethods) {
            return List.of();
        }
        return List.of(issue("additionalRecruitmentMethods",
                "Current: " + distinct.size() + ", required: " + minMethods));
    }
}
