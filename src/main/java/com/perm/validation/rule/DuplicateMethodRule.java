package com.perm.validation.rule;

import com.perm.model.CaseDateFacts;
import com.perm.model.RecruitmentMethod;
import com.perm.model.RecruitmentMethodEntry;
import com.perm.validation.RuleId;
import com.perm.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Rule that flags every additional recruitment entry repeating an earlier entry's method.
 */
public class DuplicateMethodRule extends AbstractRule {

    public DuplicateMethodRule(RuleId id) {
        super(id, null);
    }

    @Override
    public List<ValidationIssue> evaluate(CaseDateFacts facts) {
        List<ValidationIssue> issues = new ArrayList<>();
        Set<RecruitmentMethod> seen = EnumSet.noneOf(RecruitmentMethod.class);
        List<RecruitmentMethodEntry> entries = facts.getAdditionalRecruitmentMethods();
        for (int i = 0; i < entries.size(); i++) {
            RecruitmentMethod method = entries.get(i).method();
            if (!seen.add(method)) {
                issues.add(issue("additionalRecruitmentMethods[" + i + "].method",
                        method.label() + " is already listed"));
            }
        }
        return issues;
    }
}
