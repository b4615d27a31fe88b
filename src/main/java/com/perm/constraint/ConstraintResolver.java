package com.perm.constraint;

import com.perm.model.CaseDateFacts;
import com.perm.model.DateField;

import java.util.Map;

/**
 * Computes the legal date range of case fields.
 * <p>
 * "After X" bounds are strict: the minimum is the day after X. When an upstream date is
 * missing the bound stays unset and the hint names what is missing.
 */
public interface ConstraintResolver {

    /**
     * Resolve the bounds of a field.
     *
     * @param field Field to resolve
     * @param facts Case snapshot
     * @return the constraint (never null)
     */
    default DateConstraint resolveConstraints(DateField field, CaseDateFacts facts) {
        return resolveConstraints(field, facts, ResolveOptions.none());
    }

    /**
     * Resolve the bounds of a field identified by its wire name.
     *
     * @throws com.perm.exception.MalformedInputException for unknown identifiers
     */
    default DateConstraint resolveConstraints(String field, CaseDateFacts facts) {
        return resolveConstraints(DateField.fromWireName(field), facts);
    }

    /**
     * Resolve the bounds of a field with a reference day and/or an explicit RFI/RFE entry.
     */
    DateConstraint resolveConstraints(DateField field, CaseDateFacts facts, ResolveOptions options);

    /**
     * Resolve every case-scoped field.
     */
    Map<DateField, DateConstraint> resolveAll(CaseDateFacts facts, ResolveOptions options);
}
