package com.perm.cascade;

import com.perm.model.DateField;

import java.time.LocalDate;
import java.util.function.UnaryOperator;

/**
 * One edge of the dependency table: a derived field recomputed from its trigger.
 *
 * @param trigger    Field whose change fires the rule
 * @param derived    Field recomputed from the trigger
 * @param derivation Pure function from trigger value to derived value
 * @param label      Short description for logs, e.g. "+30 calendar days"
 */
public record CascadeRule(DateField trigger, DateField derived, UnaryOperator<LocalDate> derivation, String label) {

    /**
     * Derived value for a trigger value; a cleared trigger clears the derived field.
     */
    public LocalDate derive(LocalDate triggerValue) {
        return triggerValue == null ? null : derivation.apply(triggerValue);
    }
}
