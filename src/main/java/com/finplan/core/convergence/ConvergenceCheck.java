package com.finplan.core.convergence;

/**
 * Named convergence predicates selectable from configuration.
 */
public enum ConvergenceCheck {
    /** Balance sheet balances within tolerance. */
    BALANCE_SHEET(ConvergencePredicate.BALANCE_SHEET),
    /** Ending cash moved less than tolerance from the assumed cash. */
    CASH_STABILITY(ConvergencePredicate.CASH_STABILITY),
    BALANCE_AND_CASH(ConvergencePredicate.BALANCE_SHEET.and(ConvergencePredicate.CASH_STABILITY));

    private final ConvergencePredicate predicate;

    ConvergenceCheck(ConvergencePredicate predicate) {
        this.predicate = predicate;
    }

    public ConvergencePredicate predicate() {
        return predicate;
    }
}
