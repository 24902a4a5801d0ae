package com.finplan.core.convergence;

import com.finplan.core.statements.StatementSnapshot;

/**
 * Decides whether an iteration's snapshot is accepted.
 */
@FunctionalInterface
public interface ConvergencePredicate {

    /**
     * @param snapshot  statements computed in this iteration
     * @param cashSeed  ending cash assumed when this iteration computed interest
     * @param tolerance absolute tolerance
     */
    boolean passes(StatementSnapshot snapshot, double cashSeed, double tolerance);

    ConvergencePredicate BALANCE_SHEET = (snapshot, cashSeed, tolerance) ->
            Math.abs(snapshot.balanceSheet().residual()) <= tolerance;

    ConvergencePredicate CASH_STABILITY = (snapshot, cashSeed, tolerance) ->
            Math.abs(snapshot.cashFlow().endingCash() - cashSeed) <= tolerance;

    default ConvergencePredicate and(ConvergencePredicate other) {
        return (snapshot, cashSeed, tolerance) ->
                passes(snapshot, cashSeed, tolerance) && other.passes(snapshot, cashSeed, tolerance);
    }
}
