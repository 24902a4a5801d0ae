package com.finplan.core.convergence;

/**
 * Lifecycle of one (scenario, year) in the convergence engine.
 */
public enum ConvergenceState {
    SEEDED,
    ITERATING,
    CONVERGED,
    EXHAUSTED,
    FAILED;

    public boolean isTerminal() {
        return this == CONVERGED || this == EXHAUSTED || this == FAILED;
    }
}
