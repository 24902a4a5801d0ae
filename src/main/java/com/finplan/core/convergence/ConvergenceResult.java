package com.finplan.core.convergence;

import java.io.Serializable;
import java.util.List;

/**
 * Terminal outcome of one year.
 *
 * @param year       fiscal year
 * @param state      CONVERGED, EXHAUSTED or FAILED
 * @param iterations iterations consumed; 0 for a year that failed before iterating
 * @param lastError  failure message, {@code null} unless FAILED
 * @param residual   total assets minus (total liabilities + total equity) of the last iteration
 * @param checks     per-iteration diagnostics in order
 */
public record ConvergenceResult(
    int year,
    ConvergenceState state,
    int iterations,
    String lastError,
    double residual,
    List<IterationCheck> checks
) implements Serializable {

    public ConvergenceResult {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Convergence result needs a terminal state, got " + state);
        }
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public static ConvergenceResult failed(int year, String error) {
        return new ConvergenceResult(year, ConvergenceState.FAILED, 0, error, 0.0, List.of());
    }

    public boolean converged() {
        return state == ConvergenceState.CONVERGED;
    }
}
