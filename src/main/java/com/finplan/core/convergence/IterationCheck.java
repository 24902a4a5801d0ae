package com.finplan.core.convergence;

import java.io.Serializable;

/**
 * Diagnostics of one iteration.
 *
 * @param iteration 1-based iteration number
 * @param residual  balance-sheet residual, signed
 * @param cashDelta computed ending cash minus the assumed cash
 * @param passed    whether the configured predicate accepted the iteration
 */
public record IterationCheck(int iteration, double residual, double cashDelta, boolean passed)
        implements Serializable {}
