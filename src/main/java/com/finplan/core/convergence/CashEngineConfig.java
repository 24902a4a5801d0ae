package com.finplan.core.convergence;

import java.io.Serializable;

/**
 * Iteration settings for the convergence engine.
 *
 * @param maxIterations    iterations allowed per year, at least 1
 * @param tolerance        absolute tolerance of the convergence predicate, not negative
 * @param convergenceCheck which predicate accepts an iteration
 * @param depositRate      annual rate earned on positive average cash
 * @param overdraftRate    annual rate paid on negative average cash
 */
public record CashEngineConfig(
    int maxIterations,
    double tolerance,
    ConvergenceCheck convergenceCheck,
    double depositRate,
    double overdraftRate
) implements Serializable {

    public static final int DEFAULT_MAX_ITERATIONS = 3;
    public static final double DEFAULT_TOLERANCE = 0.01;
    public static final double DEFAULT_DEPOSIT_RATE = 0.05;
    public static final double DEFAULT_OVERDRAFT_RATE = 0.12;

    public CashEngineConfig {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        if (!(tolerance >= 0)) {
            throw new IllegalArgumentException("tolerance must not be negative, got " + tolerance);
        }
        convergenceCheck = convergenceCheck == null ? ConvergenceCheck.BALANCE_SHEET : convergenceCheck;
    }

    public static CashEngineConfig defaults() {
        return new CashEngineConfig(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE, ConvergenceCheck.BALANCE_SHEET,
                DEFAULT_DEPOSIT_RATE, DEFAULT_OVERDRAFT_RATE);
    }

    public CashEngineConfig withConvergenceCheck(ConvergenceCheck check) {
        return new CashEngineConfig(maxIterations, tolerance, check, depositRate, overdraftRate);
    }

    public CashEngineConfig withMaxIterations(int iterations) {
        return new CashEngineConfig(iterations, tolerance, convergenceCheck, depositRate, overdraftRate);
    }
}
