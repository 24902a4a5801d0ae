package com.finplan.core.convergence;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Per-year results of one engine run, in year order.
 */
public record EngineRunResult(List<YearResult> years) implements Serializable {

    public EngineRunResult {
        years = List.copyOf(years);
    }

    public boolean allConverged() {
        return years.stream().allMatch(y -> y.convergence().converged());
    }

    public int totalIterations() {
        return years.stream().mapToInt(y -> y.convergence().iterations()).sum();
    }

    public int yearsProcessed() {
        return years.size();
    }

    public Optional<YearResult> forYear(int year) {
        return years.stream().filter(y -> y.year() == year).findFirst();
    }

    public long countIn(ConvergenceState state) {
        return years.stream().filter(y -> y.state() == state).count();
    }
}
