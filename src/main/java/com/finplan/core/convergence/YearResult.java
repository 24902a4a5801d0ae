package com.finplan.core.convergence;

import com.finplan.core.statements.StatementSnapshot;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * @param year        fiscal year
 * @param snapshot    accepted (or last exhausted) statements; {@code null} for a failed year
 * @param convergence convergence outcome
 * @param warnings    non-fatal input warnings
 */
public record YearResult(int year, StatementSnapshot snapshot, ConvergenceResult convergence, List<String> warnings)
        implements Serializable {

    public YearResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public Optional<StatementSnapshot> findSnapshot() {
        return Optional.ofNullable(snapshot);
    }

    public ConvergenceState state() {
        return convergence.state();
    }
}
