package com.finplan.core.engine;

import com.finplan.core.convergence.ConvergenceState;
import com.finplan.core.convergence.EngineRunResult;
import com.finplan.core.model.DriverValue;
import com.finplan.core.model.ValueTable;
import com.finplan.core.projection.EvaluationFailure;

import java.util.List;

/**
 * Result of a scenario projection.
 *
 * @param scenarioId      scenario identifier
 * @param evaluationOrder driver ids in the order they were evaluated
 * @param table           projected values
 * @param written         values computed by this run
 * @param failures        per (driver, year) evaluation failures
 * @param engineResult    statements and convergence per year
 */
public record ProjectionOutcome(
    String scenarioId,
    List<String> evaluationOrder,
    ValueTable table,
    List<DriverValue> written,
    List<EvaluationFailure> failures,
    EngineRunResult engineResult
) {

    public ProjectionOutcome {
        evaluationOrder = List.copyOf(evaluationOrder);
        written = List.copyOf(written);
        failures = List.copyOf(failures);
    }

    /** True when some driver failed to evaluate or some year did not converge. */
    public boolean hasIssues() {
        return !failures.isEmpty() || !engineResult.allConverged();
    }

    public long failedYears() {
        return engineResult.countIn(ConvergenceState.FAILED);
    }

    public long exhaustedYears() {
        return engineResult.countIn(ConvergenceState.EXHAUSTED);
    }
}
