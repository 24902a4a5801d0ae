package com.finplan.core.projection;

import com.finplan.core.model.DriverValue;
import com.finplan.core.model.ValueTable;

import java.util.List;

/**
 * Output of one pipeline run.
 *
 * @param table    the projected table (a copy of the seed plus written values)
 * @param written  values written by this run, in write order
 * @param failures failures recorded while projecting, in occurrence order
 */
public record ProjectionResult(ValueTable table, List<DriverValue> written, List<EvaluationFailure> failures) {

    public ProjectionResult {
        written = List.copyOf(written);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
