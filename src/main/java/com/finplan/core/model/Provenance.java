package com.finplan.core.model;

/**
 * Origin of a value stored in a {@link ValueTable}.
 * <p>
 * Operator-entered and externally supplied values are immutable to the engine;
 * only calculated and forecasted slots may be rewritten by a projection run.
 */
public enum Provenance {
    MANUAL,
    CALCULATED,
    IMPORTED,
    FORECASTED,
    ADJUSTED;

    public boolean isEngineWritable() {
        return this == CALCULATED || this == FORECASTED;
    }
}
