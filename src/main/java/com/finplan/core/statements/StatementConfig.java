package com.finplan.core.statements;

import java.io.Serializable;

/**
 * Working-capital assumptions used to derive receivables, payables and deferred revenue.
 *
 * @param dsoDays            days sales outstanding, 0..365
 * @param dpoDays            days payable outstanding, 0..365
 * @param deferredRevenuePct share of revenue collected in advance, 0..1
 */
public record StatementConfig(double dsoDays, double dpoDays, double deferredRevenuePct) implements Serializable {

    public static StatementConfig defaults() {
        return new StatementConfig(30, 45, 0.35);
    }

    /**
     * @throws StatementValidationException listing every out-of-range field
     */
    public StatementConfig validate() {
        var violations = StatementMath.validateConfig(dsoDays, dpoDays, deferredRevenuePct);
        if (!violations.isEmpty()) {
            throw new StatementValidationException(violations);
        }
        return this;
    }
}
