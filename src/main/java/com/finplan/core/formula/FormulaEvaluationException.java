package com.finplan.core.formula;

import com.finplan.core.model.ProjectionException;

/**
 * Thrown when a formula cannot be parsed or does not reduce to a finite number.
 */
public class FormulaEvaluationException extends ProjectionException {

    private final String formula;

    public FormulaEvaluationException(String formula, String message) {
        super("Failed to evaluate formula '" + formula + "': " + message);
        this.formula = formula;
    }

    public FormulaEvaluationException(String formula, String message, Throwable cause) {
        super("Failed to evaluate formula '" + formula + "': " + message, cause);
        this.formula = formula;
    }

    public String getFormula() {
        return formula;
    }
}
