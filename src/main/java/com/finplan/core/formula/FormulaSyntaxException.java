package com.finplan.core.formula;

/**
 * Raised by the lexer and parser for text that is not a closed arithmetic expression.
 * Wrapped into {@link FormulaEvaluationException} before it leaves this package.
 */
class FormulaSyntaxException extends RuntimeException {
    FormulaSyntaxException(String message) {
        super(message);
    }
}
