package com.finplan.core.projection;

/**
 * Why a driver could not be evaluated for a year.
 */
public enum FailureKind {
    MISSING_DEPENDENCY_VALUE,
    FORMULA_EVALUATION
}
