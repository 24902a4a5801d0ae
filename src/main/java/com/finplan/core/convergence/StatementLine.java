package com.finplan.core.convergence;

/**
 * Statement inputs that can be bound to a driver.
 */
public enum StatementLine {
    REVENUE(true),
    STAFF_COSTS(true),
    RENT(true),
    OTHER_OPEX(true),
    DEPRECIATION(false),
    CAPEX(false),
    FINANCING(false),
    TAXES(false),
    PROVISIONS(false);

    private final boolean required;

    StatementLine(boolean required) {
        this.required = required;
    }

    public boolean isRequired() {
        return required;
    }
}
