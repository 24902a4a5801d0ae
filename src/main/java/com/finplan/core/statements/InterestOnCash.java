package com.finplan.core.statements;

/**
 * Interest earned or paid on the average cash balance of a year. At most one side is non-zero.
 */
public record InterestOnCash(double income, double expense) {

    public static final InterestOnCash NONE = new InterestOnCash(0, 0);

    public double net() {
        return income - expense;
    }
}
