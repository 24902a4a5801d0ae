package com.finplan.core.convergence;

import com.finplan.core.model.ProjectionException;

/**
 * A required statement line has no binding or no value for the year.
 */
public class MissingStatementInputException extends ProjectionException {

    private final StatementLine line;
    private final int year;

    public MissingStatementInputException(StatementLine line, String driverId, int year) {
        super(driverId == null
                ? "Required input " + line + " is not bound to a driver"
                : "Required input " + line + " (driver " + driverId + ") has no value for " + year);
        this.line = line;
        this.year = year;
    }

    public StatementLine getLine() {
        return line;
    }

    public int getYear() {
        return year;
    }
}
