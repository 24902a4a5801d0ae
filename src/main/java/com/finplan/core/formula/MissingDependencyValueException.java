package com.finplan.core.formula;

import com.finplan.core.model.ProjectionException;

/**
 * Thrown when a formula reads a (driver, year) slot that holds no value,
 * or references a driver id that is not part of the catalog.
 */
public class MissingDependencyValueException extends ProjectionException {

    private final String driverId;
    private final int year;

    public MissingDependencyValueException(String driverId, String driverName, int year) {
        super("Missing value for driver " + (driverName != null ? driverName : driverId) + " in year " + year);
        this.driverId = driverId;
        this.year = year;
    }

    public String getDriverId() {
        return driverId;
    }

    public int getYear() {
        return year;
    }
}
