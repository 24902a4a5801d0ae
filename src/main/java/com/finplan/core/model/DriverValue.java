package com.finplan.core.model;

import java.io.Serializable;

/**
 * A single (driver, year) value together with where it came from.
 */
public record DriverValue(
    String driverId,
    int year,
    double value,
    Provenance provenance
) implements Serializable {

    public DriverValue {
        if (driverId == null || driverId.isBlank()) {
            throw new IllegalArgumentException("driverId must not be blank");
        }
        if (provenance == null) {
            throw new IllegalArgumentException("provenance must not be null");
        }
    }
}
