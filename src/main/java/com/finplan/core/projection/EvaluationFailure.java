package com.finplan.core.projection;

import java.io.Serializable;

/**
 * A non-fatal failure recorded while projecting one (driver, year) slot.
 *
 * @param driverId   driver that could not be evaluated
 * @param driverName its display name
 * @param year       target year
 * @param kind       failure category
 * @param message    human-readable detail
 */
public record EvaluationFailure(
    String driverId,
    String driverName,
    int year,
    FailureKind kind,
    String message
) implements Serializable {}
