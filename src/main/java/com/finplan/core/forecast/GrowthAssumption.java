package com.finplan.core.forecast;

import java.io.Serializable;

/**
 * How a driver grows from its base-year value.
 *
 * @param growthRatePct first-year growth rate in percent
 * @param decline       optional yearly decline of the growth rate, {@code null} for a constant rate
 * @param floor         optional lower bound applied each year, {@code null} for none
 * @param ceiling       optional upper bound applied each year, {@code null} for none
 */
public record GrowthAssumption(double growthRatePct, Decline decline, Double floor, Double ceiling)
        implements Serializable {

    public GrowthAssumption {
        if (floor != null && ceiling != null && floor > ceiling) {
            throw new IllegalArgumentException("Floor " + floor + " is above ceiling " + ceiling);
        }
    }

    public static GrowthAssumption constant(double growthRatePct) {
        return new GrowthAssumption(growthRatePct, null, null, null);
    }

    /**
     * @param annualDecline percentage points removed from the rate after each year
     * @param terminalRate  the rate never drops below this
     */
    public record Decline(double annualDecline, double terminalRate) implements Serializable {}
}
