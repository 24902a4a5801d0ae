package com.finplan.core.forecast;

import java.io.Serializable;

/**
 * Extrapolates one driver from its base-year value.
 *
 * @param driverId   driver to extrapolate
 * @param baseYear   year whose value is grown
 * @param assumption growth rule
 */
public record GrowthPlan(String driverId, int baseYear, GrowthAssumption assumption) implements Serializable {

    public GrowthPlan {
        if (driverId == null || assumption == null) {
            throw new IllegalArgumentException("Growth plan needs a driver and an assumption");
        }
    }
}
