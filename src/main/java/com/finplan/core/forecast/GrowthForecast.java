package com.finplan.core.forecast;

import java.io.Serializable;
import java.util.List;

/**
 * Extrapolated series with its summary.
 *
 * @param baseYear  year the base value was read from, or {@code null} when supplied directly
 * @param baseValue starting value
 * @param points    one point per forecast year, ascending
 * @param summary   totals over the series
 */
public record GrowthForecast(Integer baseYear, double baseValue, List<Point> points, Summary summary)
        implements Serializable {

    public GrowthForecast {
        points = List.copyOf(points);
    }

    /**
     * @param year          forecast year
     * @param value         value after growth and clamping
     * @param growthRatePct rate applied in this year
     */
    public record Point(int year, double value, double growthRatePct) implements Serializable {}

    /**
     * @param finalValue      value of the last point
     * @param totalGrowthPct  growth from base to final value in percent; 0 when the base is 0
     * @param cagrPct         compound annual growth rate in percent; 0 when the base is 0
     * @param yearsForecasted number of points
     */
    public record Summary(double finalValue, double totalGrowthPct, double cagrPct, int yearsForecasted)
            implements Serializable {}
}
