package com.finplan.core.model;

import java.io.Serializable;
import java.util.Optional;

/**
 * The bounded year domain of a model and its split into historical and forecast years.
 *
 * @param firstYear     earliest representable year
 * @param lastYear      latest representable year
 * @param historicalEnd last historical (read-only) year; every later year is a forecast year
 */
public record YearDomain(int firstYear, int lastYear, int historicalEnd) implements Serializable {

    public static final YearDomain DEFAULT = new YearDomain(2023, 2052, 2024);

    public YearDomain {
        if (lastYear < firstYear) {
            throw new IllegalArgumentException("Year domain is empty: " + firstYear + ".." + lastYear);
        }
        if (historicalEnd < firstYear - 1 || historicalEnd > lastYear) {
            throw new IllegalArgumentException("historicalEnd " + historicalEnd
                    + " outside domain " + firstYear + ".." + lastYear);
        }
    }

    public boolean isHistorical(int year) {
        return year <= historicalEnd;
    }

    public int firstForecastYear() {
        return historicalEnd + 1;
    }

    /**
     * Checks that the range lies inside the domain.
     *
     * @throws IllegalArgumentException if any year of the range is outside the domain
     */
    public void requireWithin(YearRange range) {
        if (range.start() < firstYear || range.end() > lastYear) {
            throw new IllegalArgumentException("Year range " + range.start() + ".." + range.end()
                    + " outside domain " + firstYear + ".." + lastYear);
        }
    }

    /**
     * Clips a range to its forecast part; empty when the range is entirely historical.
     */
    public Optional<YearRange> forecastPart(YearRange range) {
        int start = Math.max(range.start(), firstForecastYear());
        if (start > range.end()) {
            return Optional.empty();
        }
        return Optional.of(new YearRange(start, range.end()));
    }
}
