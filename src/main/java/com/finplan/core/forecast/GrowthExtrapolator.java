package com.finplan.core.forecast;

import com.finplan.core.formula.MissingDependencyValueException;
import com.finplan.core.model.DriverValue;
import com.finplan.core.model.Provenance;
import com.finplan.core.model.ValueTable;
import com.finplan.core.model.YearDomain;
import com.finplan.core.model.YearRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Compounds a base value forward by a (possibly declining) growth rate.
 */
@Service
public class GrowthExtrapolator {

    private static final Logger log = LoggerFactory.getLogger(GrowthExtrapolator.class);

    public GrowthForecast extrapolate(double baseValue, YearRange years, GrowthAssumption assumption) {
        return extrapolate(null, baseValue, years, assumption);
    }

    /**
     * Reads the base value of {@code driverId} at {@code baseYear} from the table.
     *
     * @throws MissingDependencyValueException when the base slot is empty
     */
    public GrowthForecast extrapolate(String driverId, int baseYear, YearRange years,
                                      GrowthAssumption assumption, ValueTable table) {
        double base = table.get(driverId, baseYear)
                .orElseThrow(() -> new MissingDependencyValueException(driverId, null, baseYear));
        return extrapolate(baseYear, base, years, assumption);
    }

    private GrowthForecast extrapolate(Integer baseYear, double baseValue, YearRange years,
                                       GrowthAssumption assumption) {
        var points = new ArrayList<GrowthForecast.Point>(years.size());
        double value = baseValue;
        double rate = assumption.growthRatePct();
        for (int year = years.start(); year <= years.end(); year++) {
            value = value * (1 + rate / 100);
            if (assumption.floor() != null && value < assumption.floor()) {
                value = assumption.floor();
            }
            if (assumption.ceiling() != null && value > assumption.ceiling()) {
                value = assumption.ceiling();
            }
            points.add(new GrowthForecast.Point(year, value, rate));
            if (assumption.decline() != null) {
                rate = Math.max(assumption.decline().terminalRate(), rate - assumption.decline().annualDecline());
            }
        }

        double finalValue = points.get(points.size() - 1).value();
        int n = points.size();
        double totalGrowth = baseValue == 0 ? 0 : (finalValue - baseValue) / baseValue * 100;
        double cagr = baseValue == 0 ? 0 : (Math.pow(finalValue / baseValue, 1.0 / n) - 1) * 100;
        if (!Double.isFinite(cagr)) {
            cagr = 0;
        }
        log.debug("Extrapolated {} years from {}: final {}", n, baseValue, finalValue);
        return new GrowthForecast(baseYear, baseValue, points, new GrowthForecast.Summary(finalValue, totalGrowth, cagr, n));
    }

    /**
     * Writes forecast points as {@link Provenance#FORECASTED} values. Historical years and slots
     * holding manual, imported or adjusted values are skipped.
     *
     * @return the values written
     */
    public List<DriverValue> writeTo(String driverId, GrowthForecast forecast, ValueTable table, YearDomain domain) {
        var written = new ArrayList<DriverValue>();
        for (var point : forecast.points()) {
            if (domain.isHistorical(point.year()) || !table.isWritable(driverId, point.year())) {
                continue;
            }
            var value = new DriverValue(driverId, point.year(), point.value(), Provenance.FORECASTED);
            table.put(value);
            written.add(value);
        }
        log.info("Wrote {} of {} forecast points for {}", written.size(), forecast.points().size(), driverId);
        return written;
    }
}
