package com.finplan.core.rent;

import com.finplan.core.model.DriverValue;
import com.finplan.core.model.Provenance;
import com.finplan.core.model.ValueTable;
import com.finplan.core.model.YearDomain;
import com.finplan.core.model.YearRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Projects a rent model across years and derives rent metrics.
 */
@Service
public class RentCalculator {

    private static final Logger log = LoggerFactory.getLogger(RentCalculator.class);

    /**
     * @param revenueByYear revenue per year; required for every year of a revenue share model
     * @throws RentValidationException if the model configuration is invalid
     */
    public List<RentProjection> project(RentModel model, YearRange years, int baseYear,
                                        Map<Integer, Double> revenueByYear) {
        var errors = model.validate();
        if (!errors.isEmpty()) {
            throw new RentValidationException(model.type(), errors);
        }
        var projections = new ArrayList<RentProjection>(years.size());
        for (int year = years.start(); year <= years.end(); year++) {
            Double revenue = revenueByYear == null ? null : revenueByYear.get(year);
            var rev = revenue == null ? OptionalDouble.empty() : OptionalDouble.of(revenue);
            projections.add(new RentProjection(year, model.rentFor(year, baseYear, rev), model.type()));
        }
        log.debug("Projected {} rent over {}..{}", model.type(), years.start(), years.end());
        return projections;
    }

    /**
     * Revenue is read from {@code revenueDriverId} in the table when the model needs it.
     */
    public List<RentProjection> project(RentModel model, YearRange years, int baseYear,
                                        ValueTable table, String revenueDriverId) {
        var revenue = new HashMap<Integer, Double>();
        if (revenueDriverId != null) {
            years.years().forEach(y -> table.get(revenueDriverId, y).ifPresent(v -> revenue.put(y, v)));
        }
        return project(model, years, baseYear, revenue);
    }

    /**
     * Writes projected rent into the rent driver as {@link Provenance#CALCULATED}. Historical years and
     * immutable slots are left untouched.
     */
    public List<DriverValue> writeTo(String rentDriverId, List<RentProjection> projections,
                                     ValueTable table, YearDomain domain) {
        var written = new ArrayList<DriverValue>();
        for (var p : projections) {
            if (domain.isHistorical(p.year()) || !table.isWritable(rentDriverId, p.year())) {
                continue;
            }
            var value = new DriverValue(rentDriverId, p.year(), p.rent(), Provenance.CALCULATED);
            table.put(value);
            written.add(value);
        }
        return written;
    }

    /**
     * Net present value with the first projection discounted by period 0.
     */
    public double npv(List<RentProjection> projections, double discountRate) {
        double npv = 0;
        for (int i = 0; i < projections.size(); i++) {
            npv += projections.get(i).rent() / Math.pow(1 + discountRate, i);
        }
        return npv;
    }

    public double rentLoadPct(double rent, double revenue) {
        return revenue == 0 ? 0 : rent / revenue * 100;
    }
}
