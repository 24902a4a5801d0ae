package com.finplan.core.projection;

import com.finplan.core.formula.FormulaEvaluationException;
import com.finplan.core.formula.FormulaEvaluator;
import com.finplan.core.formula.MissingDependencyValueException;
import com.finplan.core.model.Driver;
import com.finplan.core.model.DriverValue;
import com.finplan.core.model.Provenance;
import com.finplan.core.model.ValueTable;
import com.finplan.core.model.YearDomain;
import com.finplan.core.model.YearRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Evaluates ordered drivers over the forecast years of a range.
 *
 * <p>Drivers are processed in the given order and, per driver, years ascending. A computed value is
 * visible to every later driver and year. Slots holding manual, imported or adjusted values are
 * never overwritten, and historical years are never computed. A failing (driver, year) is recorded
 * and the run continues.
 */
@Service
public class DriverProjectionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DriverProjectionPipeline.class);

    private final FormulaEvaluator evaluator;

    public DriverProjectionPipeline(FormulaEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * @param ordered drivers in evaluation order (see {@code DependencyResolver})
     * @param range   requested years; the historical part is skipped
     * @param seed    caller's values; left untouched
     * @param domain  year domain defining the historical partition
     */
    public ProjectionResult project(List<Driver> ordered, YearRange range, ValueTable seed, YearDomain domain) {
        ValueTable table = seed.copy();
        var written = new ArrayList<DriverValue>();
        var failures = new ArrayList<EvaluationFailure>();

        var forecast = domain.forecastPart(range);
        if (forecast.isEmpty()) {
            log.info("Range {}..{} is entirely historical; nothing to project", range.start(), range.end());
            return new ProjectionResult(table, written, failures);
        }
        YearRange years = forecast.get();

        var catalog = new LinkedHashMap<String, Driver>();
        ordered.forEach(d -> catalog.put(d.id(), d));

        for (Driver driver : ordered) {
            if (!driver.hasFormula()) {
                continue;
            }
            for (int year = years.start(); year <= years.end(); year++) {
                if (!table.isWritable(driver.id(), year)) {
                    log.trace("Keeping {} value of {} for {}", table.find(driver.id(), year)
                            .map(DriverValue::provenance).orElse(null), driver.id(), year);
                    continue;
                }
                try {
                    double value = evaluator.evaluate(driver, catalog, year, table);
                    var dv = new DriverValue(driver.id(), year, value, Provenance.CALCULATED);
                    table.put(dv);
                    written.add(dv);
                } catch (MissingDependencyValueException e) {
                    failures.add(failure(driver, year, FailureKind.MISSING_DEPENDENCY_VALUE, e.getMessage()));
                } catch (FormulaEvaluationException e) {
                    failures.add(failure(driver, year, FailureKind.FORMULA_EVALUATION, e.getMessage()));
                }
            }
        }

        log.info("Projected {} drivers over {}..{}: {} values written, {} failures",
                ordered.size(), years.start(), years.end(), written.size(), failures.size());
        return new ProjectionResult(table, written, failures);
    }

    private static EvaluationFailure failure(Driver driver, int year, FailureKind kind, String message) {
        log.warn("Could not evaluate {} ({}) for {}: {}", driver.name(), driver.id(), year, message);
        return new EvaluationFailure(driver.id(), driver.name(), year, kind, message);
    }
}
