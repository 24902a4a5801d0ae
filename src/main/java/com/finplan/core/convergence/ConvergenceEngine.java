package com.finplan.core.convergence;

import com.finplan.core.logging.MdcContext;
import com.finplan.core.model.ValueTable;
import com.finplan.core.model.YearDomain;
import com.finplan.core.model.YearRange;
import com.finplan.core.statements.OpeningBalances;
import com.finplan.core.statements.StatementConfig;
import com.finplan.core.statements.StatementDeriver;
import com.finplan.core.statements.StatementInputs;
import com.finplan.core.statements.StatementMath;
import com.finplan.core.statements.StatementSnapshot;
import com.finplan.core.statements.StatementValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Derives statements year by year and iterates each year until its convergence predicate passes.
 *
 * <p>Interest depends on average cash, and ending cash depends on net result, which includes
 * interest. Each iteration recomputes the year with an assumed ending cash, which is also the cash
 * shown on the balance sheet: the opening cash on the first iteration, the ending cash of the first
 * iteration on the second, then a secant step through the last two (assumed, derived) pairs. While
 * the assumed and derived cash differ the balance sheet carries the gap as residual. A year that
 * passes is CONVERGED.
 * A year that runs out of iterations is EXHAUSTED and its last snapshot is still carried forward.
 * A year whose inputs or configuration are invalid is FAILED without iterating; the next year starts
 * from the last accepted position.
 */
@Service
public class ConvergenceEngine {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceEngine.class);

    /**
     * Runs every forecast year of {@code range} in ascending order.
     *
     * @param table           projected driver values
     * @param range           requested years; historical years are skipped
     * @param domain          year domain
     * @param bindings        statement line to driver mapping
     * @param opening         position at the start of the first forecast year
     * @param statementConfig working-capital assumptions
     * @param config          iteration settings
     */
    public EngineRunResult run(ValueTable table, YearRange range, YearDomain domain, StatementBindings bindings,
                               OpeningBalances opening, StatementConfig statementConfig, CashEngineConfig config) {
        var results = new ArrayList<YearResult>();
        var forecast = domain.forecastPart(range);
        if (forecast.isEmpty()) {
            log.info("Range {}..{} has no forecast years", range.start(), range.end());
            return new EngineRunResult(results);
        }

        OpeningBalances carry = opening;
        for (int year = forecast.get().start(); year <= forecast.get().end(); year++) {
            MdcContext.setYear(year);
            try {
                YearResult result = solveYear(year, table, bindings, carry, statementConfig, config);
                results.add(result);
                if (result.snapshot() != null) {
                    carry = OpeningBalances.closingOf(result.snapshot());
                }
            } finally {
                MdcContext.clearYear();
            }
        }

        var run = new EngineRunResult(results);
        log.info("Cash engine processed {} years: {} converged, {} exhausted, {} failed, {} iterations",
                run.yearsProcessed(), run.countIn(ConvergenceState.CONVERGED),
                run.countIn(ConvergenceState.EXHAUSTED), run.countIn(ConvergenceState.FAILED),
                run.totalIterations());
        return run;
    }

    /**
     * Solves one year from the given opening position.
     */
    public YearResult solveYear(int year, ValueTable table, StatementBindings bindings, OpeningBalances opening,
                                StatementConfig statementConfig, CashEngineConfig config) {
        ConvergenceState state = ConvergenceState.SEEDED;
        var warnings = new ArrayList<String>();

        StatementInputs inputs;
        try {
            validate(statementConfig, config);
            inputs = readInputs(year, table, bindings, opening, warnings);
        } catch (StatementValidationException | MissingStatementInputException e) {
            log.warn("Year {} failed before iterating: {}", year, e.getMessage());
            return new YearResult(year, null, ConvergenceResult.failed(year, e.getMessage()), warnings);
        }

        state = ConvergenceState.ITERATING;
        ConvergencePredicate predicate = config.convergenceCheck().predicate();
        var checks = new ArrayList<IterationCheck>();
        double cashSeed = opening.cash();
        double previousSeed = Double.NaN;
        double previousDelta = Double.NaN;
        StatementSnapshot snapshot = null;

        for (int iteration = 1; iteration <= config.maxIterations(); iteration++) {
            snapshot = StatementDeriver.derive(year, inputs, opening, cashSeed, statementConfig,
                    config.depositRate(), config.overdraftRate());
            double endingCash = snapshot.cashFlow().endingCash();
            boolean passed = predicate.passes(snapshot, cashSeed, config.tolerance());
            var check = new IterationCheck(iteration, snapshot.balanceSheet().residual(),
                    endingCash - cashSeed, passed);
            checks.add(check);
            log.debug("Year {} iteration {}: residual={} cashDelta={} passed={}",
                    year, iteration, check.residual(), check.cashDelta(), passed);
            if (passed) {
                state = ConvergenceState.CONVERGED;
                break;
            }
            double delta = check.cashDelta();
            double nextSeed = nextSeed(cashSeed, delta, previousSeed, previousDelta, endingCash);
            previousSeed = cashSeed;
            previousDelta = delta;
            cashSeed = nextSeed;
        }

        if (state != ConvergenceState.CONVERGED) {
            state = ConvergenceState.EXHAUSTED;
            log.warn("Year {} did not converge after {} iterations (residual {})",
                    year, config.maxIterations(), snapshot.balanceSheet().residual());
        }

        var convergence = new ConvergenceResult(year, state, checks.size(), null,
                snapshot.balanceSheet().residual(), checks);
        return new YearResult(year, snapshot, convergence, warnings);
    }

    /**
     * Secant step on {@code delta(seed) = endingCash(seed) - seed}. Falls back to the derived ending
     * cash when there is no previous point or the step is degenerate.
     */
    static double nextSeed(double seed, double delta, double previousSeed, double previousDelta,
                           double endingCash) {
        if (Double.isNaN(previousSeed)) {
            return endingCash;
        }
        double slope = delta - previousDelta;
        if (slope == 0.0) {
            return endingCash;
        }
        double next = seed - delta * (seed - previousSeed) / slope;
        return Double.isFinite(next) ? next : endingCash;
    }

    private static void validate(StatementConfig statementConfig, CashEngineConfig config) {
        var violations = new ArrayList<String>();
        violations.addAll(StatementMath.validateConfig(statementConfig.dsoDays(), statementConfig.dpoDays(),
                statementConfig.deferredRevenuePct()));
        violations.addAll(StatementMath.validateRates(config.depositRate(), config.overdraftRate()));
        if (!violations.isEmpty()) {
            throw new StatementValidationException(violations);
        }
    }

    private static StatementInputs readInputs(int year, ValueTable table, StatementBindings bindings,
                                              OpeningBalances opening, List<String> warnings) {
        Map<StatementLine, Double> values = new EnumMap<>(StatementLine.class);
        for (StatementLine line : StatementLine.values()) {
            var driverId = bindings.driverFor(line);
            if (line.isRequired()) {
                if (driverId.isEmpty()) {
                    throw new MissingStatementInputException(line, null, year);
                }
                var value = table.get(driverId.get(), year);
                if (value.isEmpty()) {
                    throw new MissingStatementInputException(line, driverId.get(), year);
                }
                values.put(line, value.getAsDouble());
                continue;
            }
            double fallback = line == StatementLine.PROVISIONS ? opening.provisions() : 0.0;
            if (driverId.isEmpty()) {
                values.put(line, fallback);
                continue;
            }
            var value = table.get(driverId.get(), year);
            if (value.isPresent()) {
                values.put(line, value.getAsDouble());
            } else {
                warnings.add("No value for " + line + " (driver " + driverId.get() + ") in " + year
                        + "; using " + fallback);
                values.put(line, fallback);
            }
        }
        return new StatementInputs(
                values.get(StatementLine.REVENUE),
                values.get(StatementLine.STAFF_COSTS),
                values.get(StatementLine.RENT),
                values.get(StatementLine.OTHER_OPEX),
                values.get(StatementLine.DEPRECIATION),
                values.get(StatementLine.CAPEX),
                values.get(StatementLine.FINANCING),
                values.get(StatementLine.TAXES),
                values.get(StatementLine.PROVISIONS));
    }
}
