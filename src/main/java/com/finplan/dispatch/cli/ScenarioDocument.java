package com.finplan.dispatch.cli;

import com.finplan.core.config.EngineProperties;
import com.finplan.core.convergence.CashEngineConfig;
import com.finplan.core.convergence.ConvergenceCheck;
import com.finplan.core.convergence.StatementBindings;
import com.finplan.core.convergence.StatementLine;
import com.finplan.core.curriculum.CurriculumPlan;
import com.finplan.core.engine.ProjectionRequest;
import com.finplan.core.forecast.GrowthPlan;
import com.finplan.core.model.Driver;
import com.finplan.core.model.DriverValue;
import com.finplan.core.model.YearRange;
import com.finplan.core.rent.RentModel;
import com.finplan.core.rent.RentModelType;
import com.finplan.core.rent.RentSchedule;
import com.finplan.core.statements.OpeningBalances;
import com.finplan.core.statements.StatementConfig;

import java.util.List;
import java.util.Map;

/**
 * JSON scenario file read by the CLI. Sections left out fall back to the configured defaults.
 *
 * @param scenarioId optional scenario identifier
 * @param years      years to project
 * @param drivers    driver catalog
 * @param values     seed values
 * @param statements working-capital assumptions
 * @param cashEngine iteration settings
 * @param bindings   statement line to driver id
 * @param opening    opening balances of the first forecast year
 * @param curricula  optional curriculum plan
 * @param growth     optional driver growth plans
 * @param rent       optional rent model
 */
public record ScenarioDocument(
    String scenarioId,
    YearRange years,
    List<Driver> drivers,
    List<DriverValue> values,
    StatementsSection statements,
    CashEngineSection cashEngine,
    Map<StatementLine, String> bindings,
    OpeningBalances opening,
    CurriculumPlan curricula,
    List<GrowthPlan> growth,
    RentSection rent
) {

    public record StatementsSection(Double dsoDays, Double dpoDays, Double deferredRevenuePct) {}

    public record CashEngineSection(Integer maxIterations, Double tolerance, ConvergenceCheck convergenceCheck,
                                    Double depositRate, Double overdraftRate) {}

    /**
     * Flat rent section; {@code type} selects which of the model fields apply. Absent amounts are read as
     * 0 and absent frequencies as 1, so model validation reports what is missing.
     */
    public record RentSection(RentModelType type, Integer baseYear, String rentDriverId, String revenueDriverId,
                              Double baseRent, Double escalationRate, Integer escalationFrequency,
                              Double revenueSharePct, Double minimumRent, Double maximumRent,
                              Double landSize, Double landPricePerSqm, Double buaSize, Double buaPricePerSqm,
                              Double yieldBasePct, Double yieldGrowthRate, Integer growthFrequency) {

        RentSchedule toSchedule(int defaultBaseYear) {
            if (type == null) {
                throw new IllegalArgumentException("Rent section has no 'type'");
            }
            RentModel model = switch (type) {
                case FIXED_ESCALATION -> new RentModel.FixedEscalation(amount(baseRent), amount(escalationRate),
                        frequency(escalationFrequency));
                case REVENUE_SHARE -> new RentModel.RevenueShare(amount(revenueSharePct), minimumRent, maximumRent);
                case PARTNER -> new RentModel.Partner(amount(landSize), amount(landPricePerSqm), amount(buaSize),
                        amount(buaPricePerSqm), amount(yieldBasePct), amount(yieldGrowthRate),
                        frequency(growthFrequency));
            };
            return new RentSchedule(model, baseYear != null ? baseYear : defaultBaseYear,
                    rentDriverId != null ? rentDriverId : "rent", revenueDriverId);
        }

        private static double amount(Double value) {
            return value != null ? value : 0.0;
        }

        private static int frequency(Integer value) {
            return value != null ? value : 1;
        }
    }

    public ProjectionRequest toRequest(EngineProperties defaults) {
        if (years == null) {
            throw new IllegalArgumentException("Scenario document has no 'years' section");
        }
        return new ProjectionRequest(scenarioId, drivers, values, years,
                statementConfig(defaults.toStatementConfig()),
                cashEngineConfig(defaults.toCashEngineConfig()),
                bindings == null ? StatementBindings.builder().build() : StatementBindings.of(bindings),
                opening, curricula, growth, rent == null ? null : rent.toSchedule(years.start()));
    }

    StatementConfig statementConfig(StatementConfig base) {
        if (statements == null) {
            return base;
        }
        return new StatementConfig(
                statements.dsoDays() != null ? statements.dsoDays() : base.dsoDays(),
                statements.dpoDays() != null ? statements.dpoDays() : base.dpoDays(),
                statements.deferredRevenuePct() != null ? statements.deferredRevenuePct() : base.deferredRevenuePct());
    }

    CashEngineConfig cashEngineConfig(CashEngineConfig base) {
        if (cashEngine == null) {
            return base;
        }
        return new CashEngineConfig(
                cashEngine.maxIterations() != null ? cashEngine.maxIterations() : base.maxIterations(),
                cashEngine.tolerance() != null ? cashEngine.tolerance() : base.tolerance(),
                cashEngine.convergenceCheck() != null ? cashEngine.convergenceCheck() : base.convergenceCheck(),
                cashEngine.depositRate() != null ? cashEngine.depositRate() : base.depositRate(),
                cashEngine.overdraftRate() != null ? cashEngine.overdraftRate() : base.overdraftRate());
    }
}
