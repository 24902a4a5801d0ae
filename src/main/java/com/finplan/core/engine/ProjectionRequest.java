package com.finplan.core.engine;

import com.finplan.core.convergence.CashEngineConfig;
import com.finplan.core.convergence.StatementBindings;
import com.finplan.core.curriculum.CurriculumPlan;
import com.finplan.core.forecast.GrowthPlan;
import com.finplan.core.model.Driver;
import com.finplan.core.model.DriverValue;
import com.finplan.core.model.YearRange;
import com.finplan.core.rent.RentSchedule;
import com.finplan.core.statements.OpeningBalances;
import com.finplan.core.statements.StatementConfig;

import java.util.List;

/**
 * Everything needed to project one scenario.
 *
 * @param scenarioId      scenario identifier, {@code null} to have one generated
 * @param drivers         all drivers of the scenario
 * @param seedValues      historical, manual, imported and adjusted values
 * @param range           years to project
 * @param statementConfig working-capital assumptions
 * @param cashEngine      iteration settings
 * @param bindings        statement line to driver mapping
 * @param opening         position at the start of the first forecast year
 * @param curricula       optional curriculum plan feeding revenue and staff cost drivers
 * @param growth          drivers extrapolated from a base-year value
 * @param rent            optional rent model feeding the rent driver
 */
public record ProjectionRequest(
    String scenarioId,
    List<Driver> drivers,
    List<DriverValue> seedValues,
    YearRange range,
    StatementConfig statementConfig,
    CashEngineConfig cashEngine,
    StatementBindings bindings,
    OpeningBalances opening,
    CurriculumPlan curricula,
    List<GrowthPlan> growth,
    RentSchedule rent
) {

    public ProjectionRequest {
        drivers = drivers == null ? List.of() : List.copyOf(drivers);
        seedValues = seedValues == null ? List.of() : List.copyOf(seedValues);
        if (range == null) {
            throw new IllegalArgumentException("Year range is required");
        }
        statementConfig = statementConfig == null ? StatementConfig.defaults() : statementConfig;
        cashEngine = cashEngine == null ? CashEngineConfig.defaults() : cashEngine;
        bindings = bindings == null ? StatementBindings.builder().build() : bindings;
        opening = opening == null ? OpeningBalances.ZERO : opening;
        growth = growth == null ? List.of() : List.copyOf(growth);
    }

    public ProjectionRequest(String scenarioId, List<Driver> drivers, List<DriverValue> seedValues, YearRange range,
                             StatementConfig statementConfig, CashEngineConfig cashEngine,
                             StatementBindings bindings, OpeningBalances opening) {
        this(scenarioId, drivers, seedValues, range, statementConfig, cashEngine, bindings, opening,
                null, null, null);
    }

    public ProjectionRequest withScenarioId(String id) {
        return new ProjectionRequest(id, drivers, seedValues, range, statementConfig, cashEngine, bindings, opening,
                curricula, growth, rent);
    }

    public ProjectionRequest withCashEngine(CashEngineConfig config) {
        return new ProjectionRequest(scenarioId, drivers, seedValues, range, statementConfig, config, bindings,
                opening, curricula, growth, rent);
    }
}
