package com.finplan.core.engine;

import com.finplan.core.config.EngineProperties;
import com.finplan.core.convergence.ConvergenceEngine;
import com.finplan.core.convergence.EngineRunResult;
import com.finplan.core.convergence.YearResult;
import com.finplan.core.curriculum.CurriculumCalculator;
import com.finplan.core.events.EventBus;
import com.finplan.core.events.FinplanEvent;
import com.finplan.core.forecast.GrowthExtrapolator;
import com.finplan.core.forecast.GrowthPlan;
import com.finplan.core.logging.MdcContext;
import com.finplan.core.metrics.FinplanMetrics;
import com.finplan.core.model.Driver;
import com.finplan.core.model.DriverValue;
import com.finplan.core.model.ProjectionException;
import com.finplan.core.model.ValueTable;
import com.finplan.core.model.YearDomain;
import com.finplan.core.model.YearRange;
import com.finplan.core.projection.DriverProjectionPipeline;
import com.finplan.core.projection.ProjectionResult;
import com.finplan.core.rent.RentCalculator;
import com.finplan.core.scheduler.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one scenario end to end: resolve the driver graph, fill the seed from the curriculum, growth and
 * rent plans, project driver values, then derive and converge the statements year by year.
 * <p>
 * A cyclic graph or an invalid plan fails the whole run before any value is produced. Evaluation failures and
 * non-converged years are reported in the outcome and never abort the run.
 */
@Service
public class ProjectionEngine {

    private static final Logger log = LoggerFactory.getLogger(ProjectionEngine.class);
    private static final AtomicInteger SCENARIO_COUNTER = new AtomicInteger(0);

    private final DependencyResolver resolver;
    private final DriverProjectionPipeline pipeline;
    private final ConvergenceEngine convergenceEngine;
    private final CurriculumCalculator curriculumCalculator;
    private final GrowthExtrapolator growthExtrapolator;
    private final RentCalculator rentCalculator;
    private final EventBus eventBus;
    private final FinplanMetrics metrics;
    private final YearDomain domain;

    public ProjectionEngine(DependencyResolver resolver, DriverProjectionPipeline pipeline,
                            ConvergenceEngine convergenceEngine, CurriculumCalculator curriculumCalculator,
                            GrowthExtrapolator growthExtrapolator, RentCalculator rentCalculator,
                            EventBus eventBus, FinplanMetrics metrics, EngineProperties properties) {
        this.resolver = resolver;
        this.pipeline = pipeline;
        this.convergenceEngine = convergenceEngine;
        this.curriculumCalculator = curriculumCalculator;
        this.growthExtrapolator = growthExtrapolator;
        this.rentCalculator = rentCalculator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.domain = properties.toYearDomain();
    }

    /**
     * @throws IllegalArgumentException                             if the range lies outside the year domain
     * @throws com.finplan.core.scheduler.CyclicDependencyException if the driver graph has a cycle
     * @throws ProjectionException                                  if a curriculum, growth or rent plan is invalid
     */
    public ProjectionOutcome run(ProjectionRequest request) {
        String scenarioId = request.scenarioId() != null ? request.scenarioId() : generateScenarioId();
        long start = System.currentTimeMillis();
        MdcContext.setScenario(scenarioId);
        try {
            log.info("Starting projection of scenario {}: {} drivers, {} seed values, years {}..{}, check={}",
                    scenarioId, request.drivers().size(), request.seedValues().size(),
                    request.range().start(), request.range().end(), request.cashEngine().convergenceCheck());
            eventBus.publish(FinplanEvent.of(FinplanEvent.PROJECTION_STARTED, scenarioId, null, Map.of(
                    "drivers", request.drivers().size(),
                    "startYear", request.range().start(),
                    "endYear", request.range().end())));

            List<Driver> order;
            ValueTable seed = new ValueTable(request.seedValues());
            var prepared = new ArrayList<DriverValue>();
            try {
                domain.requireWithin(request.range());
                order = resolver.resolve(request.drivers());
                prepared.addAll(prepareSeed(request, seed));
            } catch (ProjectionException | IllegalArgumentException e) {
                log.error("Projection of scenario {} failed: {}", scenarioId, e.getMessage());
                metrics.recordRunResult("failed");
                eventBus.publish(FinplanEvent.of(FinplanEvent.PROJECTION_FAILED, scenarioId, null,
                        Map.of("error", String.valueOf(e.getMessage()))));
                throw e;
            }

            ProjectionResult projected = pipeline.project(order, request.range(), seed, domain);
            projected.failures().forEach(f -> metrics.recordEvaluationFailure(f.kind().name()));
            var written = new ArrayList<>(prepared);
            written.addAll(projected.written());
            metrics.recordValuesWritten(written.size());

            EngineRunResult engineResult = convergenceEngine.run(projected.table(), request.range(), domain,
                    request.bindings(), request.opening(), request.statementConfig(), request.cashEngine());
            for (YearResult year : engineResult.years()) {
                metrics.recordYearOutcome(year.state().name());
                metrics.recordIterations(year.convergence().iterations());
                eventBus.publish(FinplanEvent.of(FinplanEvent.YEAR_SOLVED, scenarioId, year.year(),
                        yearPayload(year)));
            }

            var outcome = new ProjectionOutcome(scenarioId, order.stream().map(Driver::id).toList(),
                    projected.table(), written, projected.failures(), engineResult);
            String status = outcome.hasIssues() ? "completed_with_issues" : "completed";
            metrics.recordRunResult(status);
            metrics.recordRunDuration(System.currentTimeMillis() - start);
            eventBus.publish(FinplanEvent.of(FinplanEvent.PROJECTION_COMPLETED, scenarioId, null, Map.of(
                    "status", status,
                    "allConverged", engineResult.allConverged(),
                    "yearsProcessed", engineResult.yearsProcessed(),
                    "totalIterations", engineResult.totalIterations(),
                    "evaluationFailures", projected.failures().size())));
            log.info("Projection of scenario {} {}: {} values written, {} failures, {} years, {} iterations",
                    scenarioId, status, written.size(), projected.failures().size(),
                    engineResult.yearsProcessed(), engineResult.totalIterations());
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Writes curriculum totals, then growth forecasts, then rent into the seed table. Rent comes last so
     * a revenue share model reads the revenue the earlier plans produced.
     */
    private List<DriverValue> prepareSeed(ProjectionRequest request, ValueTable seed) {
        var written = new ArrayList<DriverValue>();
        if (request.curricula() != null) {
            var aggregates = curriculumCalculator.project(request.curricula(), domain);
            written.addAll(curriculumCalculator.writeTo(request.curricula(), aggregates, seed, domain));
        }
        for (GrowthPlan plan : request.growth()) {
            if (plan.baseYear() >= request.range().end()) {
                log.warn("Growth base year {} of {} leaves no year to extrapolate", plan.baseYear(), plan.driverId());
                continue;
            }
            var years = YearRange.of(plan.baseYear() + 1, request.range().end());
            var forecast = growthExtrapolator.extrapolate(plan.driverId(), plan.baseYear(), years,
                    plan.assumption(), seed);
            written.addAll(growthExtrapolator.writeTo(plan.driverId(), forecast, seed, domain));
        }
        var forecastYears = domain.forecastPart(request.range());
        if (request.rent() != null && forecastYears.isPresent()) {
            var rent = request.rent();
            var projections = rentCalculator.project(rent.model(), forecastYears.get(), rent.baseYear(), seed,
                    rent.revenueDriverId());
            written.addAll(rentCalculator.writeTo(rent.rentDriverId(), projections, seed, domain));
        }
        return written;
    }

    public YearDomain domain() {
        return domain;
    }

    /**
     * Generates a scenario ID in the format SCN-YYYY-NNNN.
     */
    public String generateScenarioId() {
        int count = SCENARIO_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("SCN-%d-%04d", year, count);
    }

    private static Map<String, Object> yearPayload(YearResult year) {
        var payload = new HashMap<String, Object>();
        payload.put("state", year.state().name());
        payload.put("iterations", year.convergence().iterations());
        payload.put("residual", year.convergence().residual());
        if (year.convergence().lastError() != null) {
            payload.put("error", year.convergence().lastError());
        }
        if (!year.warnings().isEmpty()) {
            payload.put("warnings", year.warnings());
        }
        return payload;
    }
}
