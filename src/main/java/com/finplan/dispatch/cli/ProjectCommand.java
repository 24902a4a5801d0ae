package com.finplan.dispatch.cli;

import com.finplan.core.config.EngineProperties;
import com.finplan.core.convergence.ConvergenceCheck;
import com.finplan.core.convergence.ConvergenceState;
import com.finplan.core.engine.ProjectionEngine;
import com.finplan.core.engine.ProjectionOutcome;
import com.finplan.core.model.ProjectionException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: finplan project &lt;scenario.json&gt;
 * <p>
 * Projects the scenario and prints each year's statements and convergence diagnostics.
 */
@Command(name = "project", mixinStandardHelpOptions = true, description = "Project a scenario file")
@Component
public class ProjectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Scenario JSON file")
    private Path scenarioFile;

    @Option(names = {"--check", "-c"},
            description = "Convergence check override: BALANCE_SHEET, CASH_STABILITY, BALANCE_AND_CASH")
    private String check;

    @Option(names = {"--max-iterations"}, description = "Iterations allowed per year")
    private Integer maxIterations;

    private final ProjectionEngine engine;
    private final ScenarioLoader loader;
    private final EngineProperties properties;

    public ProjectCommand(ProjectionEngine engine, ScenarioLoader loader, EngineProperties properties) {
        this.engine = engine;
        this.loader = loader;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ProjectionOutcome outcome;
        try {
            var request = loader.load(scenarioFile).toRequest(properties);
            var cashEngine = request.cashEngine();
            if (check != null) {
                cashEngine = cashEngine.withConvergenceCheck(
                        ConvergenceCheck.valueOf(check.toUpperCase()));
            }
            if (maxIterations != null) {
                cashEngine = cashEngine.withMaxIterations(maxIterations);
            }
            request = request.withCashEngine(cashEngine);
            ConsoleOutput.info("Projecting " + scenarioFile.getFileName() + " over "
                    + request.range().start() + ".." + request.range().end());
            outcome = engine.run(request);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read scenario: " + e.getMessage());
            return FinplanCommand.EXIT_FAILED;
        } catch (ProjectionException | IllegalArgumentException e) {
            ConsoleOutput.error("Projection failed: " + e.getMessage());
            return FinplanCommand.EXIT_FAILED;
        }

        System.out.println();
        ConsoleOutput.info("Scenario " + outcome.scenarioId() + ": evaluation order "
                + String.join(", ", outcome.evaluationOrder()));
        ConsoleOutput.info(outcome.written().size() + " values calculated");
        if (!outcome.failures().isEmpty()) {
            ConsoleOutput.error("Evaluation failures (" + outcome.failures().size() + "):");
            outcome.failures().forEach(ConsoleOutput::failure);
        }
        System.out.println();
        outcome.engineResult().years().forEach(ConsoleOutput::year);

        System.out.println("──────────────────────────────────");
        var result = outcome.engineResult();
        if (outcome.failedYears() > 0 || outcome.exhaustedYears() > 0) {
            ConsoleOutput.error(String.format("%d of %d years converged (%d exhausted, %d failed), %d iterations",
                    result.countIn(ConvergenceState.CONVERGED),
                    result.yearsProcessed(), outcome.exhaustedYears(), outcome.failedYears(),
                    result.totalIterations()));
            return FinplanCommand.EXIT_INCOMPLETE;
        }
        ConsoleOutput.success(String.format("All %d years converged, %d iterations",
                result.yearsProcessed(), result.totalIterations()));
        return 0;
    }
}
