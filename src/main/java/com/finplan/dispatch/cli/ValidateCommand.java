package com.finplan.dispatch.cli;

import com.finplan.core.config.EngineProperties;
import com.finplan.core.model.ProjectionException;
import com.finplan.core.scheduler.DependencyResolver;
import com.finplan.core.statements.StatementMath;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.concurrent.Callable;

/**
 * CLI command: finplan validate &lt;scenario.json&gt;
 * <p>
 * Resolves the driver graph and checks the configuration without projecting.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a scenario file")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Scenario JSON file")
    private Path scenarioFile;

    private final DependencyResolver resolver;
    private final ScenarioLoader loader;
    private final EngineProperties properties;

    public ValidateCommand(DependencyResolver resolver, ScenarioLoader loader, EngineProperties properties) {
        this.resolver = resolver;
        this.loader = loader;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var request = loader.load(scenarioFile).toRequest(properties);
            var problems = new ArrayList<String>();

            try {
                properties.toYearDomain().requireWithin(request.range());
            } catch (IllegalArgumentException e) {
                problems.add(e.getMessage());
            }
            var statements = request.statementConfig();
            problems.addAll(StatementMath.validateConfig(statements.dsoDays(), statements.dpoDays(),
                    statements.deferredRevenuePct()));
            problems.addAll(StatementMath.validateRates(request.cashEngine().depositRate(),
                    request.cashEngine().overdraftRate()));

            if (request.rent() != null) {
                request.rent().model().validate().forEach(v -> problems.add("Rent: " + v));
            }
            if (request.curricula() != null) {
                var domain = properties.toYearDomain();
                request.curricula().years().forEach(c -> problems.addAll(c.validate(domain)));
            }

            try {
                var order = resolver.resolve(request.drivers());
                ConsoleOutput.success("Driver graph resolves: " + order.size() + " drivers");
            } catch (ProjectionException | IllegalArgumentException e) {
                problems.add(e.getMessage());
            }

            if (problems.isEmpty()) {
                ConsoleOutput.success("Scenario is valid");
                return 0;
            }
            problems.forEach(ConsoleOutput::error);
            return FinplanCommand.EXIT_FAILED;
        } catch (IOException | IllegalArgumentException e) {
            ConsoleOutput.error("Cannot read scenario: " + e.getMessage());
            return FinplanCommand.EXIT_FAILED;
        }
    }
}
