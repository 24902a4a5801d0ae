package com.finplan.dispatch.cli;

import com.finplan.core.config.EngineProperties;
import com.finplan.core.convergence.ConvergenceEngine;
import com.finplan.core.curriculum.CurriculumCalculator;
import com.finplan.core.engine.ProjectionEngine;
import com.finplan.core.events.EventBus;
import com.finplan.core.forecast.GrowthExtrapolator;
import com.finplan.core.formula.FormulaEvaluator;
import com.finplan.core.metrics.FinplanMetrics;
import com.finplan.core.projection.DriverProjectionPipeline;
import com.finplan.core.rent.RentCalculator;
import com.finplan.core.scheduler.DependencyResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Finplan CLI command structure.
 * These tests exercise picocli directly without a Spring context, wiring the real engine services
 * and running scenario files written to a temporary directory.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private Path schoolScenario;

    @BeforeEach
    void setUp() throws IOException {
        schoolScenario = tempDir.resolve("school.json");
        try (InputStream in = getClass().getResourceAsStream("/scenarios/school.json")) {
            Files.copy(in, schoolScenario);
        }
    }

    /**
     * Custom picocli IFactory that builds commands from real, Spring-free services.
     */
    private CommandLine.IFactory createFactory() {
        var properties = new EngineProperties();
        var loader = new ScenarioLoader();
        var resolver = new DependencyResolver();
        var engine = new ProjectionEngine(resolver, new DriverProjectionPipeline(new FormulaEvaluator()),
                new ConvergenceEngine(), new CurriculumCalculator(), new GrowthExtrapolator(), new RentCalculator(),
                new EventBus(), new FinplanMetrics(new SimpleMeterRegistry()), properties);
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ProjectCommand.class) {
                    return (K) new ProjectCommand(engine, loader, properties);
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(resolver, loader, properties);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new FinplanCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path writeScenario(String name, String json) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    private Path schoolScenarioWith(String from, String to) throws IOException {
        String json = Files.readString(schoolScenario, StandardCharsets.UTF_8);
        assertTrue(json.contains(from), "fixture does not contain " + from);
        return writeScenario("variant.json", json.replace(from, to));
    }

    // ── Help output ──

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists the subcommands")
        void helpListsSubcommands() {
            var result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("project"));
            assertTrue(result.output().contains("validate"));
        }

        @Test
        @DisplayName("no arguments prints the banner and usage")
        void noArguments() {
            var result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("FINPLAN"));
            assertTrue(result.output().contains("Usage"));
        }
    }

    // ── project ──

    @Nested
    @DisplayName("project command")
    class ProjectTests {

        @Test
        @DisplayName("a balanced scenario converges and exits 0")
        void converges() {
            var result = execute("project", schoolScenario.toString());

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("[2025]"));
            assertTrue(result.output().contains("[2026]"));
            assertTrue(result.output().contains("All 2 years converged"));
            assertTrue(result.output().contains("students, tuition"), result.output());
        }

        @Test
        @DisplayName("an imbalanced opening position exhausts the budget and exits 2")
        void exhausted() throws IOException {
            var file = schoolScenarioWith("\"cash\": 1000", "\"cash\": 1005");

            var result = execute("project", file.toString());

            assertEquals(FinplanCommand.EXIT_INCOMPLETE, result.exitCode(), result.output());
            assertTrue(result.output().contains("EXHAUSTED"));
        }

        @Test
        @DisplayName("--check and --max-iterations override the scenario settings")
        void overrides() {
            var result = execute("project", "--check", "cash_stability", "--max-iterations", "10",
                    schoolScenario.toString());

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("iterations"));
        }

        @Test
        @DisplayName("curriculum, growth and rent sections feed the projected drivers")
        void plannedScenario() throws IOException {
            var file = tempDir.resolve("campus.json");
            try (InputStream in = getClass().getResourceAsStream("/scenarios/campus.json")) {
                Files.copy(in, file);
            }

            var result = execute("project", file.toString());

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("8 values calculated"), result.output());
            assertTrue(result.output().contains("All 2 years converged"), result.output());
        }

        @Test
        @DisplayName("a cyclic driver graph exits 1")
        void cyclic() throws IOException {
            var file = writeScenario("cycle.json", """
                    {
                      "years": { "start": 2025, "end": 2026 },
                      "drivers": [
                        { "id": "a", "name": "A", "formula": "B + 1", "dependencies": ["b"] },
                        { "id": "b", "name": "B", "formula": "A + 1", "dependencies": ["a"] }
                      ]
                    }
                    """);

            var result = execute("project", file.toString());

            assertEquals(FinplanCommand.EXIT_FAILED, result.exitCode());
            assertTrue(result.output().contains("Circular dependency detected"), result.output());
        }

        @Test
        @DisplayName("a missing file exits 1")
        void missingFile() {
            var result = execute("project", tempDir.resolve("nope.json").toString());
            assertEquals(FinplanCommand.EXIT_FAILED, result.exitCode());
            assertTrue(result.output().contains("Cannot read scenario"));
        }
    }

    // ── validate ──

    @Nested
    @DisplayName("validate command")
    class ValidateTests {

        @Test
        @DisplayName("a valid scenario exits 0")
        void valid() {
            var result = execute("validate", schoolScenario.toString());
            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("Driver graph resolves: 6 drivers"));
            assertTrue(result.output().contains("Scenario is valid"));
        }

        @Test
        @DisplayName("out-of-range working capital settings are reported")
        void invalidStatements() throws IOException {
            var file = schoolScenarioWith("\"dsoDays\": 20", "\"dsoDays\": 400");

            var result = execute("validate", file.toString());

            assertEquals(FinplanCommand.EXIT_FAILED, result.exitCode());
            assertTrue(result.output().contains("DSO days must be between 0 and 365"));
        }

        @Test
        @DisplayName("an invalid rent section is reported")
        void invalidRent() throws IOException {
            var file = schoolScenarioWith("\"opening\"",
                    "\"rent\": { \"type\": \"REVENUE_SHARE\", \"revenueSharePct\": 150 },\n  \"opening\"");

            var result = execute("validate", file.toString());

            assertEquals(FinplanCommand.EXIT_FAILED, result.exitCode());
            assertTrue(result.output().contains("Rent: Revenue share percentage must be between 0 and 100"),
                    result.output());
        }

        @Test
        @DisplayName("years outside the domain are reported")
        void outOfDomain() throws IOException {
            var file = schoolScenarioWith("\"end\": 2026", "\"end\": 2060");

            var result = execute("validate", file.toString());

            assertEquals(FinplanCommand.EXIT_FAILED, result.exitCode());
            assertTrue(result.output().contains("outside domain"));
        }
    }
}
