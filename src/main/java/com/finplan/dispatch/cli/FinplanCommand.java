package com.finplan.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Finplan.
 * Routes to subcommands: project, validate.
 */
@Command(
        name = "finplan",
        mixinStandardHelpOptions = true,
        version = "Finplan 0.1.0",
        description = "Financial projection engine: driver formulas, statements and cash convergence",
        subcommands = {
                ProjectCommand.class,
                ValidateCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FinplanCommand implements Runnable {

    /** Run failed before producing results. */
    public static final int EXIT_FAILED = 1;
    /** Run completed but some years failed or did not converge. */
    public static final int EXIT_INCOMPLETE = 2;

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
