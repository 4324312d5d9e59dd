package dev.treebleshooter.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI entry point for treebleshooter.
 */
@Command(
    name = "treebleshooter",
    mixinStandardHelpOptions = true,
    version = "treebleshooter 1.0.0",
    description = "Build, check and walk through branching troubleshooting guides.",
    subcommands = {
        ValidateCommand.class,
        StatsCommand.class,
        RunCommand.class,
        ExportCommand.class,
        ListCommand.class,
        CatalogCommand.class
    }
)
public class TreebleshooterCli implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    /** A command line configured the way {@code Main} runs it. */
    public static CommandLine commandLine() {
        return new CommandLine(new TreebleshooterCli())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        spec.commandLine().getErr().println("Error: a command is required.");
        spec.commandLine().usage(spec.commandLine().getErr());
        return 1;
    }
}
