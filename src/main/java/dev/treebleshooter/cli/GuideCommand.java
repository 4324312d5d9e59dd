package dev.treebleshooter.cli;

import dev.treebleshooter.engine.GuideFormatException;
import dev.treebleshooter.engine.NavigationException;
import dev.treebleshooter.engine.ValidationFinding;
import dev.treebleshooter.model.GuideLimits;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Shared plumbing for subcommands that operate on a guide: limit options,
 * output streams, and turning failures into one-line messages and exit codes.
 */
abstract class GuideCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    LimitOptions limitOptions;

    @Override
    public Integer call() {
        try {
            return run(limitOptions.toLimits());
        } catch (GuideFormatException e) {
            err().println("Malformed guide file: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err().println("Cannot access file: " + e.getMessage());
            return 1;
        } catch (NavigationException e) {
            err().println("This guide is broken: " + e.getMessage());
            return 1;
        } catch (IllegalStateException e) {
            err().println("Cannot analyze guide: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err().println("Error: " + e.getMessage());
            return 2;
        }
    }

    abstract int run(GuideLimits limits) throws IOException;

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    void printFindings(List<ValidationFinding> findings) {
        findings.forEach(f -> out().println("  " + f));
    }
}
