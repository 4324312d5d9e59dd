package dev.treebleshooter.cli;

import dev.treebleshooter.engine.GuideNavigator;
import dev.treebleshooter.engine.GuideWorkspace;
import dev.treebleshooter.engine.ValidationFinding;
import dev.treebleshooter.model.GuideLimits;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

@Command(name = "run", mixinStandardHelpOptions = true,
    description = "Walk through a guide interactively.")
class RunCommand extends GuideCommand {

    @Parameters(index = "0", description = "Guide file (.tsg)")
    Path file;

    BufferedReader input = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

    @Override
    int run(GuideLimits limits) throws IOException {
        var workspace = new GuideWorkspace(limits);
        List<ValidationFinding> findings = workspace.open(file);
        if (ValidationFinding.hasErrors(findings)) {
            err().println("Refusing to run a guide with validation errors:");
            ValidationFinding.errors(findings).forEach(f -> err().println("  " + f));
            return 1;
        }

        GuideNavigator navigator = workspace.newNavigator();
        out().println(navigator.guide().orElseThrow().metadata().title());
        new ConsoleSession(input, out()).run(navigator);
        return 0;
    }
}
