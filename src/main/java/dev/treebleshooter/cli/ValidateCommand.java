package dev.treebleshooter.cli;

import dev.treebleshooter.engine.GuideLoader;
import dev.treebleshooter.engine.GuideValidator;
import dev.treebleshooter.engine.ValidationFinding;
import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideLimits;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Command(name = "validate", mixinStandardHelpOptions = true,
    description = "Check a guide for structural problems. Exits with 1 if any error is found.")
class ValidateCommand extends GuideCommand {

    @Parameters(index = "0", description = "Guide file (.tsg)")
    Path file;

    @Override
    int run(GuideLimits limits) throws IOException {
        Guide guide = GuideLoader.loadFromFile(file);
        List<ValidationFinding> findings = GuideValidator.validate(guide, limits);
        int errors = ValidationFinding.errors(findings).size();

        out().printf("%s: %d error(s), %d warning(s)%n", guide.metadata().title(), errors, findings.size() - errors);
        printFindings(findings);
        return errors > 0 ? 1 : 0;
    }
}
