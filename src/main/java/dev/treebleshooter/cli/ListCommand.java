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

@Command(name = "list", mixinStandardHelpOptions = true,
    description = "List the guide files in a directory with their status.")
class ListCommand extends GuideCommand {

    @Parameters(index = "0", arity = "0..1", defaultValue = "data/guides",
        description = "Directory to scan (default: ${DEFAULT-VALUE})")
    Path directory;

    @Override
    int run(GuideLimits limits) throws IOException {
        List<Path> files = GuideLoader.listGuideFiles(directory);
        if (files.isEmpty()) {
            out().println("No guides found in " + directory);
            return 0;
        }
        int unreadable = 0;
        for (Path file : files) {
            String name = file.getFileName().toString();
            try {
                Guide guide = GuideLoader.loadFromFile(file);
                boolean valid = !ValidationFinding.hasErrors(GuideValidator.validate(guide, limits));
                out().printf("  %-30s %-40s %3d nodes  %s%n", name, guide.metadata().title(),
                    guide.nodes().size(), valid ? "ok" : "INVALID");
            } catch (IOException e) {
                unreadable++;
                out().printf("  %-30s unreadable: %s%n", name, e.getMessage());
            }
        }
        return unreadable > 0 ? 1 : 0;
    }
}
