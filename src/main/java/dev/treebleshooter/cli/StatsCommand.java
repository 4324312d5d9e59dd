package dev.treebleshooter.cli;

import dev.treebleshooter.engine.GuideAnalyzer;
import dev.treebleshooter.engine.GuideLoader;
import dev.treebleshooter.engine.GuideStatistics;
import dev.treebleshooter.engine.GuideValidator;
import dev.treebleshooter.engine.ValidationFinding;
import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideLimits;
import dev.treebleshooter.model.Node;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

@Command(name = "stats", mixinStandardHelpOptions = true,
    description = "Print path and size statistics for a valid guide.")
class StatsCommand extends GuideCommand {

    @Parameters(index = "0", description = "Guide file (.tsg)")
    Path file;

    @Option(names = "--paths", description = "Also list every path from the root to a solution")
    boolean showPaths;

    @Override
    int run(GuideLimits limits) throws IOException {
        Guide guide = GuideLoader.loadFromFile(file);
        List<ValidationFinding> findings = GuideValidator.validate(guide, limits);
        if (ValidationFinding.hasErrors(findings)) {
            err().println("Guide has validation errors; fix them before computing statistics:");
            ValidationFinding.errors(findings).forEach(f -> err().println("  " + f));
            return 1;
        }

        GuideStatistics stats = GuideAnalyzer.statistics(guide, limits);
        out().println(guide.metadata().title());
        out().printf("  Nodes:               %d%n", stats.nodeCount());
        out().printf("  Solutions:           %d%n", stats.solutionCount());
        out().printf("  Paths:               %d%n", stats.pathCount());
        out().printf("  Shortest path:       %d%n", stats.minDepth());
        out().printf("  Longest path:        %d%n", stats.maxDepth());
        out().printf("  Average path length: %.2f%n", stats.averagePathLength());

        if (showPaths) {
            List<List<String>> paths = GuideAnalyzer.allPaths(guide, limits);
            for (int i = 0; i < paths.size(); i++) {
                String rendered = paths.get(i).stream()
                    .map(id -> guide.node(id).map(Node::question).orElse(id))
                    .collect(Collectors.joining(" -> "));
                out().printf("  %d. %s%n", i + 1, rendered);
            }
        }
        return 0;
    }
}
