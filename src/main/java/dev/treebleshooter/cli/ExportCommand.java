package dev.treebleshooter.cli;

import dev.treebleshooter.engine.GuideExporter;
import dev.treebleshooter.engine.GuideLoader;
import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideLimits;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Command(name = "export", mixinStandardHelpOptions = true,
    description = "Render a guide as JSON, Markdown or HTML.")
class ExportCommand extends GuideCommand {

    @Parameters(index = "0", description = "Guide file (.tsg)")
    Path file;

    @Option(names = "--format", defaultValue = "MARKDOWN",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    GuideExporter.Format format;

    @Option(names = {"-o", "--output"}, description = "Write to this file instead of standard output")
    Path output;

    @Override
    int run(GuideLimits limits) throws IOException {
        Guide guide = GuideLoader.loadFromFile(file);
        String rendered = GuideExporter.export(guide, format);
        if (output == null) {
            out().print(rendered);
            out().flush();
        } else {
            Files.writeString(output, rendered, StandardCharsets.UTF_8);
            out().println("Exported '" + guide.metadata().title() + "' to " + output);
        }
        return 0;
    }
}
