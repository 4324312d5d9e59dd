package dev.treebleshooter.engine;

import dev.treebleshooter.model.Answer;
import dev.treebleshooter.model.Guide;
import dev.treebleshooter.model.GuideMetadata;
import dev.treebleshooter.model.Node;

import java.util.HashSet;
import java.util.Set;

/**
 * Renders a guide as a standalone document for people who will not run it interactively.
 */
public final class GuideExporter {

    /** Markdown headings stop nesting below this level. */
    static final int MAX_MARKDOWN_LEVEL = 5;

    public enum Format { JSON, MARKDOWN, HTML }

    private GuideExporter() {}

    public static String export(Guide guide, Format format) {
        return switch (format) {
            case JSON -> GuideSerializer.toJson(guide);
            case MARKDOWN -> toMarkdown(guide);
            case HTML -> toHtml(guide);
        };
    }

    static String toMarkdown(Guide guide) {
        GuideMetadata meta = guide.metadata();
        var sb = new StringBuilder();
        sb.append("# ").append(meta.title()).append("\n\n");
        sb.append(meta.description()).append("\n\n");
        sb.append("**Author:** ").append(meta.author()).append("  \n");
        sb.append("**Difficulty:** ").append(meta.difficultyLevel().label()).append("  \n");
        sb.append("**Estimated Time:** ").append(estimatedTime(meta)).append("\n\n");
        sb.append("## Troubleshooting Steps\n\n");
        guide.rootNode().ifPresent(root -> appendMarkdown(guide, root, 1, sb));
        return sb.toString();
    }

    static String toHtml(Guide guide) {
        GuideMetadata meta = guide.metadata();
        var sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n<html>\n<head>\n");
        sb.append("<title>").append(escape(meta.title())).append("</title>\n");
        sb.append("<meta charset=\"utf-8\">\n");
        sb.append("<style>\n")
          .append("body { font-family: Arial, sans-serif; max-width: 800px; margin: 0 auto; padding: 20px; }\n")
          .append(".metadata { background: #ecf0f1; padding: 10px; border-radius: 5px; }\n")
          .append(".question { background: #3498db; color: white; padding: 10px; margin: 10px 0; border-radius: 5px; }\n")
          .append(".answer { margin-left: 20px; padding: 5px; }\n")
          .append(".solution { background: #2ecc71; color: white; padding: 10px; border-radius: 5px; }\n")
          .append("</style>\n</head>\n<body>\n");
        sb.append("<h1>").append(escape(meta.title())).append("</h1>\n");
        sb.append("<div class=\"metadata\">\n");
        sb.append("<p>").append(escape(meta.description())).append("</p>\n");
        sb.append("<p><strong>Author:</strong> ").append(escape(meta.author())).append("</p>\n");
        sb.append("<p><strong>Difficulty:</strong> ").append(meta.difficultyLevel().label()).append("</p>\n");
        sb.append("<p><strong>Estimated Time:</strong> ").append(estimatedTime(meta)).append("</p>\n");
        sb.append("</div>\n<h2>Troubleshooting Steps</h2>\n");
        guide.rootNode().ifPresent(root -> appendHtml(guide, root, new HashSet<>(), sb));
        sb.append("</body>\n</html>\n");
        return sb.toString();
    }

    private static void appendMarkdown(Guide guide, Node node, int level, StringBuilder sb) {
        sb.append("#".repeat(level + 1)).append(' ').append(node.question()).append("\n\n");
        if (node.helpText() != null && !node.helpText().isBlank()) {
            sb.append('_').append(node.helpText()).append("_\n\n");
        }
        for (Answer answer : node.answers()) {
            sb.append("- **").append(answer.answerText()).append("**");
            if (answer instanceof Answer.Solution solution) {
                sb.append(" → _Solution: ").append(solution.solutionText()).append("_\n");
            } else if (answer instanceof Answer.Route route) {
                sb.append('\n');
                guide.node(route.nextNodeId())
                    .filter(next -> level < MAX_MARKDOWN_LEVEL)
                    .ifPresent(next -> appendMarkdown(guide, next, level + 1, sb));
            }
            sb.append('\n');
        }
    }

    // Each node is rendered once, so shared and cyclic routes terminate.
    private static void appendHtml(Guide guide, Node node, Set<String> visited, StringBuilder sb) {
        if (!visited.add(node.nodeId())) {
            return;
        }
        sb.append("<div class=\"question\">").append(escape(node.question())).append("</div>\n");
        if (node.helpText() != null && !node.helpText().isBlank()) {
            sb.append("<p style=\"font-style: italic;\">").append(escape(node.helpText())).append("</p>\n");
        }
        for (Answer answer : node.answers()) {
            sb.append("<div class=\"answer\">&bull; ").append(escape(answer.answerText()));
            if (answer instanceof Answer.Solution solution) {
                sb.append("<div class=\"solution\">Solution: ").append(escape(solution.solutionText())).append("</div>");
            } else if (answer instanceof Answer.Route route) {
                guide.node(route.nextNodeId()).ifPresent(next -> {
                    sb.append('\n');
                    appendHtml(guide, next, visited, sb);
                });
            }
            sb.append("</div>\n");
        }
    }

    private static String estimatedTime(GuideMetadata meta) {
        return meta.estimatedTimeMinutes() == null ? "not specified" : meta.estimatedTimeMinutes() + " minutes";
    }

    private static String escape(String text) {
        if (text == null) {
            return "";
        }
        var sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
