package dev.treebleshooter.cli;

import dev.treebleshooter.model.GuideLimits;
import picocli.CommandLine.Option;

/**
 * Command-line overrides for {@link GuideLimits}.
 */
public class LimitOptions {

    @Option(names = "--max-depth", defaultValue = "" + GuideLimits.DEFAULT_MAX_TREE_DEPTH,
        description = "Warn when a path from the root visits more nodes than this (default: ${DEFAULT-VALUE})")
    int maxDepth;

    @Option(names = "--max-answers", defaultValue = "" + GuideLimits.DEFAULT_MAX_ANSWERS_PER_NODE,
        description = "Warn when a node has more answers than this (default: ${DEFAULT-VALUE})")
    int maxAnswers;

    @Option(names = "--min-answers", defaultValue = "" + GuideLimits.DEFAULT_MIN_ANSWERS_PER_NODE,
        description = "Warn when a node has fewer answers than this (default: ${DEFAULT-VALUE})")
    int minAnswers;

    @Option(names = "--max-history", defaultValue = "" + GuideLimits.DEFAULT_MAX_HISTORY_LENGTH,
        description = "Abort a walk or path enumeration longer than this (default: ${DEFAULT-VALUE})")
    int maxHistory;

    GuideLimits toLimits() {
        return new GuideLimits(maxDepth, maxAnswers, minAnswers, maxHistory);
    }
}
