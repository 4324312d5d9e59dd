package dev.treebleshooter.model;

/**
 * Soft and hard limits applied when validating and running a guide.
 * Depth and fan-out limits only produce warnings; {@code maxHistoryLength}
 * is a hard ceiling for navigation and path enumeration.
 */
public record GuideLimits(
    int maxTreeDepth,
    int maxAnswersPerNode,
    int minAnswersPerNode,
    int maxHistoryLength
) {
    public static final int DEFAULT_MAX_TREE_DEPTH = 20;
    public static final int DEFAULT_MAX_ANSWERS_PER_NODE = 10;
    public static final int DEFAULT_MIN_ANSWERS_PER_NODE = 2;
    public static final int DEFAULT_MAX_HISTORY_LENGTH = 100;

    public GuideLimits {
        if (maxTreeDepth < 1 || maxAnswersPerNode < 1 || minAnswersPerNode < 1 || maxHistoryLength < 1) {
            throw new IllegalArgumentException("Guide limits must be positive: maxTreeDepth=%d, maxAnswersPerNode=%d, minAnswersPerNode=%d, maxHistoryLength=%d"
                .formatted(maxTreeDepth, maxAnswersPerNode, minAnswersPerNode, maxHistoryLength));
        }
    }

    public static GuideLimits defaults() {
        return new GuideLimits(DEFAULT_MAX_TREE_DEPTH, DEFAULT_MAX_ANSWERS_PER_NODE,
            DEFAULT_MIN_ANSWERS_PER_NODE, DEFAULT_MAX_HISTORY_LENGTH);
    }
}
